package com.example.formlayout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Pixel sizes as the store expects them: decimal strings, all optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldSize {

    private String width;
    private String height;
    private String innerHeight;

    public boolean isEmpty() {
        return width == null && height == null && innerHeight == null;
    }

    public FieldSize copy() {
        return new FieldSize(width, height, innerHeight);
    }
}
