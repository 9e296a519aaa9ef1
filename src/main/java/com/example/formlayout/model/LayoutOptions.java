package com.example.formlayout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LayoutOptions {

    /** Wrap every named section into its own group */
    private boolean groupBySection;

    /** Descriptors per row; values below 1 mean 1 */
    private int fieldsPerRow = 1;

    public static LayoutOptions defaults() {
        return new LayoutOptions();
    }

    public int effectiveFieldsPerRow() {
        return Math.max(1, fieldsPerRow);
    }
}
