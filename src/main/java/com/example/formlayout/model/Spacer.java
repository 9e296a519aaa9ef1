package com.example.formlayout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Spacer implements FieldElement {

    private String elementId;

    @Override
    public String getType() {
        return LayoutTypes.SPACER;
    }

    @Override
    public Spacer copy() {
        return new Spacer(elementId);
    }
}
