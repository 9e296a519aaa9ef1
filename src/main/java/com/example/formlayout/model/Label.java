package com.example.formlayout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Label implements FieldElement {

    private String value;

    @Override
    public String getType() {
        return LayoutTypes.LABEL;
    }

    @Override
    public Label copy() {
        return new Label(value);
    }
}
