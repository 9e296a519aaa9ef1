package com.example.formlayout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Horizontal rule. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Hr implements FieldElement {

    private String elementId;

    @Override
    public String getType() {
        return LayoutTypes.HR;
    }

    @Override
    public Hr copy() {
        return new Hr(elementId);
    }
}
