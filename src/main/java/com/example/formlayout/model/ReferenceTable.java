package com.example.formlayout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceTable implements FieldElement {

    private String code;

    @Override
    public String getType() {
        return LayoutTypes.REFERENCE_TABLE;
    }

    @Override
    public ReferenceTable copy() {
        return new ReferenceTable(code);
    }
}
