package com.example.formlayout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input field placed in a row. {@code type} is the real field type (NUMBER, DATE, ...),
 * not a layout tag.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Field implements FieldElement {

    private String type;
    private String code;
    private FieldSize size = new FieldSize();

    @Override
    public Field copy() {
        return new Field(type, code, size == null ? new FieldSize() : size.copy());
    }
}
