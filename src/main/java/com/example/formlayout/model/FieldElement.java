package com.example.formlayout.model;

/**
 * Member of a {@link Row#getFields()} sequence.
 */
public interface FieldElement extends LayoutElement {

    @Override
    FieldElement copy();
}
