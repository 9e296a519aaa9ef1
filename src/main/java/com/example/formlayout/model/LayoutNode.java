package com.example.formlayout.model;

/**
 * Element of a top-level sequence or of a {@link Group#getLayout()}: ROW, GROUP or SUBTABLE.
 */
public interface LayoutNode extends LayoutElement {

    @Override
    LayoutNode copy();
}
