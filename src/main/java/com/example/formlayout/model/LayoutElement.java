package com.example.formlayout.model;

/**
 * Anything that can appear in a layout document.
 */
public interface LayoutElement {

    String getType();

    LayoutElement copy();
}
