package com.example.formlayout.builder;

/**
 * A field descriptor that cannot be rendered where it was placed.
 */
public class LayoutBuildException extends IllegalArgumentException {

    public LayoutBuildException(String message) {
        super(message);
    }
}
