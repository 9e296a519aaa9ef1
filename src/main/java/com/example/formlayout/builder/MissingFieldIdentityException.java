package com.example.formlayout.builder;

public class MissingFieldIdentityException extends LayoutBuildException {

    public MissingFieldIdentityException(String message) {
        super(message);
    }
}
