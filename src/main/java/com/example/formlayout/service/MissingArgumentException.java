package com.example.formlayout.service;

import lombok.Getter;

@Getter
public class MissingArgumentException extends IllegalArgumentException {

    private final String argument;

    public MissingArgumentException(String argument) {
        this(argument, argument + " is required");
    }

    public MissingArgumentException(String argument, String message) {
        super(message);
        this.argument = argument;
    }
}
