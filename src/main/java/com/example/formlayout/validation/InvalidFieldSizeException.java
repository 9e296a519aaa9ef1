package com.example.formlayout.validation;

public class InvalidFieldSizeException extends IllegalArgumentException {

    public InvalidFieldSizeException(String message) {
        super(message);
    }
}
