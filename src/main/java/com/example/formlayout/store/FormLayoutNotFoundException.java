package com.example.formlayout.store;

import lombok.Getter;

@Getter
public class FormLayoutNotFoundException extends RuntimeException {

    private final String appId;

    public FormLayoutNotFoundException(String appId) {
        super("No form layout stored for app " + appId);
        this.appId = appId;
    }
}
