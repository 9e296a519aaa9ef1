package com.example.formlayout.validation;

import lombok.Getter;

import java.util.Set;

@Getter
public class UnknownFieldCodeException extends IllegalArgumentException {

    private final Set<String> unknownCodes;

    public UnknownFieldCodeException(String appId, Set<String> unknownCodes) {
        super("Layout of app " + appId + " references fields that do not exist on the form: " + unknownCodes);
        this.unknownCodes = Set.copyOf(unknownCodes);
    }
}
