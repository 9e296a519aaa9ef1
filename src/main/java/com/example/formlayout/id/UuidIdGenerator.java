package com.example.formlayout.id;

import java.util.UUID;

public class UuidIdGenerator implements IdGenerator {

    private static final int SUFFIX_LENGTH = 12;

    @Override
    public String next(String prefix) {
        String random = UUID.randomUUID()
                .toString()
                .replace("-", "")
                .substring(0, SUFFIX_LENGTH);
        return prefix + "_" + random;
    }
}
