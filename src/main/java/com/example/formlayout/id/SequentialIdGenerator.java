package com.example.formlayout.id;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counter shared by all prefixes. Deterministic, so tests can predict generated codes.
 */
public class SequentialIdGenerator implements IdGenerator {

    private final AtomicLong seq;

    public SequentialIdGenerator() {
        this(1L);
    }

    public SequentialIdGenerator(long start) {
        this.seq = new AtomicLong(start);
    }

    @Override
    public String next(String prefix) {
        return prefix + "_" + seq.getAndIncrement();
    }
}
