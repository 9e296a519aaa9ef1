package com.example.formlayout.id;

/**
 * Source of default codes and element ids ({@code group_...}, {@code spacer_...}).
 */
public interface IdGenerator {

    /** @return {@code prefix + "_" + suffix}, the suffix unique for this generator */
    String next(String prefix);
}
