package com.example.formlayout.model;

/**
 * One repair performed by the normalizer.
 *
 * @param path    location in the document, e.g. {@code layout[2].fields[0]}
 * @param message what was repaired
 */
public record LayoutWarning(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
