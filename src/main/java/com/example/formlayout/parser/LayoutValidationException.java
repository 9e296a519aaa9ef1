package com.example.formlayout.parser;

import com.example.formlayout.model.LayoutWarning;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised instead of repairing when the normalizer runs in strict mode.
 */
@Getter
public class LayoutValidationException extends RuntimeException {

    private final List<LayoutWarning> violations;

    public LayoutValidationException(List<LayoutWarning> violations) {
        super("Layout violates the nesting grammar (" + violations.size() + " problem(s)): "
                + violations.stream().map(LayoutWarning::toString).collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }
}
