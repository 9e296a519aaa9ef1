package com.example.formlayout.parser;

import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.LayoutWarning;

import java.util.List;

/**
 * Repaired document plus the repairs that produced it. No warnings means the input was already valid.
 * Notices name problems that were left in place, such as a field without a code; they repeat on
 * every pass and never fail strict mode.
 */
public record NormalizeResult(List<LayoutNode> layout, List<LayoutWarning> warnings, List<LayoutWarning> notices) {

    public boolean repaired() {
        return !warnings.isEmpty();
    }
}
