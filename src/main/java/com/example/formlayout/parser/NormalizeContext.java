package com.example.formlayout.parser;

import com.example.formlayout.model.LayoutWarning;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * State of one normalization pass:
 *  - path    : where the descent currently is, e.g. layout[1].layout[0].fields[2]
 *  - warnings: every repair made so far, in document order
 *  - notices : problems left as they are (no repair possible), not counted as repairs
 */
class NormalizeContext {

    private final Deque<String> path = new ArrayDeque<>();
    private final List<LayoutWarning> warnings = new ArrayList<>();
    private final List<LayoutWarning> notices = new ArrayList<>();

    NormalizeContext(String root) {
        path.addLast(root);
    }

    void enter(String segment) {
        path.addLast(segment);
    }

    void enterIndex(int index) {
        path.addLast("[" + index + "]");
    }

    void exit() {
        path.removeLast();
    }

    String currentPath() {
        return String.join("", path);
    }

    LayoutWarning addWarning(String message) {
        LayoutWarning w = new LayoutWarning(currentPath(), message);
        warnings.add(w);
        return w;
    }

    LayoutWarning addNotice(String message) {
        LayoutWarning n = new LayoutWarning(currentPath(), message);
        notices.add(n);
        return n;
    }

    List<LayoutWarning> notices() {
        return List.copyOf(notices);
    }

    List<LayoutWarning> warnings() {
        return List.copyOf(warnings);
    }

    boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
