package com.example.effectivediff.domain;

/**
 * Tag of a single line inside a hunk.
 */
public enum DiffLineStatus {
    CONTEXT(' '),
    ADDED('+'),
    REMOVED('-');

    private final char prefix;

    DiffLineStatus(char prefix) {
        this.prefix = prefix;
    }

    public char prefix() {
        return prefix;
    }
}
