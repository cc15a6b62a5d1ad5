package com.example.effectivediff.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Inclusive 1-based line range.
 */
public record LineRange(int start, int end) {

    public LineRange {
        if (start < 1 || end < start) {
            throw new IllegalArgumentException("Invalid line range " + start + ".." + end);
        }
    }

    @JsonIgnore
    public int length() {
        return end - start + 1;
    }

    public boolean contains(int lineNumber) {
        return lineNumber >= start && lineNumber <= end;
    }

    /** Whether the line lies in this range widened by {@code padding} lines on both ends. */
    public boolean containsWithin(int lineNumber, int padding) {
        return lineNumber >= start - padding && lineNumber <= end + padding;
    }
}
