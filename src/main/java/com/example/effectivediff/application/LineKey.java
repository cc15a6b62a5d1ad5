package com.example.effectivediff.application;

/**
 * A line position on one side of the diff: old numbering for removed lines, new numbering for
 * added lines.
 */
public record LineKey(String path, int lineNumber) {

    public LineKey next(int delta) {
        return new LineKey(path, lineNumber + delta);
    }
}
