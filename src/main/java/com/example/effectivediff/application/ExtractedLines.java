package com.example.effectivediff.application;

import java.util.List;

/**
 * Removed lines (old file, old number) and added lines (new file, new number) of a whole diff, in
 * diff order.
 */
public record ExtractedLines(List<ExtractedLine> removed, List<ExtractedLine> added) {

    public ExtractedLines {
        removed = List.copyOf(removed);
        added = List.copyOf(added);
    }
}
