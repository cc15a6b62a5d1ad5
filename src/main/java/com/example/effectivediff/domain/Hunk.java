package com.example.effectivediff.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * A contiguous region of a unified diff. A side with a line count of zero uses the unified
 * convention: its start is the line after which the change applies.
 */
public record Hunk(
        int oldStart, int oldLineCount, int newStart, int newLineCount, List<DiffLine> lines) {

    public Hunk {
        Objects.requireNonNull(lines, "lines");
        lines = List.copyOf(lines);
    }

    /**
     * Builds a hunk whose header is derived from the line numbers of its lines.
     *
     * @param lines lines in diff order, numbered
     * @param oldAnchor old line after which an old-side-empty hunk applies
     * @param newAnchor new line after which a new-side-empty hunk applies
     */
    public static Hunk of(List<DiffLine> lines, int oldAnchor, int newAnchor) {
        int oldStart = -1;
        int newStart = -1;
        int oldCount = 0;
        int newCount = 0;
        for (DiffLine line : lines) {
            if (line.isOldSide()) {
                if (oldStart < 0) {
                    oldStart = line.oldLineNumber();
                }
                oldCount++;
            }
            if (line.isNewSide()) {
                if (newStart < 0) {
                    newStart = line.newLineNumber();
                }
                newCount++;
            }
        }
        return new Hunk(
                oldCount == 0 ? oldAnchor : oldStart,
                oldCount,
                newCount == 0 ? newAnchor : newStart,
                newCount,
                lines);
    }

    /** First old line covered, or the line after the anchor when the old side is empty. */
    @JsonIgnore
    public int oldFirstLine() {
        return oldLineCount == 0 ? oldStart + 1 : oldStart;
    }

    @JsonIgnore
    public int oldLastLine() {
        return oldFirstLine() + oldLineCount - 1;
    }

    @JsonIgnore
    public int newFirstLine() {
        return newLineCount == 0 ? newStart + 1 : newStart;
    }

    @JsonIgnore
    public int newLastLine() {
        return newFirstLine() + newLineCount - 1;
    }

    @JsonIgnore
    public long changedLineCount() {
        return lines.stream().filter(DiffLine::isChange).count();
    }

    @JsonIgnore
    public String header() {
        return String.format(
                "@@ -%d,%d +%d,%d @@", oldStart, oldLineCount, newStart, newLineCount);
    }
}
