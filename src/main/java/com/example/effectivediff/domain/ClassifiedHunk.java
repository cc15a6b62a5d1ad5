package com.example.effectivediff.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * An original diff hunk with its lines classified, so a reviewer can tell hunks that only
 * relocate code from hunks that carry new code.
 */
public record ClassifiedHunk(String filePath, int oldStart, int newStart, List<ClassifiedDiffLine> lines) {

    public ClassifiedHunk {
        Objects.requireNonNull(lines, "lines");
        lines = List.copyOf(lines);
    }

    /** True when the hunk has changes and every one of them is part of a move. */
    @JsonIgnore
    public boolean isMoved() {
        List<ClassifiedDiffLine> changes =
                lines.stream().filter(line -> line.classification() != LineClassification.CONTEXT).toList();
        return !changes.isEmpty()
                && changes.stream()
                        .allMatch(
                                line ->
                                        line.classification() == LineClassification.MOVED
                                                || line.classification() == LineClassification.MOVED_REMOVAL);
    }

    public boolean hasNewCode() {
        return lines.stream().anyMatch(line -> line.classification() == LineClassification.NEW);
    }

    public boolean hasChangesInMove() {
        return lines.stream().anyMatch(line -> line.classification() == LineClassification.CHANGED_IN_MOVE);
    }

    public List<ClassifiedDiffLine> newCodeLines() {
        return lines.stream().filter(line -> line.classification() == LineClassification.NEW).toList();
    }

    /** New, removed and changed-in-move lines; verbatim moves and context are left out. */
    public List<ClassifiedDiffLine> changedLines() {
        return lines.stream()
                .filter(
                        line ->
                                switch (line.classification()) {
                                    case NEW, REMOVED, CHANGED_IN_MOVE -> true;
                                    default -> false;
                                })
                .toList();
    }
}
