package com.example.effectivediff.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One tagged line of a hunk. Context lines carry both line numbers, removed lines only the old
 * one and added lines only the new one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffLine(
        DiffLineStatus status, String content, Integer oldLineNumber, Integer newLineNumber) {

    public DiffLine {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(content, "content");
    }

    public static DiffLine context(String content, int oldLineNumber, int newLineNumber) {
        return new DiffLine(DiffLineStatus.CONTEXT, content, oldLineNumber, newLineNumber);
    }

    public static DiffLine added(String content, int newLineNumber) {
        return new DiffLine(DiffLineStatus.ADDED, content, null, newLineNumber);
    }

    public static DiffLine removed(String content, int oldLineNumber) {
        return new DiffLine(DiffLineStatus.REMOVED, content, oldLineNumber, null);
    }

    @JsonIgnore
    public boolean isChange() {
        return status != DiffLineStatus.CONTEXT;
    }

    /** Whether the line occupies a slot in the old file (context or removed). */
    @JsonIgnore
    public boolean isOldSide() {
        return status != DiffLineStatus.ADDED;
    }

    /** Whether the line occupies a slot in the new file (context or added). */
    @JsonIgnore
    public boolean isNewSide() {
        return status != DiffLineStatus.REMOVED;
    }
}
