package com.example.effectivediff.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Hunks of one changed file pair. {@code oldPath} is null for an added file and {@code newPath}
 * is null for a deleted one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileDiff(String oldPath, String newPath, List<Hunk> hunks) {

    public FileDiff {
        Objects.requireNonNull(hunks, "hunks");
        hunks = List.copyOf(hunks);
    }

    /** Path used for ordering and reporting: the new path unless the file was deleted. */
    @JsonIgnore
    public String path() {
        return newPath != null ? newPath : oldPath;
    }

    @JsonIgnore
    public boolean isAdded() {
        return oldPath == null;
    }

    @JsonIgnore
    public boolean isDeleted() {
        return newPath == null;
    }

    public FileDiff withHunks(List<Hunk> replacement) {
        return new FileDiff(oldPath, newPath, replacement);
    }
}
