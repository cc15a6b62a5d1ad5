package com.example.effectivediff.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * A parsed diff: one {@link FileDiff} per changed file pair.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitDiff(String commitHash, List<FileDiff> files) {

    public GitDiff {
        Objects.requireNonNull(files, "files");
        files = List.copyOf(files);
    }

    public static GitDiff empty(String commitHash) {
        return new GitDiff(commitHash, List.of());
    }

    @JsonIgnore
    public long changedLineCount() {
        return files.stream()
                .flatMap(file -> file.hunks().stream())
                .mapToLong(Hunk::changedLineCount)
                .sum();
    }
}
