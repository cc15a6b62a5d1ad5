package com.example.effectivediff.domain;

import java.util.Objects;

/**
 * A contiguous block of lines removed at one location and added verbatim at another. Source
 * numbers are old-file lines, target numbers new-file lines.
 */
public record MoveCandidate(
        String sourceFile,
        LineRange sourceLineRange,
        String targetFile,
        LineRange targetLineRange,
        int matchedLineCount,
        double score) {

    public MoveCandidate {
        Objects.requireNonNull(sourceFile, "sourceFile");
        Objects.requireNonNull(sourceLineRange, "sourceLineRange");
        Objects.requireNonNull(targetFile, "targetFile");
        Objects.requireNonNull(targetLineRange, "targetLineRange");
        if (matchedLineCount != sourceLineRange.length()
                || matchedLineCount != targetLineRange.length()) {
            throw new IllegalArgumentException(
                    "Matched line count "
                            + matchedLineCount
                            + " does not fit ranges "
                            + sourceLineRange
                            + " and "
                            + targetLineRange);
        }
    }
}
