package com.example.effectivediff.domain;

/**
 * Persisted description of one accepted move. {@code effectiveDiffLines} counts the genuine
 * changes kept in the effective diff around the moved block.
 */
public record MoveReportEntry(
        String sourceFile,
        LineRange sourceLineRange,
        String targetFile,
        LineRange targetLineRange,
        int matchedLineCount,
        double score,
        int effectiveDiffLines) {}
