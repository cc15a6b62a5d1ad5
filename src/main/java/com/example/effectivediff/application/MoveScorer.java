package com.example.effectivediff.application;

import java.util.List;

/**
 * Confidence score of a move. The integer part is the matched line count; the fraction rewards
 * lines whose content is rare among the added lines, so the score grows strictly with block size.
 */
public final class MoveScorer {
    static final double UNIQUENESS_WEIGHT = 0.5;

    private MoveScorer() {}

    public static double score(int matchedLineCount, double meanUniqueness) {
        double bounded = Math.max(0.0, Math.min(1.0, meanUniqueness));
        return matchedLineCount + UNIQUENESS_WEIGHT * bounded;
    }

    /** Mean of {@code 1 / frequency} over the block's lines. */
    public static double meanUniqueness(List<String> contents, LineMatches matches) {
        if (contents.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (String content : contents) {
            sum += 1.0 / Math.max(1, matches.addedFrequency(content));
        }
        return sum / contents.size();
    }
}
