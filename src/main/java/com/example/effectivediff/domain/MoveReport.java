package com.example.effectivediff.domain;

import java.util.List;
import java.util.Objects;

/**
 * Every accepted move, sorted by source file and source start line.
 */
public record MoveReport(
        int movesDetected,
        int totalLinesMoved,
        int totalLinesEffectivelyChanged,
        List<MoveReportEntry> moves) {

    public MoveReport {
        Objects.requireNonNull(moves, "moves");
        moves = List.copyOf(moves);
    }

    public static MoveReport empty() {
        return new MoveReport(0, 0, 0, List.of());
    }
}
