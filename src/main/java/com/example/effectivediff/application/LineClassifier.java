package com.example.effectivediff.application;

import com.example.effectivediff.domain.ClassifiedDiffLine;
import com.example.effectivediff.domain.ClassifiedHunk;
import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.DiffLineStatus;
import com.example.effectivediff.domain.EffectiveDiffPipelineResult;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import com.example.effectivediff.domain.LineClassification;
import com.example.effectivediff.domain.MoveCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Labels every line of a diff with its role relative to a set of moves, for presentation layers
 * that show the full diff with moves highlighted.
 *
 * <p>An added line is {@link LineClassification#CHANGED_IN_MOVE} when it is not moved, lies within
 * {@code context-padding} lines of a move target and survives as an addition in the effective
 * diff.
 */
@Component
public class LineClassifier {
    private final int contextPadding;

    public LineClassifier(EffectiveDiffProperties properties) {
        properties.validate();
        this.contextPadding = properties.getContextPadding();
    }

    /** Classifies the original diff against the outcome of a finished run. */
    public List<ClassifiedDiffLine> classify(GitDiff originalDiff, EffectiveDiffPipelineResult result) {
        List<MoveCandidate> moves =
                result.moveReport().moves().stream()
                        .map(
                                entry ->
                                        new MoveCandidate(
                                                entry.sourceFile(),
                                                entry.sourceLineRange(),
                                                entry.targetFile(),
                                                entry.targetLineRange(),
                                                entry.matchedLineCount(),
                                                entry.score()))
                        .toList();
        return classify(originalDiff, result.effectiveDiff(), moves);
    }

    public List<ClassifiedDiffLine> classify(
            GitDiff originalDiff, GitDiff effectiveDiff, List<MoveCandidate> moves) {
        MovedLines moved = new MovedLines(moves);
        Set<String> retainedAdditions = retainedAdditions(effectiveDiff);
        List<ClassifiedDiffLine> result = new ArrayList<>();
        for (FileDiff file : originalDiff.files()) {
            for (Hunk hunk : file.hunks()) {
                for (DiffLine line : hunk.lines()) {
                    result.add(
                            new ClassifiedDiffLine(
                                    file.path(), line, classify(file, line, moved, retainedAdditions)));
                }
            }
        }
        return result;
    }

    /**
     * Regroups classified lines along the hunk boundaries of the diff they were classified from.
     * Each original hunk takes as many lines as it has, in order.
     */
    public List<ClassifiedHunk> groupIntoHunks(GitDiff originalDiff, List<ClassifiedDiffLine> classifiedLines) {
        List<ClassifiedHunk> hunks = new ArrayList<>();
        int index = 0;
        for (FileDiff file : originalDiff.files()) {
            for (Hunk hunk : file.hunks()) {
                int end = Math.min(index + hunk.lines().size(), classifiedLines.size());
                hunks.add(
                        new ClassifiedHunk(
                                file.path(), hunk.oldStart(), hunk.newStart(), classifiedLines.subList(index, end)));
                index = end;
            }
        }
        return hunks;
    }

    /** Lines the author actually wrote: new code and edits made inside moved blocks. */
    public List<ClassifiedDiffLine> newAndChangedInMoveLines(List<ClassifiedHunk> hunks) {
        return hunks.stream()
                .flatMap(hunk -> hunk.lines().stream())
                .filter(
                        line ->
                                line.classification() == LineClassification.NEW
                                        || line.classification() == LineClassification.CHANGED_IN_MOVE)
                .toList();
    }

    private LineClassification classify(
            FileDiff file, DiffLine line, MovedLines moved, Set<String> retainedAdditions) {
        return switch (line.status()) {
            case ADDED -> {
                if (moved.isMoved(file, line)) {
                    yield LineClassification.MOVED;
                }
                boolean editedInMove =
                        retainedAdditions.contains(additionKey(file.newPath(), line.newLineNumber()))
                                && nearMoveTarget(file, line, moved.moves());
                yield editedInMove ? LineClassification.CHANGED_IN_MOVE : LineClassification.NEW;
            }
            case REMOVED ->
                    moved.isMoved(file, line)
                            ? LineClassification.MOVED_REMOVAL
                            : LineClassification.REMOVED;
            case CONTEXT -> LineClassification.CONTEXT;
        };
    }

    private boolean nearMoveTarget(FileDiff file, DiffLine line, List<MoveCandidate> moves) {
        return moves.stream()
                .anyMatch(
                        move ->
                                move.targetFile().equals(file.newPath())
                                        && move.targetLineRange()
                                                .containsWithin(line.newLineNumber(), contextPadding));
    }

    private static Set<String> retainedAdditions(GitDiff effectiveDiff) {
        Set<String> keys = new HashSet<>();
        for (FileDiff file : effectiveDiff.files()) {
            for (Hunk hunk : file.hunks()) {
                for (DiffLine line : hunk.lines()) {
                    if (line.status() == DiffLineStatus.ADDED) {
                        keys.add(additionKey(file.newPath(), line.newLineNumber()));
                    }
                }
            }
        }
        return keys;
    }

    private static String additionKey(String path, int newLineNumber) {
        return path + ":" + newLineNumber;
    }
}
