package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.DiffLineStatus;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.MoveCandidate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Line-level view of a set of accepted moves: which old lines are move sources and which new
 * lines are move targets.
 */
public class MovedLines {
    private final List<MoveCandidate> moves;
    private final Set<LineKey> sources = new HashSet<>();
    private final Set<LineKey> targets = new HashSet<>();

    public MovedLines(List<MoveCandidate> moves) {
        this.moves = List.copyOf(moves);
        for (MoveCandidate move : this.moves) {
            for (int line = move.sourceLineRange().start(); line <= move.sourceLineRange().end(); line++) {
                sources.add(new LineKey(move.sourceFile(), line));
            }
            for (int line = move.targetLineRange().start(); line <= move.targetLineRange().end(); line++) {
                targets.add(new LineKey(move.targetFile(), line));
            }
        }
    }

    public List<MoveCandidate> moves() {
        return moves;
    }

    public boolean isEmpty() {
        return moves.isEmpty();
    }

    /** Whether this line of {@code file} is consumed by a move. Context lines never are. */
    public boolean isMoved(FileDiff file, DiffLine line) {
        if (line.status() == DiffLineStatus.REMOVED) {
            return sources.contains(new LineKey(file.oldPath(), line.oldLineNumber()));
        }
        if (line.status() == DiffLineStatus.ADDED) {
            return targets.contains(new LineKey(file.newPath(), line.newLineNumber()));
        }
        return false;
    }

    /** Whether any move takes lines out of, or puts lines into, this file pair. */
    public boolean touches(FileDiff file) {
        return moves.stream().anyMatch(move -> touches(move, file));
    }

    /** The moves that remain once every move touching one of {@code failed} is dropped. */
    public MovedLines without(List<FileDiff> failed) {
        List<MoveCandidate> kept = new ArrayList<>();
        for (MoveCandidate move : moves) {
            if (failed.stream().noneMatch(file -> touches(move, file))) {
                kept.add(move);
            }
        }
        return new MovedLines(kept);
    }

    private static boolean touches(MoveCandidate move, FileDiff file) {
        return (file.oldPath() != null && Objects.equals(move.sourceFile(), file.oldPath()))
                || (file.newPath() != null && Objects.equals(move.targetFile(), file.newPath()));
    }
}
