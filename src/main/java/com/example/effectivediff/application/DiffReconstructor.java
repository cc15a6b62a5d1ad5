package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.Hunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Rebuilds the hunks of one file pair with the moved lines taken out.
 *
 * <p>Filtering works line by line. A hunk that mixes moved lines with genuine edits is cut
 * wherever moved lines were dropped, and every piece that still carries a change becomes a hunk
 * of its own with a header derived from its lines. Pieces left with context only disappear.
 */
@Component
public class DiffReconstructor {
    private static final Logger log = LogManager.getLogger(DiffReconstructor.class);

    /**
     * Uses the re-diffed hunks when, once moves are removed, they change exactly the lines the
     * original diff changes outside the moves. Otherwise the original hunks are filtered instead.
     */
    public FileDiff reconstruct(FileDiff original, List<Hunk> rediffed, MovedLines moved) {
        List<Hunk> fromRediff = elide(original, rediffed, moved);
        List<Hunk> fromOriginal = elide(original, original.hunks(), moved);
        List<DiffLine> rediffChanges = changedLines(fromRediff);
        List<DiffLine> originalChanges = changedLines(fromOriginal);
        if (rediffChanges.size() == originalChanges.size()
                && new HashSet<>(rediffChanges).equals(new HashSet<>(originalChanges))) {
            return original.withHunks(fromRediff);
        }
        log.debug(
                "Re-diff of {} does not cover the original changes, filtering original hunks",
                original.path());
        return original.withHunks(fromOriginal);
    }

    /** Filters the original hunks of a file pair that was not re-diffed. */
    public FileDiff filter(FileDiff original, MovedLines moved) {
        return original.withHunks(elide(original, original.hunks(), moved));
    }

    private List<Hunk> elide(FileDiff file, List<Hunk> hunks, MovedLines moved) {
        List<Hunk> result = new ArrayList<>();
        for (Hunk hunk : hunks) {
            splitAroundMoves(file, hunk, moved, result);
        }
        return result;
    }

    private void splitAroundMoves(FileDiff file, Hunk hunk, MovedLines moved, List<Hunk> out) {
        int lastOld = hunk.oldFirstLine() - 1;
        int lastNew = hunk.newFirstLine() - 1;
        List<DiffLine> piece = new ArrayList<>();
        int pieceOldAnchor = lastOld;
        int pieceNewAnchor = lastNew;
        for (DiffLine line : hunk.lines()) {
            if (moved.isMoved(file, line)) {
                emit(piece, pieceOldAnchor, pieceNewAnchor, out);
                piece = new ArrayList<>();
            } else {
                if (piece.isEmpty()) {
                    pieceOldAnchor = lastOld;
                    pieceNewAnchor = lastNew;
                }
                piece.add(line);
            }
            if (line.isOldSide()) {
                lastOld = line.oldLineNumber();
            }
            if (line.isNewSide()) {
                lastNew = line.newLineNumber();
            }
        }
        emit(piece, pieceOldAnchor, pieceNewAnchor, out);
    }

    private void emit(List<DiffLine> piece, int oldAnchor, int newAnchor, List<Hunk> out) {
        if (piece.stream().anyMatch(DiffLine::isChange)) {
            out.add(Hunk.of(piece, oldAnchor, newAnchor));
        }
    }

    private List<DiffLine> changedLines(List<Hunk> hunks) {
        List<DiffLine> changed = new ArrayList<>();
        for (Hunk hunk : hunks) {
            for (DiffLine line : hunk.lines()) {
                if (line.isChange()) {
                    changed.add(line);
                }
            }
        }
        return changed;
    }
}
