package com.example.effectivediff.application;

import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.FileFailure;
import com.example.effectivediff.domain.Hunk;

import java.util.List;

/**
 * Result of re-diffing one file pair: absolute hunks, or the failure that degraded it.
 */
record FileRediffOutcome(FileDiff file, List<Hunk> hunks, FileFailure failure) {

    static FileRediffOutcome succeeded(FileDiff file, List<Hunk> hunks) {
        return new FileRediffOutcome(file, List.copyOf(hunks), null);
    }

    static FileRediffOutcome failed(FileDiff file, FileFailure failure) {
        return new FileRediffOutcome(file, List.of(), failure);
    }

    boolean isFailed() {
        return failure != null;
    }
}
