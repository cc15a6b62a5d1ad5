package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.DiffLineStatus;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Rejects diffs whose structure the engine cannot rely on. Every check throws
 * {@link MalformedDiffException} naming the offending file and hunk.
 */
@Component
public class DiffValidator {

    public void validate(GitDiff gitDiff) {
        Set<String> oldPaths = new HashSet<>();
        Set<String> newPaths = new HashSet<>();
        for (FileDiff file : gitDiff.files()) {
            if (file.oldPath() == null && file.newPath() == null) {
                throw new MalformedDiffException("File diff without old or new path");
            }
            if (file.oldPath() != null && !oldPaths.add(file.oldPath())) {
                throw new MalformedDiffException("Duplicate old path " + file.oldPath());
            }
            if (file.newPath() != null && !newPaths.add(file.newPath())) {
                throw new MalformedDiffException("Duplicate new path " + file.newPath());
            }
            validateHunks(file);
        }
    }

    private void validateHunks(FileDiff file) {
        Hunk previous = null;
        for (Hunk hunk : file.hunks()) {
            validateHunk(file, hunk);
            if (previous != null
                    && (hunk.oldFirstLine() <= previous.oldLastLine()
                            || hunk.newFirstLine() <= previous.newLastLine())) {
                throw malformed(file, hunk, "overlaps or precedes the previous hunk");
            }
            previous = hunk;
        }
    }

    private void validateHunk(FileDiff file, Hunk hunk) {
        if (hunk.lines().isEmpty()) {
            throw malformed(file, hunk, "has no lines");
        }
        if (hunk.oldLineCount() < 0 || hunk.newLineCount() < 0) {
            throw malformed(file, hunk, "has a negative line count");
        }
        if (hunk.oldStart() < (hunk.oldLineCount() == 0 ? 0 : 1)
                || hunk.newStart() < (hunk.newLineCount() == 0 ? 0 : 1)) {
            throw malformed(file, hunk, "has an invalid start line");
        }
        if (file.isAdded() && hunk.oldLineCount() > 0) {
            throw malformed(file, hunk, "has old lines in an added file");
        }
        if (file.isDeleted() && hunk.newLineCount() > 0) {
            throw malformed(file, hunk, "has new lines in a deleted file");
        }

        int expectedOld = hunk.oldFirstLine();
        int expectedNew = hunk.newFirstLine();
        int oldCount = 0;
        int newCount = 0;
        for (DiffLine line : hunk.lines()) {
            checkNumbers(file, hunk, line);
            if (line.isOldSide()) {
                if (line.oldLineNumber() != expectedOld) {
                    throw malformed(
                            file, hunk, "expected old line " + expectedOld + " but found " + line.oldLineNumber());
                }
                expectedOld++;
                oldCount++;
            }
            if (line.isNewSide()) {
                if (line.newLineNumber() != expectedNew) {
                    throw malformed(
                            file, hunk, "expected new line " + expectedNew + " but found " + line.newLineNumber());
                }
                expectedNew++;
                newCount++;
            }
        }
        if (oldCount != hunk.oldLineCount() || newCount != hunk.newLineCount()) {
            throw malformed(
                    file,
                    hunk,
                    String.format("header counts disagree with its %d old and %d new lines", oldCount, newCount));
        }
    }

    private void checkNumbers(FileDiff file, Hunk hunk, DiffLine line) {
        boolean hasOld = line.oldLineNumber() != null;
        boolean hasNew = line.newLineNumber() != null;
        boolean valid =
                switch (line.status()) {
                    case CONTEXT -> hasOld && hasNew;
                    case REMOVED -> hasOld && !hasNew;
                    case ADDED -> !hasOld && hasNew;
                };
        if (!valid) {
            throw malformed(file, hunk, "has a " + describe(line.status()) + " line with wrong line numbers");
        }
    }

    private static String describe(DiffLineStatus status) {
        return status.name().toLowerCase();
    }

    private static MalformedDiffException malformed(FileDiff file, Hunk hunk, String problem) {
        return new MalformedDiffException(file.path() + " hunk " + hunk.header() + " " + problem);
    }
}
