package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.DiffLineStatus;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class LineExtractor {

    public ExtractedLines extract(GitDiff gitDiff) {
        List<ExtractedLine> removed = new ArrayList<>();
        List<ExtractedLine> added = new ArrayList<>();
        for (FileDiff file : gitDiff.files()) {
            for (Hunk hunk : file.hunks()) {
                for (DiffLine line : hunk.lines()) {
                    if (line.status() == DiffLineStatus.REMOVED) {
                        removed.add(
                                new ExtractedLine(
                                        file.oldPath(), line.oldLineNumber(), line.content()));
                    } else if (line.status() == DiffLineStatus.ADDED) {
                        added.add(
                                new ExtractedLine(
                                        file.newPath(), line.newLineNumber(), line.content()));
                    }
                }
            }
        }
        return new ExtractedLines(removed, added);
    }
}
