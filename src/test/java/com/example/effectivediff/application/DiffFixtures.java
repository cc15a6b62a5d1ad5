package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.EffectiveDiffPipelineResult;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import com.example.effectivediff.domain.MoveReportEntry;
import com.example.effectivediff.infrastructure.DiffUtilsRediffer;
import com.example.effectivediff.infrastructure.UnifiedDiffParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

/** Builders shared by the engine tests. */
final class DiffFixtures {

    private DiffFixtures() {}

    static EffectiveDiffProperties properties() {
        EffectiveDiffProperties properties = new EffectiveDiffProperties();
        properties.setThreadPoolSize(2);
        return properties;
    }

    static DiffUtilsRediffer rediffer() {
        return new DiffUtilsRediffer(properties(), new UnifiedDiffParser());
    }

    static EffectiveDiffPipeline pipeline(EffectiveDiffProperties properties) {
        return new EffectiveDiffPipeline(
                new DiffValidator(),
                new LineExtractor(),
                new LineMatcher(),
                new BlockAggregator(properties),
                new RegionRediffer(properties),
                new DiffReconstructor(),
                new MoveReportBuilder(properties),
                new DiffUtilsRediffer(properties, new UnifiedDiffParser()),
                properties);
    }

    /** Lines {@code "<prefix> line 1"} to {@code "<prefix> line n"}. */
    static List<String> numbered(String prefix, int count) {
        List<String> lines = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lines.add(prefix + " line " + i);
        }
        return lines;
    }

    static String text(List<String> lines) {
        return TextLines.join(lines);
    }

    static Hunk removedHunk(int oldStart, List<String> contents) {
        List<DiffLine> lines = new ArrayList<>();
        for (int i = 0; i < contents.size(); i++) {
            lines.add(DiffLine.removed(contents.get(i), oldStart + i));
        }
        return new Hunk(oldStart, contents.size(), oldStart - 1, 0, lines);
    }

    static Hunk addedHunk(int newStart, List<String> contents) {
        List<DiffLine> lines = new ArrayList<>();
        for (int i = 0; i < contents.size(); i++) {
            lines.add(DiffLine.added(contents.get(i), newStart + i));
        }
        return new Hunk(newStart - 1, 0, newStart, contents.size(), lines);
    }

    static GitDiff gitDiff(FileDiff... files) {
        return new GitDiff("abc123", List.of(files));
    }

    /** Diffs every path of the two snapshots the way {@code git diff -U3} would. */
    static GitDiff diffOf(Map<String, String> oldFiles, Map<String, String> newFiles) {
        DiffUtilsRediffer rediffer = rediffer();
        Set<String> paths = new TreeSet<>(oldFiles.keySet());
        paths.addAll(newFiles.keySet());
        List<FileDiff> files = new ArrayList<>();
        for (String path : paths) {
            String oldText = oldFiles.getOrDefault(path, "");
            String newText = newFiles.getOrDefault(path, "");
            List<Hunk> hunks = rediffer.rediff(oldText, newText);
            if (!hunks.isEmpty()) {
                files.add(
                        new FileDiff(
                                oldFiles.containsKey(path) ? path : null,
                                newFiles.containsKey(path) ? path : null,
                                hunks));
            }
        }
        return new GitDiff("abc123", files);
    }

    /** Every changed line of a diff as {@code path:status:number}. */
    static List<String> changedLineKeys(GitDiff gitDiff) {
        List<String> keys = new ArrayList<>();
        for (FileDiff file : gitDiff.files()) {
            for (Hunk hunk : file.hunks()) {
                for (DiffLine line : hunk.lines()) {
                    switch (line.status()) {
                        case REMOVED -> keys.add(file.oldPath() + ":-:" + line.oldLineNumber());
                        case ADDED -> keys.add(file.newPath() + ":+:" + line.newLineNumber());
                        default -> {}
                    }
                }
            }
        }
        return keys;
    }

    static List<String> movedLineKeys(List<MoveReportEntry> moves) {
        List<String> keys = new ArrayList<>();
        for (MoveReportEntry move : moves) {
            for (int line = move.sourceLineRange().start(); line <= move.sourceLineRange().end(); line++) {
                keys.add(move.sourceFile() + ":-:" + line);
            }
            for (int line = move.targetLineRange().start(); line <= move.targetLineRange().end(); line++) {
                keys.add(move.targetFile() + ":+:" + line);
            }
        }
        return keys;
    }

    /** Every changed input line is either moved or still in the effective diff, never both. */
    static void assertPartition(GitDiff input, EffectiveDiffPipelineResult result) {
        List<String> inputLines = changedLineKeys(input);
        List<String> moved = movedLineKeys(result.moveReport().moves());
        List<String> retained = changedLineKeys(result.effectiveDiff());

        Set<String> movedSet = new HashSet<>(moved);
        Set<String> retainedSet = new HashSet<>(retained);
        assertThat(movedSet).hasSameSizeAs(moved);
        assertThat(retainedSet).hasSameSizeAs(retained);
        assertThat(movedSet).doesNotContainAnyElementsOf(retainedSet);

        Set<String> union = new HashSet<>(movedSet);
        union.addAll(retainedSet);
        assertThat(union).containsExactlyInAnyOrderElementsOf(inputLines);
    }
}
