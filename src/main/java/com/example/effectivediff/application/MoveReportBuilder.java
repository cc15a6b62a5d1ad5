package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.DiffLineStatus;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import com.example.effectivediff.domain.MoveCandidate;
import com.example.effectivediff.domain.MoveReport;
import com.example.effectivediff.domain.MoveReportEntry;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Component
public class MoveReportBuilder {
    static final Comparator<MoveCandidate> REPORT_ORDER =
            Comparator.comparing(MoveCandidate::sourceFile)
                    .thenComparingInt(move -> move.sourceLineRange().start())
                    .thenComparing(MoveCandidate::targetFile)
                    .thenComparingInt(move -> move.targetLineRange().start());

    private final int contextPadding;

    public MoveReportBuilder(EffectiveDiffProperties properties) {
        properties.validate();
        this.contextPadding = properties.getContextPadding();
    }

    public MoveReport build(List<MoveCandidate> moves, GitDiff effectiveDiff) {
        List<MoveReportEntry> entries =
                moves.stream()
                        .sorted(REPORT_ORDER)
                        .map(move -> toEntry(move, effectiveDiff))
                        .toList();
        int linesMoved = moves.stream().mapToInt(MoveCandidate::matchedLineCount).sum();
        return new MoveReport(
                entries.size(), linesMoved, (int) effectiveDiff.changedLineCount(), entries);
    }

    private MoveReportEntry toEntry(MoveCandidate move, GitDiff effectiveDiff) {
        return new MoveReportEntry(
                move.sourceFile(),
                move.sourceLineRange(),
                move.targetFile(),
                move.targetLineRange(),
                move.matchedLineCount(),
                move.score(),
                changesAround(move, effectiveDiff));
    }

    /** Genuine changes left in the effective diff within the padded windows of the move. */
    private int changesAround(MoveCandidate move, GitDiff effectiveDiff) {
        int count = 0;
        for (FileDiff file : effectiveDiff.files()) {
            boolean source = Objects.equals(file.oldPath(), move.sourceFile());
            boolean target = Objects.equals(file.newPath(), move.targetFile());
            if (!source && !target) {
                continue;
            }
            for (Hunk hunk : file.hunks()) {
                for (DiffLine line : hunk.lines()) {
                    if (target
                            && line.status() == DiffLineStatus.ADDED
                            && move.targetLineRange().containsWithin(line.newLineNumber(), contextPadding)) {
                        count++;
                    } else if (source
                            && line.status() == DiffLineStatus.REMOVED
                            && move.sourceLineRange().containsWithin(line.oldLineNumber(), contextPadding)) {
                        count++;
                    }
                }
            }
        }
        return count;
    }
}
