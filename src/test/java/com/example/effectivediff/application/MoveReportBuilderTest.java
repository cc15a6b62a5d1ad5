package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import com.example.effectivediff.domain.LineRange;
import com.example.effectivediff.domain.MoveCandidate;
import com.example.effectivediff.domain.MoveReport;
import com.example.effectivediff.domain.MoveReportEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.effectivediff.application.DiffFixtures.gitDiff;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class MoveReportBuilderTest {

    private final MoveReportBuilder builder = new MoveReportBuilder(new EffectiveDiffProperties());

    @Test
    void entriesAreSortedBySourceFileThenStart() {
        MoveCandidate late = new MoveCandidate("B.java", new LineRange(40, 43), "X.java", new LineRange(1, 4), 4, 4.5);
        MoveCandidate early = new MoveCandidate("B.java", new LineRange(2, 4), "Y.java", new LineRange(7, 9), 3, 3.5);
        MoveCandidate first = new MoveCandidate("A.java", new LineRange(90, 94), "Z.java", new LineRange(1, 5), 5, 5.5);

        MoveReport report = builder.build(List.of(late, early, first), GitDiff.empty("abc123"));

        assertThat(report.moves())
                .extracting(MoveReportEntry::sourceFile, entry -> entry.sourceLineRange().start())
                .containsExactly(
                        tuple("A.java", 90),
                        tuple("B.java", 2),
                        tuple("B.java", 40));
        assertThat(report.movesDetected()).isEqualTo(3);
        assertThat(report.totalLinesMoved()).isEqualTo(12);
        assertThat(report.totalLinesEffectivelyChanged()).isZero();
    }

    @Test
    void changesNearAMoveAreCountedForThatMove() {
        MoveCandidate move = new MoveCandidate("A.java", new LineRange(10, 14), "B.java", new LineRange(20, 24), 5, 5.5);
        Hunk sourceEdit =
                new Hunk(16, 1, 11, 1, List.of(DiffLine.removed("old", 16), DiffLine.added("new", 11)));
        Hunk targetEdit = new Hunk(24, 0, 25, 1, List.of(DiffLine.added("tweak", 25)));
        Hunk farEdit = new Hunk(79, 0, 80, 1, List.of(DiffLine.added("unrelated", 80)));
        GitDiff effective =
                gitDiff(
                        new FileDiff("A.java", "A.java", List.of(sourceEdit)),
                        new FileDiff("B.java", "B.java", List.of(targetEdit, farEdit)));

        MoveReport report = builder.build(List.of(move), effective);

        assertThat(report.moves()).singleElement().extracting(MoveReportEntry::effectiveDiffLines).isEqualTo(2);
        assertThat(report.totalLinesEffectivelyChanged()).isEqualTo(4);
    }
}
