package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.effectivediff.application.DiffFixtures.addedHunk;
import static com.example.effectivediff.application.DiffFixtures.gitDiff;
import static com.example.effectivediff.application.DiffFixtures.removedHunk;
import static org.assertj.core.api.Assertions.assertThat;

class LineMatcherTest {

    private final LineExtractor extractor = new LineExtractor();
    private final LineMatcher matcher = new LineMatcher();

    @Test
    void extractorNumbersRemovedByOldPathAndAddedByNewPath() {
        Hunk hunk =
                new Hunk(
                        3,
                        2,
                        3,
                        2,
                        List.of(
                                DiffLine.context("keep", 3, 3),
                                DiffLine.removed("before", 4),
                                DiffLine.added("after", 4)));
        GitDiff diff = gitDiff(new FileDiff("old/Name.java", "new/Name.java", List.of(hunk)));

        ExtractedLines lines = extractor.extract(diff);

        assertThat(lines.removed()).containsExactly(new ExtractedLine("old/Name.java", 4, "before"));
        assertThat(lines.added()).containsExactly(new ExtractedLine("new/Name.java", 4, "after"));
    }

    @Test
    void everyIdenticalAddedLineIsACandidateAcrossFiles() {
        GitDiff diff =
                gitDiff(
                        new FileDiff("A.java", "A.java", List.of(removedHunk(1, List.of("}", "return total;")))),
                        new FileDiff("B.java", "B.java", List.of(addedHunk(5, List.of("}", "return total;")))),
                        new FileDiff(null, "C.java", List.of(addedHunk(1, List.of("}")))));

        LineMatches matches = matcher.match(extractor.extract(diff));

        ExtractedLine brace = matches.removedLines().get(0);
        assertThat(matches.candidatesFor(brace))
                .containsExactly(new ExtractedLine("B.java", 5, "}"), new ExtractedLine("C.java", 1, "}"));
        assertThat(matches.addedFrequency("}")).isEqualTo(2);
        assertThat(matches.addedFrequency("return total;")).isEqualTo(1);
        assertThat(matches.addedFrequency("missing")).isZero();
        assertThat(matches.matchedPairCount()).isEqualTo(3);
    }

    @Test
    void contentMustMatchExactly() {
        GitDiff diff =
                gitDiff(
                        new FileDiff("A.java", "A.java", List.of(removedHunk(1, List.of("int x = 1;")))),
                        new FileDiff("B.java", "B.java", List.of(addedHunk(1, List.of("int x = 1; ", "int  x = 1;")))));

        LineMatches matches = matcher.match(extractor.extract(diff));

        assertThat(matches.candidatesFor(matches.removedLines().get(0))).isEmpty();
        assertThat(matches.removedAt(new LineKey("A.java", 1))).isNotNull();
        assertThat(matches.addedAt(new LineKey("B.java", 2)).content()).isEqualTo("int  x = 1;");
    }
}
