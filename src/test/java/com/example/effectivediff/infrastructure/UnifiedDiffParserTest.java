package com.example.effectivediff.infrastructure;

import com.example.effectivediff.application.MalformedDiffException;
import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnifiedDiffParserTest {

    private final UnifiedDiffParser parser = new UnifiedDiffParser();

    @Test
    void parsesModifiedAddedDeletedAndRenamedFiles() {
        String diff =
                String.join(
                        "\n",
                        "diff --git a/src/App.java b/src/App.java",
                        "index 1111111..2222222 100644",
                        "--- a/src/App.java",
                        "+++ b/src/App.java",
                        "@@ -2,3 +2,3 @@ class App {",
                        " first",
                        "-second",
                        "+second changed",
                        " third",
                        "diff --git a/src/New.java b/src/New.java",
                        "new file mode 100644",
                        "index 0000000..3333333",
                        "--- /dev/null",
                        "+++ b/src/New.java",
                        "@@ -0,0 +1,2 @@",
                        "+one",
                        "+two",
                        "\\ No newline at end of file",
                        "diff --git a/src/Old.java b/src/Old.java",
                        "deleted file mode 100644",
                        "--- a/src/Old.java",
                        "+++ /dev/null",
                        "@@ -1 +0,0 @@",
                        "-gone",
                        "diff --git a/src/From.java b/src/To.java",
                        "similarity index 100%",
                        "rename from src/From.java",
                        "rename to src/To.java",
                        "");

        GitDiff gitDiff = parser.parse(diff, "c0ffee");

        assertThat(gitDiff.commitHash()).isEqualTo("c0ffee");
        assertThat(gitDiff.files())
                .containsExactly(
                        new FileDiff(
                                "src/App.java",
                                "src/App.java",
                                List.of(
                                        new Hunk(
                                                2,
                                                3,
                                                2,
                                                3,
                                                List.of(
                                                        DiffLine.context("first", 2, 2),
                                                        DiffLine.removed("second", 3),
                                                        DiffLine.added("second changed", 3),
                                                        DiffLine.context("third", 4, 4))))),
                        new FileDiff(
                                null,
                                "src/New.java",
                                List.of(new Hunk(0, 0, 1, 2, List.of(DiffLine.added("one", 1), DiffLine.added("two", 2))))),
                        new FileDiff(
                                "src/Old.java",
                                null,
                                List.of(new Hunk(1, 1, 0, 0, List.of(DiffLine.removed("gone", 1))))),
                        new FileDiff("src/From.java", "src/To.java", List.of()));
    }

    @Test
    void acceptsPlainUnifiedDiffWithoutGitHeaders() {
        String diff =
                String.join(
                        "\n",
                        "--- a/one.txt\t2024-01-01 00:00:00",
                        "+++ b/one.txt\t2024-01-02 00:00:00",
                        "@@ -1,1 +1,1 @@",
                        "-a",
                        "+b",
                        "--- a/two.txt",
                        "+++ b/two.txt",
                        "@@ -3,0 +4,1 @@",
                        "+c");

        GitDiff gitDiff = parser.parse(diff, null);

        assertThat(gitDiff.files()).extracting(FileDiff::path).containsExactly("one.txt", "two.txt");
        assertThat(gitDiff.files().get(1).hunks().get(0).lines()).containsExactly(DiffLine.added("c", 4));
    }

    @Test
    void removedLineThatLooksLikeAHeaderStaysInItsHunk() {
        String diff =
                String.join(
                        "\n",
                        "--- a/notes.md",
                        "+++ b/notes.md",
                        "@@ -1,2 +1,1 @@",
                        "--- a/notes.md",
                        "+++ b/notes.md");

        assertThatThrownBy(() -> parser.parse(diff, null)).isInstanceOf(MalformedDiffException.class);

        String valid =
                String.join(
                        "\n",
                        "--- a/notes.md",
                        "+++ b/notes.md",
                        "@@ -1,2 +1,1 @@",
                        "--- separator",
                        " kept");
        assertThat(parser.parse(valid, null).files().get(0).hunks().get(0).lines())
                .containsExactly(DiffLine.removed("-- separator", 1), DiffLine.context("kept", 2, 1));
    }

    @Test
    void truncatedHunkIsMalformed() {
        assertThatThrownBy(() -> parser.parseHunks(List.of("@@ -1,3 +1,3 @@", " a", " b")))
                .isInstanceOf(MalformedDiffException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void parseHunksSkipsFileHeaders() {
        List<Hunk> hunks =
                parser.parseHunks(List.of("--- old", "+++ new", "@@ -5 +5 @@", "-x", "+y", "@@ -9,0 +10 @@", "+z"));

        assertThat(hunks)
                .containsExactly(
                        new Hunk(5, 1, 5, 1, List.of(DiffLine.removed("x", 5), DiffLine.added("y", 5))),
                        new Hunk(9, 0, 10, 1, List.of(DiffLine.added("z", 10))));
    }

    @Test
    void onlyLineFeedSeparatesDiffLines() {
        String diff =
                "--- a/Win.java\n"
                        + "+++ b/Win.java\n"
                        + "@@ -1,2 +1,2 @@\n"
                        + " keep\r\n"
                        + "-String s = \"x\u2028y\";\r\n"
                        + "+String s = \"x\u2029y\";\r\n";

        GitDiff gitDiff = parser.parse(diff, "c0ffee");

        assertThat(gitDiff.files().get(0).hunks().get(0).lines())
                .containsExactly(
                        DiffLine.context("keep\r", 1, 1),
                        DiffLine.removed("String s = \"x\u2028y\";\r", 2),
                        DiffLine.added("String s = \"x\u2029y\";\r", 2));
    }
}
