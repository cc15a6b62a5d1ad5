package com.example.effectivediff.infrastructure;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UnifiedDiffWriterTest {

    private final UnifiedDiffWriter writer = new UnifiedDiffWriter();

    private final GitDiff gitDiff =
            new GitDiff(
                    "c0ffee",
                    List.of(
                            new FileDiff(
                                    "Service.java",
                                    "Service.java",
                                    List.of(
                                            new Hunk(
                                                    15,
                                                    2,
                                                    10,
                                                    2,
                                                    List.of(
                                                            DiffLine.context("ctx", 15, 10),
                                                            DiffLine.removed("limit = 10", 16),
                                                            DiffLine.added("limit = 20", 11))))),
                            new FileDiff(null, "New.java", List.of(new Hunk(0, 0, 1, 1, List.of(DiffLine.added("x", 1))))),
                            new FileDiff("Old.java", "Renamed.java", List.of())));

    @Test
    void writesGitStyleSections() {
        assertThat(writer.write(gitDiff))
                .isEqualTo(
                        String.join(
                                "\n",
                                "diff --git a/Service.java b/Service.java",
                                "--- a/Service.java",
                                "+++ b/Service.java",
                                "@@ -15,2 +10,2 @@",
                                " ctx",
                                "-limit = 10",
                                "+limit = 20",
                                "diff --git a/New.java b/New.java",
                                "new file mode 100644",
                                "--- /dev/null",
                                "+++ b/New.java",
                                "@@ -0,0 +1,1 @@",
                                "+x",
                                "diff --git a/Old.java b/Renamed.java",
                                "rename from Old.java",
                                "rename to Renamed.java",
                                ""));
    }

    @Test
    void parserReadsWhatTheWriterWrites() {
        assertThat(new UnifiedDiffParser().parse(writer.write(gitDiff), "c0ffee")).isEqualTo(gitDiff);
    }
}
