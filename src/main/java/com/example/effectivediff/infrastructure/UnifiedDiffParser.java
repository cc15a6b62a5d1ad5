package com.example.effectivediff.infrastructure;

import com.example.effectivediff.application.MalformedDiffException;
import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code git diff} output into the diff model. Understands {@code diff --git} sections,
 * {@code /dev/null} sides, new/deleted file modes, renames and the "no newline at end of file"
 * marker; plain {@code ---}/{@code +++} diffs without git headers are accepted as well.
 */
@Component
public class UnifiedDiffParser {
    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*");
    private static final String DEV_NULL = "/dev/null";

    public GitDiff parse(String diffText, String commitHash) {
        List<String> lines = Arrays.asList(diffText.split("\n", -1));
        List<FileDiff> files = new ArrayList<>();
        FileSection section = null;
        int index = 0;
        while (index < lines.size()) {
            String line = lines.get(index);
            if (line.startsWith("diff --git ")) {
                addSection(files, section);
                section = FileSection.fromGitHeader(line);
                index++;
            } else if (line.startsWith("--- ")
                    && index + 1 < lines.size()
                    && lines.get(index + 1).startsWith("+++ ")) {
                if (section == null || section.sawFileHeaders) {
                    addSection(files, section);
                    section = new FileSection();
                }
                section.oldPath = stripPath(line.substring(4));
                section.newPath = stripPath(lines.get(index + 1).substring(4));
                section.sawFileHeaders = true;
                index += 2;
            } else if (line.startsWith("@@")) {
                if (section == null) {
                    throw new MalformedDiffException("Hunk header before any file header: " + line);
                }
                index = readHunk(lines, index, section.hunks);
            } else {
                if (section != null) {
                    section.readExtendedHeader(line);
                }
                index++;
            }
        }
        addSection(files, section);
        return new GitDiff(commitHash, files);
    }

    /** Parses the hunks of a single-file diff, ignoring everything before the first header. */
    public List<Hunk> parseHunks(List<String> lines) {
        List<Hunk> hunks = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            if (lines.get(index).startsWith("@@")) {
                index = readHunk(lines, index, hunks);
            } else {
                index++;
            }
        }
        return hunks;
    }

    private int readHunk(List<String> lines, int headerIndex, List<Hunk> hunks) {
        String header = lines.get(headerIndex);
        Matcher matcher = HUNK_HEADER.matcher(header);
        if (!matcher.matches()) {
            throw new MalformedDiffException("Invalid hunk header: " + header);
        }
        int oldStart = Integer.parseInt(matcher.group(1));
        int oldCount = matcher.group(2) == null ? 1 : Integer.parseInt(matcher.group(2));
        int newStart = Integer.parseInt(matcher.group(3));
        int newCount = matcher.group(4) == null ? 1 : Integer.parseInt(matcher.group(4));

        List<DiffLine> diffLines = new ArrayList<>();
        int oldLine = oldStart;
        int newLine = newStart;
        int oldRemaining = oldCount;
        int newRemaining = newCount;
        int index = headerIndex + 1;
        while (index < lines.size() && (oldRemaining > 0 || newRemaining > 0)) {
            String line = lines.get(index);
            if (line.startsWith("\\")) {
                index++;
                continue;
            }
            char prefix = line.isEmpty() ? ' ' : line.charAt(0);
            String content = line.isEmpty() ? "" : line.substring(1);
            if (prefix == ' ' && oldRemaining > 0 && newRemaining > 0) {
                diffLines.add(DiffLine.context(content, oldLine++, newLine++));
                oldRemaining--;
                newRemaining--;
            } else if (prefix == '-' && oldRemaining > 0) {
                diffLines.add(DiffLine.removed(content, oldLine++));
                oldRemaining--;
            } else if (prefix == '+' && newRemaining > 0) {
                diffLines.add(DiffLine.added(content, newLine++));
                newRemaining--;
            } else {
                throw new MalformedDiffException(
                        "Unexpected line in hunk " + header + ": " + line);
            }
            index++;
        }
        if (oldRemaining > 0 || newRemaining > 0) {
            throw new MalformedDiffException("Truncated hunk " + header);
        }
        while (index < lines.size() && lines.get(index).startsWith("\\")) {
            index++;
        }
        hunks.add(new Hunk(oldStart, oldCount, newStart, newCount, diffLines));
        return index;
    }

    private static void addSection(List<FileDiff> files, FileSection section) {
        if (section != null) {
            files.add(section.toFileDiff());
        }
    }

    private static String stripPath(String raw) {
        String path = raw;
        int tab = path.indexOf('\t');
        if (tab >= 0) {
            path = path.substring(0, tab);
        }
        if (path.equals(DEV_NULL)) {
            return null;
        }
        if (path.startsWith("a/") || path.startsWith("b/")) {
            return path.substring(2);
        }
        return path;
    }

    private static final class FileSection {
        private String oldPath;
        private String newPath;
        private boolean sawFileHeaders;
        private boolean added;
        private boolean deleted;
        private final List<Hunk> hunks = new ArrayList<>();

        static FileSection fromGitHeader(String line) {
            FileSection section = new FileSection();
            String paths = line.substring("diff --git ".length());
            int split = paths.lastIndexOf(" b/");
            if (split >= 0) {
                section.oldPath = stripPath(paths.substring(0, split));
                section.newPath = stripPath(paths.substring(split + 1));
            }
            return section;
        }

        void readExtendedHeader(String line) {
            if (line.startsWith("new file mode")) {
                added = true;
            } else if (line.startsWith("deleted file mode")) {
                deleted = true;
            } else if (line.startsWith("rename from ")) {
                oldPath = line.substring("rename from ".length());
            } else if (line.startsWith("rename to ")) {
                newPath = line.substring("rename to ".length());
            }
        }

        FileDiff toFileDiff() {
            return new FileDiff(added ? null : oldPath, deleted ? null : newPath, hunks);
        }
    }
}
