package com.example.effectivediff.infrastructure;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import org.springframework.stereotype.Component;

/**
 * Renders the diff model as {@code git diff} style text that {@link UnifiedDiffParser} reads back.
 */
@Component
public class UnifiedDiffWriter {

    public String write(GitDiff gitDiff) {
        StringBuilder out = new StringBuilder();
        for (FileDiff file : gitDiff.files()) {
            writeFile(file, out);
        }
        return out.toString();
    }

    private void writeFile(FileDiff file, StringBuilder out) {
        String oldName = file.oldPath() != null ? file.oldPath() : file.newPath();
        String newName = file.newPath() != null ? file.newPath() : file.oldPath();
        out.append("diff --git a/").append(oldName).append(" b/").append(newName).append('\n');
        if (file.isAdded()) {
            out.append("new file mode 100644\n");
        } else if (file.isDeleted()) {
            out.append("deleted file mode 100644\n");
        } else if (!file.oldPath().equals(file.newPath())) {
            out.append("rename from ").append(file.oldPath()).append('\n');
            out.append("rename to ").append(file.newPath()).append('\n');
        }
        if (file.hunks().isEmpty()) {
            return;
        }
        out.append("--- ").append(file.isAdded() ? "/dev/null" : "a/" + file.oldPath()).append('\n');
        out.append("+++ ").append(file.isDeleted() ? "/dev/null" : "b/" + file.newPath()).append('\n');
        for (Hunk hunk : file.hunks()) {
            out.append(hunk.header()).append('\n');
            for (DiffLine line : hunk.lines()) {
                out.append(line.status().prefix()).append(line.content()).append('\n');
            }
        }
    }
}
