package com.example.effectivediff.infrastructure;

import com.example.effectivediff.application.EffectiveDiffProperties;
import com.example.effectivediff.application.Rediffer;
import com.example.effectivediff.application.TextLines;
import com.example.effectivediff.domain.Hunk;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * In-process re-differ: Myers diff from java-diff-utils rendered as unified hunks.
 */
@Component
@Primary
public class DiffUtilsRediffer implements Rediffer {
    private final int contextLines;
    private final UnifiedDiffParser parser;

    public DiffUtilsRediffer(EffectiveDiffProperties properties, UnifiedDiffParser parser) {
        properties.validate();
        this.contextLines = properties.getRediffContextLines();
        this.parser = parser;
    }

    @Override
    public List<Hunk> rediff(String oldText, String newText) {
        List<String> originalLines = TextLines.split(oldText);
        List<String> revisedLines = TextLines.split(newText);
        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return List.of();
        }
        List<String> unified =
                UnifiedDiffUtils.generateUnifiedDiff(
                        "old", "new", originalLines, patch, contextLines);
        return anchored(parser.parseHunks(unified));
    }

    /**
     * Re-derives the start of every side that has no lines. Outside hunks the two sides are
     * aligned with a running offset, so the anchor follows from the other side.
     */
    private List<Hunk> anchored(List<Hunk> hunks) {
        List<Hunk> result = new ArrayList<>(hunks.size());
        int offset = 0;
        for (Hunk hunk : hunks) {
            int oldStart = hunk.oldStart();
            int newStart = hunk.newStart();
            if (hunk.oldLineCount() == 0 && hunk.newLineCount() > 0) {
                oldStart = hunk.newStart() - 1 - offset;
            } else if (hunk.newLineCount() == 0 && hunk.oldLineCount() > 0) {
                newStart = hunk.oldStart() - 1 + offset;
            }
            result.add(
                    new Hunk(oldStart, hunk.oldLineCount(), newStart, hunk.newLineCount(), hunk.lines()));
            offset += hunk.newLineCount() - hunk.oldLineCount();
        }
        return result;
    }
}
