package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.Hunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-diffs the padded residual regions of one file pair and returns the resulting hunks in
 * absolute line numbers. Moved lines stay in the residual text; removing them from the output is
 * the reconstructor's job.
 */
@Component
public class RegionRediffer {
    private static final Logger log = LogManager.getLogger(RegionRediffer.class);

    private final int contextPadding;

    public RegionRediffer(EffectiveDiffProperties properties) {
        properties.validate();
        this.contextPadding = properties.getContextPadding();
    }

    public List<Hunk> rediff(FileDiff file, String oldText, String newText, Rediffer rediffer)
            throws RediffException, ContentMismatchException {
        List<String> oldLines = TextLines.split(oldText);
        List<String> newLines = TextLines.split(newText);
        verifyContent(file, oldLines, newLines);

        List<ResidualRegion> regions =
                ResidualRegion.plan(file.hunks(), oldLines.size(), newLines.size(), contextPadding);
        List<Hunk> absolute = new ArrayList<>();
        for (ResidualRegion region : regions) {
            List<Hunk> local = rediffer.rediff(region.oldText(oldLines), region.newText(newLines));
            for (Hunk hunk : local) {
                absolute.add(region.toAbsolute(hunk));
            }
        }
        log.debug(
                "Re-diffed {} in {} region(s): {} hunk(s) before, {} after",
                file.path(),
                regions.size(),
                file.hunks().size(),
                absolute.size());
        return absolute;
    }

    private void verifyContent(FileDiff file, List<String> oldLines, List<String> newLines)
            throws ContentMismatchException {
        for (Hunk hunk : file.hunks()) {
            for (DiffLine line : hunk.lines()) {
                if (line.isOldSide()) {
                    checkLine(file, "old", oldLines, line.oldLineNumber(), line.content());
                }
                if (line.isNewSide()) {
                    checkLine(file, "new", newLines, line.newLineNumber(), line.content());
                }
            }
        }
    }

    private void checkLine(
            FileDiff file, String side, List<String> lines, int lineNumber, String expected)
            throws ContentMismatchException {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            throw new ContentMismatchException(
                    String.format(
                            "%s %s line %d is beyond the end of the file (%d lines)",
                            file.path(), side, lineNumber, lines.size()));
        }
        if (!lines.get(lineNumber - 1).equals(expected)) {
            throw new ContentMismatchException(
                    String.format(
                            "%s %s line %d differs from the diff", file.path(), side, lineNumber));
        }
    }
}
