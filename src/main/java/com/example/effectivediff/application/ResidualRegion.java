package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.Hunk;

import java.util.ArrayList;
import java.util.List;

/**
 * A padded slice of one file pair that is handed to the re-differ. Offsets are the absolute
 * numbers of the first old and new line of the slice; a side may be empty.
 */
public record ResidualRegion(int oldOffset, int oldLength, int newOffset, int newLength) {

    /**
     * Pads every hunk by up to {@code padding} unchanged lines on each side and merges regions
     * that touch. Padding is the same on both sides so the unchanged lines stay aligned.
     */
    public static List<ResidualRegion> plan(
            List<Hunk> hunks, int oldFileLength, int newFileLength, int padding) {
        List<ResidualRegion> regions = new ArrayList<>();
        for (Hunk hunk : hunks) {
            int oldFirst = hunk.oldFirstLine();
            int newFirst = hunk.newFirstLine();
            int oldLast = hunk.oldLastLine();
            int newLast = hunk.newLastLine();
            int lead = Math.min(padding, Math.min(oldFirst - 1, newFirst - 1));
            int trail = Math.min(padding, Math.min(oldFileLength - oldLast, newFileLength - newLast));
            ResidualRegion region =
                    new ResidualRegion(
                            oldFirst - lead,
                            oldLast - oldFirst + 1 + lead + trail,
                            newFirst - lead,
                            newLast - newFirst + 1 + lead + trail);
            if (!regions.isEmpty() && regions.get(regions.size() - 1).touches(region)) {
                ResidualRegion previous = regions.remove(regions.size() - 1);
                region = previous.mergedWith(region);
            }
            regions.add(region);
        }
        return regions;
    }

    public int oldEnd() {
        return oldOffset + oldLength - 1;
    }

    public int newEnd() {
        return newOffset + newLength - 1;
    }

    public String oldText(List<String> oldLines) {
        return TextLines.join(oldLines.subList(oldOffset - 1, oldOffset - 1 + oldLength));
    }

    public String newText(List<String> newLines) {
        return TextLines.join(newLines.subList(newOffset - 1, newOffset - 1 + newLength));
    }

    /** Re-numbers a hunk produced for this region's text into absolute file lines. */
    public Hunk toAbsolute(Hunk local) {
        List<DiffLine> lines = new ArrayList<>(local.lines().size());
        for (DiffLine line : local.lines()) {
            lines.add(
                    new DiffLine(
                            line.status(),
                            line.content(),
                            line.oldLineNumber() == null ? null : oldOffset + line.oldLineNumber() - 1,
                            line.newLineNumber() == null ? null : newOffset + line.newLineNumber() - 1));
        }
        return new Hunk(
                oldOffset + local.oldStart() - 1,
                local.oldLineCount(),
                newOffset + local.newStart() - 1,
                local.newLineCount(),
                lines);
    }

    private boolean touches(ResidualRegion next) {
        return next.oldOffset <= oldEnd() + 1;
    }

    private ResidualRegion mergedWith(ResidualRegion next) {
        int oldEnd = Math.max(oldEnd(), next.oldEnd());
        int newEnd = Math.max(newEnd(), next.newEnd());
        return new ResidualRegion(
                oldOffset, oldEnd - oldOffset + 1, newOffset, newEnd - newOffset + 1);
    }
}
