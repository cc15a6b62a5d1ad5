package com.example.effectivediff.application;

import com.example.effectivediff.domain.LineRange;
import com.example.effectivediff.domain.MoveCandidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Grows matched line pairs into maximal contiguous blocks and selects non-overlapping moves,
 * longest first.
 *
 * <p>Every matched pair lies on exactly one maximal run: consecutive removed lines of one file
 * paired with consecutive added lines of one file, content equal line by line. Runs are only
 * started at pairs whose predecessor pair does not match, so each run is built once. Selection
 * pops the longest run (ties: source path, source start, target path, target start); a run that
 * lost lines to an earlier selection is split into its free segments and re-queued.
 */
@Component
public class BlockAggregator {
    private static final Logger log = LogManager.getLogger(BlockAggregator.class);

    private static final Comparator<Run> SELECTION_ORDER =
            Comparator.comparingInt(Run::length)
                    .reversed()
                    .thenComparing(Run::sourceFile)
                    .thenComparingInt(Run::sourceStart)
                    .thenComparing(Run::targetFile)
                    .thenComparingInt(Run::targetStart);

    private final int minBlockSize;
    private final int minSignificantLineLength;

    public BlockAggregator(EffectiveDiffProperties properties) {
        properties.validate();
        this.minBlockSize = properties.getMinBlockSize();
        this.minSignificantLineLength = properties.getMinSignificantLineLength();
    }

    public List<MoveCandidate> aggregate(LineMatches matches) {
        return aggregate(matches, new ConsumedLines());
    }

    public List<MoveCandidate> aggregate(LineMatches matches, ConsumedLines consumed) {
        PriorityQueue<Run> queue = new PriorityQueue<>(SELECTION_ORDER);
        for (ExtractedLine removed : matches.removedLines()) {
            for (ExtractedLine added : matches.candidatesFor(removed)) {
                if (continuesEarlierRun(matches, removed, added)) {
                    continue;
                }
                Run run = growRun(matches, removed, added);
                if (run.length() >= minBlockSize) {
                    queue.add(run);
                }
            }
        }

        List<MoveCandidate> accepted = new ArrayList<>();
        while (!queue.isEmpty()) {
            Run run = queue.poll();
            List<Run> free = freeSegments(run, consumed);
            if (free.size() == 1 && free.get(0).length() == run.length()) {
                List<String> contents = contentsOf(run, matches);
                if (!hasSignificantLine(contents)) {
                    log.debug("Discarding low-signal block {}", run);
                    continue;
                }
                for (int i = 0; i < run.length(); i++) {
                    consumed.consume(run.sourceKey(i), run.targetKey(i));
                }
                accepted.add(toCandidate(run, contents, matches));
                log.debug("Selected move {}", run);
            } else {
                for (Run segment : free) {
                    if (segment.length() >= minBlockSize) {
                        queue.add(segment);
                    }
                }
            }
        }
        return accepted;
    }

    private boolean continuesEarlierRun(
            LineMatches matches, ExtractedLine removed, ExtractedLine added) {
        ExtractedLine previousRemoved = matches.removedAt(removed.key().next(-1));
        ExtractedLine previousAdded = matches.addedAt(added.key().next(-1));
        return previousRemoved != null
                && previousAdded != null
                && previousRemoved.content().equals(previousAdded.content());
    }

    private Run growRun(LineMatches matches, ExtractedLine removed, ExtractedLine added) {
        int length = 1;
        while (true) {
            ExtractedLine nextRemoved = matches.removedAt(removed.key().next(length));
            ExtractedLine nextAdded = matches.addedAt(added.key().next(length));
            if (nextRemoved == null
                    || nextAdded == null
                    || !nextRemoved.content().equals(nextAdded.content())) {
                break;
            }
            length++;
        }
        return new Run(
                removed.path(), removed.lineNumber(), added.path(), added.lineNumber(), length);
    }

    private List<Run> freeSegments(Run run, ConsumedLines consumed) {
        List<Run> segments = new ArrayList<>();
        int segmentStart = -1;
        for (int i = 0; i <= run.length(); i++) {
            boolean free =
                    i < run.length()
                            && !consumed.isRemovedConsumed(run.sourceKey(i))
                            && !consumed.isAddedConsumed(run.targetKey(i));
            if (free && segmentStart < 0) {
                segmentStart = i;
            } else if (!free && segmentStart >= 0) {
                segments.add(run.slice(segmentStart, i));
                segmentStart = -1;
            }
        }
        return segments;
    }

    private List<String> contentsOf(Run run, LineMatches matches) {
        List<String> contents = new ArrayList<>(run.length());
        for (int i = 0; i < run.length(); i++) {
            contents.add(matches.removedAt(run.sourceKey(i)).content());
        }
        return contents;
    }

    private boolean hasSignificantLine(List<String> contents) {
        return contents.stream().anyMatch(c -> c.trim().length() >= minSignificantLineLength);
    }

    private MoveCandidate toCandidate(Run run, List<String> contents, LineMatches matches) {
        double score = MoveScorer.score(run.length(), MoveScorer.meanUniqueness(contents, matches));
        return new MoveCandidate(
                run.sourceFile(),
                new LineRange(run.sourceStart(), run.sourceStart() + run.length() - 1),
                run.targetFile(),
                new LineRange(run.targetStart(), run.targetStart() + run.length() - 1),
                run.length(),
                score);
    }

    record Run(String sourceFile, int sourceStart, String targetFile, int targetStart, int length) {

        LineKey sourceKey(int offset) {
            return new LineKey(sourceFile, sourceStart + offset);
        }

        LineKey targetKey(int offset) {
            return new LineKey(targetFile, targetStart + offset);
        }

        Run slice(int fromInclusive, int toExclusive) {
            return new Run(
                    sourceFile,
                    sourceStart + fromInclusive,
                    targetFile,
                    targetStart + fromInclusive,
                    toExclusive - fromInclusive);
        }
    }
}
