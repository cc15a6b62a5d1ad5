package com.example.effectivediff.application;

import com.example.effectivediff.domain.EffectiveDiffPipelineResult;
import com.example.effectivediff.domain.FailureReason;
import com.example.effectivediff.domain.FileDiff;
import com.example.effectivediff.domain.FileFailure;
import com.example.effectivediff.domain.GitDiff;
import com.example.effectivediff.domain.Hunk;
import com.example.effectivediff.domain.MoveCandidate;
import com.example.effectivediff.domain.MoveReport;
import com.example.effectivediff.domain.PipelineDiagnostics;
import com.example.effectivediff.domain.StepTiming;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the whole engine on one diff: validation, line extraction and matching, block
 * aggregation, per-file re-diffing, reconstruction and the move report.
 *
 * <p>Nothing escapes a run. A file pair that cannot be re-diffed keeps its original hunks and
 * every move touching it is withdrawn; anything else that goes wrong returns the input diff
 * unchanged with an empty report. Per-file re-diffs run on a fixed pool and are collected in file
 * order, so results never depend on completion order.
 */
@Service
public class EffectiveDiffPipeline implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(EffectiveDiffPipeline.class);

    private final DiffValidator diffValidator;
    private final LineExtractor lineExtractor;
    private final LineMatcher lineMatcher;
    private final BlockAggregator blockAggregator;
    private final RegionRediffer regionRediffer;
    private final DiffReconstructor diffReconstructor;
    private final MoveReportBuilder moveReportBuilder;
    private final Rediffer defaultRediffer;
    private final ExecutorService executor;

    public EffectiveDiffPipeline(
            DiffValidator diffValidator,
            LineExtractor lineExtractor,
            LineMatcher lineMatcher,
            BlockAggregator blockAggregator,
            RegionRediffer regionRediffer,
            DiffReconstructor diffReconstructor,
            MoveReportBuilder moveReportBuilder,
            Rediffer defaultRediffer,
            EffectiveDiffProperties properties) {
        properties.validate();
        this.diffValidator = diffValidator;
        this.lineExtractor = lineExtractor;
        this.lineMatcher = lineMatcher;
        this.blockAggregator = blockAggregator;
        this.regionRediffer = regionRediffer;
        this.diffReconstructor = diffReconstructor;
        this.moveReportBuilder = moveReportBuilder;
        this.defaultRediffer = defaultRediffer;
        this.executor = Executors.newFixedThreadPool(properties.effectiveThreadPoolSize());
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(List<StepTiming> timings, String label, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        timings.add(new StepTiming(label, seconds));
        log.info("{} in {}s", label, seconds);
        return seconds;
    }

    /**
     * Runs the engine with file contents taken from two path-keyed maps. Every failure during the
     * run ends in a per-file degradation or in a fallback to {@code gitDiff}; only a missing
     * argument escapes.
     *
     * @throws NullPointerException if any argument is {@code null}; checked before the run starts
     */
    public EffectiveDiffPipelineResult runEffectiveDiffPipeline(
            GitDiff gitDiff,
            Map<String, String> oldFileContents,
            Map<String, String> newFileContents,
            Rediffer rediffer) {
        Objects.requireNonNull(oldFileContents, "oldFileContents");
        Objects.requireNonNull(newFileContents, "newFileContents");
        return run(gitDiff, FileContentProvider.fromMaps(oldFileContents, newFileContents), rediffer);
    }

    public EffectiveDiffPipelineResult run(GitDiff gitDiff, FileContentProvider contents) {
        return run(gitDiff, contents, defaultRediffer);
    }

    /**
     * Same contract as {@link #runEffectiveDiffPipeline}, reading contents through a provider.
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public EffectiveDiffPipelineResult run(
            GitDiff gitDiff, FileContentProvider contents, Rediffer rediffer) {
        Objects.requireNonNull(gitDiff, "gitDiff");
        Objects.requireNonNull(contents, "contents");
        Objects.requireNonNull(rediffer, "rediffer");

        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();
        try {
            return reduce(gitDiff, contents, rediffer, timings, overallStart);
        } catch (MalformedDiffException e) {
            log.warn("Malformed diff {}, returning it unreduced: {}", gitDiff.commitHash(), e.getMessage());
            return fallback(gitDiff, timings, overallStart, "Malformed diff: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Effective diff run for {} interrupted, returning the diff unreduced", gitDiff.commitHash());
            return fallback(gitDiff, timings, overallStart, "Interrupted");
        } catch (RuntimeException e) {
            log.warn("Effective diff run for {} failed, returning the diff unreduced", gitDiff.commitHash(), e);
            return fallback(gitDiff, timings, overallStart, "Unexpected failure: " + e);
        }
    }

    private EffectiveDiffPipelineResult reduce(
            GitDiff gitDiff,
            FileContentProvider contents,
            Rediffer rediffer,
            List<StepTiming> timings,
            long overallStart)
            throws InterruptedException {
        long validateStart = System.nanoTime();
        diffValidator.validate(gitDiff);
        recordStep(timings, "Validate diff", validateStart);

        long extractStart = System.nanoTime();
        ExtractedLines lines = lineExtractor.extract(gitDiff);
        recordStep(timings, "Extract changed lines", extractStart);

        long matchStart = System.nanoTime();
        LineMatches matches = lineMatcher.match(lines);
        recordStep(timings, "Match removed and added lines", matchStart);

        long aggregateStart = System.nanoTime();
        List<MoveCandidate> candidates = blockAggregator.aggregate(matches);
        recordStep(timings, "Aggregate move blocks", aggregateStart);

        if (candidates.isEmpty()) {
            double totalSeconds = nanosToSeconds(System.nanoTime() - overallStart);
            log.info(
                    "No moves in {} ({} files, {} changed lines) in {}s",
                    gitDiff.commitHash(),
                    gitDiff.files().size(),
                    gitDiff.changedLineCount(),
                    totalSeconds);
            return new EffectiveDiffPipelineResult(
                    gitDiff,
                    moveReportBuilder.build(List.of(), gitDiff),
                    PipelineDiagnostics.completed(timings, totalSeconds, List.of()));
        }

        MovedLines moved = new MovedLines(candidates);
        long rediffStart = System.nanoTime();
        Map<FileDiff, FileRediffOutcome> outcomes = rediffTouchedFiles(gitDiff, moved, contents, rediffer);
        recordStep(timings, "Re-diff residual regions", rediffStart);

        long reconstructStart = System.nanoTime();
        List<FileDiff> failedFiles = new ArrayList<>();
        List<FileFailure> failures = new ArrayList<>();
        for (FileRediffOutcome outcome : outcomes.values()) {
            if (outcome.isFailed()) {
                failedFiles.add(outcome.file());
                failures.add(outcome.failure());
            }
        }
        MovedLines accepted = moved.without(failedFiles);
        if (accepted.moves().size() < moved.moves().size()) {
            log.warn(
                    "Withdrew {} move(s) touching {} degraded file(s)",
                    moved.moves().size() - accepted.moves().size(),
                    failedFiles.size());
        }
        GitDiff effectiveDiff = reconstruct(gitDiff, outcomes, accepted);
        recordStep(timings, "Reconstruct effective diff", reconstructStart);

        long reportStart = System.nanoTime();
        MoveReport report = moveReportBuilder.build(accepted.moves(), effectiveDiff);
        recordStep(timings, "Build move report", reportStart);

        double totalSeconds = nanosToSeconds(System.nanoTime() - overallStart);
        log.info(
                "Effective diff for {}: {} files, {} candidates, {} moves, {} lines moved, {} lines changed, in {}s",
                gitDiff.commitHash(),
                gitDiff.files().size(),
                candidates.size(),
                report.movesDetected(),
                report.totalLinesMoved(),
                report.totalLinesEffectivelyChanged(),
                totalSeconds);
        return new EffectiveDiffPipelineResult(
                effectiveDiff, report, PipelineDiagnostics.completed(timings, totalSeconds, failures));
    }

    private Map<FileDiff, FileRediffOutcome> rediffTouchedFiles(
            GitDiff gitDiff, MovedLines moved, FileContentProvider contents, Rediffer rediffer)
            throws InterruptedException {
        List<FileDiff> touched = gitDiff.files().stream().filter(moved::touches).toList();
        List<Future<FileRediffOutcome>> futures = new ArrayList<>(touched.size());
        for (FileDiff file : touched) {
            futures.add(executor.submit(() -> rediffFile(file, contents, rediffer)));
        }

        Map<FileDiff, FileRediffOutcome> outcomes = new LinkedHashMap<>();
        try {
            for (int i = 0; i < touched.size(); i++) {
                FileDiff file = touched.get(i);
                try {
                    outcomes.put(file, futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.warn("Re-diff worker for {} failed, keeping its original hunks", file.path(), cause);
                    outcomes.put(
                            file,
                            FileRediffOutcome.failed(
                                    file, new FileFailure(file.path(), FailureReason.WORKER_FAILED, String.valueOf(cause))));
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }
        return outcomes;
    }

    private FileRediffOutcome rediffFile(FileDiff file, FileContentProvider contents, Rediffer rediffer) {
        try {
            String oldText = file.isAdded() ? "" : contents.read(file.oldPath(), FileContentProvider.Revision.OLD);
            String newText = file.isDeleted() ? "" : contents.read(file.newPath(), FileContentProvider.Revision.NEW);
            List<Hunk> hunks = regionRediffer.rediff(file, oldText, newText, rediffer);
            return FileRediffOutcome.succeeded(file, hunks);
        } catch (NoSuchFileException e) {
            return degraded(file, FailureReason.CONTENT_UNAVAILABLE, "Missing file content " + e.getMessage());
        } catch (IOException e) {
            return degraded(file, FailureReason.CONTENT_UNAVAILABLE, "Could not read file content: " + e.getMessage());
        } catch (ContentMismatchException e) {
            return degraded(file, FailureReason.CONTENT_MISMATCH, e.getMessage());
        } catch (RediffException e) {
            return degraded(file, FailureReason.REDIFF_FAILED, e.getMessage());
        }
    }

    private FileRediffOutcome degraded(FileDiff file, FailureReason reason, String message) {
        log.warn("Keeping original hunks of {} ({}): {}", file.path(), reason, message);
        return FileRediffOutcome.failed(file, new FileFailure(file.path(), reason, message));
    }

    private GitDiff reconstruct(GitDiff gitDiff, Map<FileDiff, FileRediffOutcome> outcomes, MovedLines accepted) {
        List<FileDiff> files = new ArrayList<>();
        for (FileDiff file : gitDiff.files()) {
            if (!accepted.touches(file)) {
                files.add(file);
                continue;
            }
            FileRediffOutcome outcome = outcomes.get(file);
            FileDiff reduced =
                    outcome != null && !outcome.isFailed()
                            ? diffReconstructor.reconstruct(file, outcome.hunks(), accepted)
                            : diffReconstructor.filter(file, accepted);
            if (reduced.hunks().isEmpty()) {
                log.debug("Dropping {}: every change is part of a move", file.path());
                continue;
            }
            files.add(reduced);
        }
        files.sort(Comparator.comparing(FileDiff::path));
        return new GitDiff(gitDiff.commitHash(), files);
    }

    private EffectiveDiffPipelineResult fallback(
            GitDiff gitDiff, List<StepTiming> timings, long overallStart, String reason) {
        double totalSeconds = nanosToSeconds(System.nanoTime() - overallStart);
        return new EffectiveDiffPipelineResult(
                gitDiff, MoveReport.empty(), PipelineDiagnostics.fellBack(timings, totalSeconds, reason));
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
