package com.example.effectivediff.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * What happened during a pipeline run: step timings, degraded file pairs and, when the whole run
 * fell back to the input diff, why.
 */
@Getter
@AllArgsConstructor
public class PipelineDiagnostics {
    private final List<StepTiming> steps;
    private final double totalDurationSeconds;
    private final List<FileFailure> fileFailures;
    private final boolean fallback;
    private final String fallbackReason;

    public static PipelineDiagnostics completed(
            List<StepTiming> steps, double totalDurationSeconds, List<FileFailure> fileFailures) {
        return new PipelineDiagnostics(
                List.copyOf(steps), totalDurationSeconds, List.copyOf(fileFailures), false, null);
    }

    public static PipelineDiagnostics fellBack(
            List<StepTiming> steps, double totalDurationSeconds, String reason) {
        return new PipelineDiagnostics(
                List.copyOf(steps), totalDurationSeconds, List.of(), true, reason);
    }
}
