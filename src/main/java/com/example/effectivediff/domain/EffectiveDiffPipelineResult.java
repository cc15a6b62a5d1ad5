package com.example.effectivediff.domain;

import java.util.Objects;

/**
 * Output of one pipeline run. {@code diagnostics} is informational and not part of the persisted
 * artifacts.
 */
public record EffectiveDiffPipelineResult(
        GitDiff effectiveDiff, MoveReport moveReport, PipelineDiagnostics diagnostics) {

    public EffectiveDiffPipelineResult {
        Objects.requireNonNull(effectiveDiff, "effectiveDiff");
        Objects.requireNonNull(moveReport, "moveReport");
        Objects.requireNonNull(diagnostics, "diagnostics");
    }
}
