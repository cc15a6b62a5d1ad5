package com.example.effectivediff.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Represents the elapsed time for a single pipeline step.
 */
@Getter
@ToString
@AllArgsConstructor
public class StepTiming {
    private final String label;
    private final double durationSeconds;
}
