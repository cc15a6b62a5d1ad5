package com.example.effectivediff.application;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the effective diff engine, bound from {@code effective-diff.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "effective-diff")
public class EffectiveDiffProperties {
    public static final int DEFAULT_MIN_BLOCK_SIZE = 3;
    public static final int DEFAULT_MIN_SIGNIFICANT_LINE_LENGTH = 3;
    public static final int DEFAULT_CONTEXT_PADDING = 3;
    public static final int DEFAULT_REDIFF_CONTEXT_LINES = 3;

    private int minBlockSize = DEFAULT_MIN_BLOCK_SIZE;
    private int minSignificantLineLength = DEFAULT_MIN_SIGNIFICANT_LINE_LENGTH;
    private int contextPadding = DEFAULT_CONTEXT_PADDING;
    private int rediffContextLines = DEFAULT_REDIFF_CONTEXT_LINES;
    private int threadPoolSize = 0;
    private String gitExecutable = "git";

    public void validate() {
        if (minBlockSize < 1) {
            throw new IllegalArgumentException("min-block-size must be at least 1");
        }
        if (minSignificantLineLength < 0) {
            throw new IllegalArgumentException("min-significant-line-length must not be negative");
        }
        if (contextPadding < 0) {
            throw new IllegalArgumentException("context-padding must not be negative");
        }
        if (rediffContextLines < 0) {
            throw new IllegalArgumentException("rediff-context-lines must not be negative");
        }
        if (threadPoolSize < 0) {
            throw new IllegalArgumentException("thread-pool-size must not be negative");
        }
    }

    public int effectiveThreadPoolSize() {
        int configured = threadPoolSize > 0 ? threadPoolSize : Runtime.getRuntime().availableProcessors();
        return Math.max(1, configured);
    }
}
