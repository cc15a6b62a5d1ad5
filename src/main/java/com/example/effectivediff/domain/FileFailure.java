package com.example.effectivediff.domain;

/**
 * A file pair that degraded to its original hunks.
 */
public record FileFailure(String path, FailureReason reason, String message) {}
