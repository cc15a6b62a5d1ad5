package com.example.effectivediff.domain;

public enum FailureReason {
    REDIFF_FAILED,
    CONTENT_UNAVAILABLE,
    CONTENT_MISMATCH,
    WORKER_FAILED
}
