package com.example.effectivediff.application;

/**
 * The input diff is internally inconsistent and cannot be reduced.
 */
public class MalformedDiffException extends IllegalArgumentException {
    public MalformedDiffException(String message) {
        super(message);
    }
}
