package com.example.effectivediff.application;

/**
 * The file content handed to the engine does not agree with what the diff says about it.
 */
public class ContentMismatchException extends Exception {
    public ContentMismatchException(String message) {
        super(message);
    }
}
