package com.example.effectivediff.application;

public record ExtractedLine(String path, int lineNumber, String content) {

    public LineKey key() {
        return new LineKey(path, lineNumber);
    }
}
