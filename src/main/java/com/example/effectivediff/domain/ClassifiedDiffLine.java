package com.example.effectivediff.domain;

public record ClassifiedDiffLine(String filePath, DiffLine line, LineClassification classification) {}
