package com.example.effectivediff.application;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Indexes added lines by exact content so each removed line finds its identical added lines in
 * one lookup. Nothing is filtered here, blank and one-character lines included.
 */
@Component
public class LineMatcher {

    public LineMatches match(ExtractedLines lines) {
        Map<String, List<ExtractedLine>> addedByContent = new LinkedHashMap<>();
        Map<LineKey, ExtractedLine> addedByKey = new HashMap<>();
        for (ExtractedLine added : lines.added()) {
            addedByContent.computeIfAbsent(added.content(), c -> new ArrayList<>()).add(added);
            addedByKey.put(added.key(), added);
        }
        Map<LineKey, ExtractedLine> removedByKey = new HashMap<>();
        for (ExtractedLine removed : lines.removed()) {
            removedByKey.put(removed.key(), removed);
        }
        return new LineMatches(lines.removed(), addedByContent, removedByKey, addedByKey);
    }
}
