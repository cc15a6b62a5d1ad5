package com.example.effectivediff.application;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Content index produced by the {@link LineMatcher}: every removed line together with the added
 * lines of identical content, plus positional lookups on both sides.
 */
public class LineMatches {
    private final List<ExtractedLine> removedLines;
    private final Map<String, List<ExtractedLine>> addedByContent;
    private final Map<LineKey, ExtractedLine> removedByKey;
    private final Map<LineKey, ExtractedLine> addedByKey;

    LineMatches(
            List<ExtractedLine> removedLines,
            Map<String, List<ExtractedLine>> addedByContent,
            Map<LineKey, ExtractedLine> removedByKey,
            Map<LineKey, ExtractedLine> addedByKey) {
        this.removedLines = List.copyOf(removedLines);
        Map<String, List<ExtractedLine>> index = new HashMap<>();
        addedByContent.forEach((content, lines) -> index.put(content, List.copyOf(lines)));
        this.addedByContent = Collections.unmodifiableMap(index);
        this.removedByKey = Collections.unmodifiableMap(new HashMap<>(removedByKey));
        this.addedByKey = Collections.unmodifiableMap(new HashMap<>(addedByKey));
    }

    public List<ExtractedLine> removedLines() {
        return removedLines;
    }

    /** Added lines whose content equals the removed line's, in diff order. */
    public List<ExtractedLine> candidatesFor(ExtractedLine removed) {
        return addedByContent.getOrDefault(removed.content(), List.of());
    }

    /** Number of added lines carrying exactly this content. */
    public int addedFrequency(String content) {
        return addedByContent.getOrDefault(content, List.of()).size();
    }

    public ExtractedLine removedAt(LineKey key) {
        return removedByKey.get(key);
    }

    public ExtractedLine addedAt(LineKey key) {
        return addedByKey.get(key);
    }

    public int matchedPairCount() {
        int pairs = 0;
        for (ExtractedLine removed : removedLines) {
            pairs += candidatesFor(removed).size();
        }
        return pairs;
    }
}
