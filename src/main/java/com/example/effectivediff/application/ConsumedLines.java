package com.example.effectivediff.application;

import java.util.HashSet;
import java.util.Set;

/**
 * Lines already claimed by a selected move. One instance per aggregation pass; removed and added
 * positions are tracked separately because they live in different numberings.
 */
public class ConsumedLines {
    private final Set<LineKey> removed = new HashSet<>();
    private final Set<LineKey> added = new HashSet<>();

    public boolean isRemovedConsumed(LineKey key) {
        return removed.contains(key);
    }

    public boolean isAddedConsumed(LineKey key) {
        return added.contains(key);
    }

    public void consume(LineKey removedKey, LineKey addedKey) {
        removed.add(removedKey);
        added.add(addedKey);
    }

    public int size() {
        return removed.size() + added.size();
    }
}
