package com.example.effectivediff.application;

import com.example.effectivediff.domain.Hunk;

import java.util.List;

/**
 * Line-level diff between two texts. Returned hunks are numbered from line 1 of the given texts
 * and must carry line numbers on every line.
 */
public interface Rediffer {
    List<Hunk> rediff(String oldText, String newText) throws RediffException;
}
