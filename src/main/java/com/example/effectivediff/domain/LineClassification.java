package com.example.effectivediff.domain;

/**
 * Role of an original diff line once moves are known.
 */
public enum LineClassification {
    /** Added line that is not part of, nor next to, any move. */
    NEW,
    /** Added line that is the target side of a move. */
    MOVED,
    /**
     * Added line kept in the effective diff inside the padded window of a move target: an edit
     * made while moving.
     */
    CHANGED_IN_MOVE,
    /** Removed line that is not part of any move. */
    REMOVED,
    /** Removed line that is the source side of a move. */
    MOVED_REMOVAL,
    CONTEXT
}
