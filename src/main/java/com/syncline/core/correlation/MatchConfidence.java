package com.syncline.core.correlation;

/**
 * How strongly a canonical entity was tied to an optimistic one.
 */
public enum MatchConfidence {
    /** Same id. */
    EXACT,
    /** Structural correlation (parent, role, time window, call id...). */
    CORRELATION,
    /** Heuristic match; reserved, no current strategy produces it. */
    FUZZY
}
