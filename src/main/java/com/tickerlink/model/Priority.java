package com.tickerlink.model;

/**
 * Candidate ordering class. Declaration order is the sort order.
 */
public enum Priority {
    TOP_LONG,
    TOP_SHORT,
    REGULAR;

    public int order() {
        return ordinal();
    }
}
