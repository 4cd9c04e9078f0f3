package com.tickerlink.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * One ticker found in a message.
 */
public final class Candidate {
    public static final Comparator<Candidate> DISPLAY_ORDER = Comparator
            .comparingInt((Candidate c) -> c.priority.order())
            .thenComparing(Comparator.comparingDouble((Candidate c) -> c.confidence).reversed())
            .thenComparingInt(c -> c.sourceOffset);

    public final String ticker;
    public final double confidence;
    public final int sourceOffset;
    public final Priority priority;

    public Candidate(String ticker, double confidence, int sourceOffset, Priority priority) {
        this.ticker = ticker == null ? "" : ticker;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.sourceOffset = Math.max(0, sourceOffset);
        this.priority = priority == null ? Priority.REGULAR : priority;
    }

    /**
     * True when this candidate should replace {@code other} during dedupe.
     */
    public boolean beats(Candidate other) {
        if (other == null) {
            return true;
        }
        if (confidence != other.confidence) {
            return confidence > other.confidence;
        }
        return priority.order() < other.priority.order();
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s(%.2f,%s)", ticker, confidence, priority.name().toLowerCase(Locale.ROOT));
    }
}
