package com.tickerlink.symbol;

import com.tickerlink.model.Candidate;
import com.tickerlink.model.Priority;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Candidate in progress: a token plus the confidence accumulated so far.
 * Every rule returns a new instance.
 */
public final class ScoredToken {
    public final TokenMatch match;
    public final double confidence;
    public final List<String> notes;

    private ScoredToken(TokenMatch match, double confidence, List<String> notes) {
        this.match = match;
        this.confidence = confidence;
        this.notes = notes;
    }

    public static ScoredToken start(TokenMatch match) {
        return new ScoredToken(match, 0.0, List.of());
    }

    public ScoredToken plus(double delta, String note) {
        if (delta == 0.0) {
            return this;
        }
        List<String> next = new ArrayList<>(notes);
        next.add(String.format(Locale.US, "%s%+.2f", note, delta));
        return new ScoredToken(match, confidence + delta, List.copyOf(next));
    }

    public ScoredToken capped() {
        if (confidence <= 1.0) {
            return this;
        }
        return new ScoredToken(match, 1.0, notes);
    }

    public Candidate toCandidate() {
        return new Candidate(match.symbol, confidence, match.offset, Priority.REGULAR);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s=%.2f %s", match.symbol, confidence, notes);
    }
}
