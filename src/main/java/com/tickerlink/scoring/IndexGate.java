package com.tickerlink.scoring;

import java.util.Locale;

/**
 * Decides whether a scored message is indexed. Accepted messages contribute all their
 * tickers, rejected ones contribute none.
 */
public class IndexGate {
    public static final double DEFAULT_THRESHOLD = 0.7;

    private final double threshold;

    public IndexGate(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("gate threshold out of range: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @param tickerList whether the list-pattern detector classified the message as a bare ticker list
     */
    public GateDecision evaluate(double score, int tickerCount, boolean tickerList) {
        StringBuilder reason = new StringBuilder();
        boolean accepted = true;

        if (tickerCount <= 0) {
            accepted = false;
            reason.append("no tickers; ");
        }
        if (tickerList) {
            reason.append("ticker list; ");
        }
        if (score < threshold) {
            accepted = false;
            reason.append(String.format(Locale.US, "score %.2f<%.2f; ", score, threshold));
        }

        String text = accepted ? String.format(Locale.US, "score %.2f>=%.2f", score, threshold) : reason.toString().trim();
        return new GateDecision(accepted, score, text);
    }
}
