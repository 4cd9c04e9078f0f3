package com.tickerlink.pipeline;

import java.util.List;
import java.util.Locale;

/**
 * What the live path did with one message.
 */
public final class IngestOutcome {
    public enum Status {
        INDEXED,
        REJECTED_SCORE,
        NO_TICKERS,
        SKIPPED_BOT,
        SKIPPED_CHANNEL,
        SKIPPED_AUTHOR
    }

    public final Status status;
    public final List<String> tickers;
    public final double score;
    public final String reason;

    private IngestOutcome(Status status, List<String> tickers, double score, String reason) {
        this.status = status;
        this.tickers = tickers == null ? List.of() : List.copyOf(tickers);
        this.score = score;
        this.reason = reason == null ? "" : reason;
    }

    static IngestOutcome skipped(Status status, String reason) {
        return new IngestOutcome(status, List.of(), 0.0, reason);
    }

    static IngestOutcome noTickers() {
        return new IngestOutcome(Status.NO_TICKERS, List.of(), 0.0, "no tickers");
    }

    static IngestOutcome rejected(List<String> tickers, double score, String reason) {
        return new IngestOutcome(Status.REJECTED_SCORE, tickers, score, reason);
    }

    static IngestOutcome indexed(List<String> tickers, double score, String reason) {
        return new IngestOutcome(Status.INDEXED, tickers, score, reason);
    }

    public boolean indexed() {
        return status == Status.INDEXED;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s tickers=%s score=%.2f reason=%s", status, tickers, score, reason);
    }
}
