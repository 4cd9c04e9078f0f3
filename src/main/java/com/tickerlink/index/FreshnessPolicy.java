package com.tickerlink.index;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Age rules for indexed analysis: the freshness window and the recency weight used when ranking.
 */
public final class FreshnessPolicy {
    public static final Duration DEFAULT_WINDOW = Duration.ofDays(7);

    private final Duration window;
    private final Clock clock;

    public FreshnessPolicy(Duration window, Clock clock) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("freshness window must be positive: " + window);
        }
        this.window = window;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Duration ageOf(Instant timestamp) {
        Duration age = Duration.between(timestamp, clock.instant());
        return age.isNegative() ? Duration.ZERO : age;
    }

    /** Stale means strictly older than the window. */
    public boolean isFresh(Instant timestamp) {
        return ageOf(timestamp).compareTo(window) <= 0;
    }

    public double timeDecay(Instant timestamp) {
        Duration age = ageOf(timestamp);
        if (age.compareTo(Duration.ofHours(1)) <= 0) {
            return 1.0;
        }
        if (age.compareTo(Duration.ofHours(6)) <= 0) {
            return 0.8;
        }
        if (age.compareTo(Duration.ofHours(24)) <= 0) {
            return 0.6;
        }
        if (age.compareTo(Duration.ofHours(72)) <= 0) {
            return 0.4;
        }
        return 0.2;
    }
}
