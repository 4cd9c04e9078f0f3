package com.tickerlink.index;

import com.tickerlink.config.Lexicon;
import com.tickerlink.symbol.SymbolAllowlist;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreshnessSweeperTest {

    private static final Instant NOW = Instant.parse("2024-06-10T12:00:00Z");

    @Test
    void sweepOnce_shouldPruneStaleRecords() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AnalysisIndex index = new AnalysisIndex(20, new FreshnessPolicy(Duration.ofDays(7), clock));
        index.record("OLD", AnalysisIndexTest.rec("1", NOW.minus(Duration.ofDays(9)), 0.8));
        index.record("NEW", AnalysisIndexTest.rec("2", NOW.minus(Duration.ofDays(1)), 0.8));

        try (FreshnessSweeper sweeper = new FreshnessSweeper(
                index, new SymbolAllowlist(Lexicon.defaults(), Duration.ofDays(7), clock), Duration.ofMinutes(60))) {
            sweeper.start();
            assertEquals(1, sweeper.sweepOnce());
        }

        assertTrue(index.latest("OLD").isEmpty());
        assertTrue(index.isFresh("NEW"));
    }

    @Test
    void constructor_shouldRejectNonPositiveInterval() {
        AnalysisIndex index = new AnalysisIndex(20, new FreshnessPolicy(Duration.ofDays(7), Clock.systemUTC()));

        assertThrows(IllegalArgumentException.class, () -> new FreshnessSweeper(index, null, Duration.ZERO));
    }
}
