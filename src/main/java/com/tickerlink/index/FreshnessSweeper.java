package com.tickerlink.index;

import com.tickerlink.symbol.SymbolAllowlist;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically prunes stale index entries and expired learned symbols on one daemon thread.
 */
public final class FreshnessSweeper implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(FreshnessSweeper.class);

    private final AnalysisIndex index;
    private final SymbolAllowlist allowlist;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public FreshnessSweeper(AnalysisIndex index, SymbolAllowlist allowlist, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("sweep interval must be positive: " + interval);
        }
        this.index = index;
        this.allowlist = allowlist;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "freshness-sweeper");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
    }

    /** One sweep; returns the number of index rows removed. */
    public int sweepOnce() {
        int removed = index.pruneStale();
        int expired = allowlist == null ? 0 : allowlist.pruneExpired();
        if (removed > 0 || expired > 0) {
            LOG.info("sweep removed {} stale records, {} learned symbols", removed, expired);
        }
        return removed;
    }

    private void sweepSafely() {
        try {
            sweepOnce();
        } catch (RuntimeException e) {
            LOG.error("freshness sweep failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("freshness sweeper did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }
}
