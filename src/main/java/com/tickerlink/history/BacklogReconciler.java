package com.tickerlink.history;

import com.tickerlink.config.Config;
import com.tickerlink.core.RunTelemetry;
import com.tickerlink.model.AnalysisRecord;
import com.tickerlink.model.Candidate;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.model.MessageLinks;
import com.tickerlink.pipeline.MessageAnalyzer;
import com.tickerlink.source.LinkExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Rebuilds the per-ticker best analysis from channel history.
 *
 * <p>Each channel is paged backwards to the cutoff and scanned into its own map; that map
 * is merged into the result only once the channel's scan has finished. A failed page
 * drops the whole channel, a cancellation drops the channel in progress and stops.</p>
 *
 * <p>Merging is quality-first: a candidate replaces the retained record only when its
 * quality score is higher by more than the margin. Within the margin the later timestamp
 * wins and equal timestamps keep the retained record.</p>
 */
public final class BacklogReconciler {
    private static final Logger LOG = LogManager.getLogger(BacklogReconciler.class);
    private static final double EPSILON = 1e-9;

    private final ChannelHistorySource source;
    private final MessageAnalyzer analyzer;
    private final QualityScorer quality;
    private final LinkExtractor links;
    private final Clock clock;

    private final Duration lookback;
    private final int pageSize;
    private final int maxBatches;
    private final long paceMs;
    private final double margin;
    private final double minScore;

    public BacklogReconciler(
            Config config,
            ChannelHistorySource source,
            MessageAnalyzer analyzer,
            QualityScorer quality,
            LinkExtractor links,
            Clock clock
    ) {
        this.source = source;
        this.analyzer = analyzer;
        this.quality = quality;
        this.links = links;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.lookback = Duration.ofDays(Math.max(1, config.getInt("reconcile.days", 7)));
        this.pageSize = Math.max(1, Math.min(100, config.getInt("reconcile.page_size", 100)));
        this.maxBatches = Math.max(1, config.getInt("reconcile.max_batches", 50));
        this.paceMs = Math.max(0L, config.getLong("reconcile.pace_ms", 100L));
        this.margin = Math.max(0.0, config.getDouble("reconcile.quality_margin", 0.1));
        this.minScore = config.getDouble("reconcile.min_score", 0.0);
    }

    public ReconcileResult reconcile(List<String> channelIds, RunTelemetry telemetry) {
        return reconcile(channelIds, telemetry, () -> false);
    }

    public ReconcileResult reconcile(List<String> channelIds, RunTelemetry telemetry, BooleanSupplier cancelled) {
        Instant cutoff = clock.instant().minus(lookback);
        Map<String, AnalysisRecord> best = new HashMap<>();
        List<String> scanned = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int messages = 0;
        boolean stopped = false;

        for (String channelId : channelIds) {
            if (cancelled.getAsBoolean()) {
                stopped = true;
                break;
            }
            ChannelScan scan = scanChannel(channelId, cutoff, telemetry, cancelled);
            if (scan.cancelled) {
                stopped = true;
                break;
            }
            if (scan.failure != null) {
                failed.add(channelId);
                telemetry.channelSkipped(channelId, scan.failure);
                continue;
            }
            telemetry.startStep(RunTelemetry.STEP_MERGE);
            int replaced = 0;
            for (Map.Entry<String, AnalysisRecord> e : scan.best.entrySet()) {
                if (shouldReplace(best.get(e.getKey()), e.getValue(), margin)) {
                    best.put(e.getKey(), e.getValue());
                    replaced++;
                }
            }
            telemetry.endStep(RunTelemetry.STEP_MERGE, scan.best.size(), replaced, 0);
            telemetry.channelScanned(scan.messages);
            scanned.add(channelId);
            messages += scan.messages;
            LOG.info("channel {} scanned: {} messages, {} tickers", channelId, scan.messages, scan.best.size());
        }
        if (stopped) {
            telemetry.markCancelled();
            LOG.warn("reconciliation cancelled after {} channels", scanned.size());
        }

        List<Map.Entry<String, AnalysisRecord>> ordered = new ArrayList<>(best.entrySet());
        ordered.sort(Comparator.comparing((Map.Entry<String, AnalysisRecord> e) -> e.getValue().timestamp)
                .thenComparing(e -> e.getKey()));
        Map<String, AnalysisRecord> out = new LinkedHashMap<>();
        for (Map.Entry<String, AnalysisRecord> e : ordered) {
            out.put(e.getKey(), e.getValue());
        }
        return new ReconcileResult(out, scanned, failed, messages, stopped);
    }

    /**
     * Quality-first replacement rule; see the class comment.
     */
    public static boolean shouldReplace(AnalysisRecord retained, AnalysisRecord candidate, double margin) {
        if (candidate == null) {
            return false;
        }
        if (retained == null) {
            return true;
        }
        double diff = candidate.relevanceScore - retained.relevanceScore;
        if (diff > margin + EPSILON) {
            return true;
        }
        if (diff < -margin - EPSILON) {
            return false;
        }
        return candidate.timestamp.isAfter(retained.timestamp);
    }

    private ChannelScan scanChannel(String channelId, Instant cutoff, RunTelemetry telemetry, BooleanSupplier cancelled) {
        ChannelScan scan = new ChannelScan();
        String before = null;
        for (int batch = 0; batch < maxBatches; batch++) {
            if (batch > 0) {
                if (cancelled.getAsBoolean() || !pace()) {
                    scan.cancelled = true;
                    return scan;
                }
            }
            List<ChannelMessage> page;
            telemetry.startStep(RunTelemetry.STEP_HISTORY_FETCH);
            try {
                page = source.fetchPage(channelId, before, pageSize);
                telemetry.endStep(RunTelemetry.STEP_HISTORY_FETCH, 1, page.size(), 0);
            } catch (Exception e) {
                telemetry.endStep(RunTelemetry.STEP_HISTORY_FETCH, 1, 0, 1);
                LOG.warn("history fetch failed for channel {}: {}", channelId, e.getMessage());
                scan.failure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                return scan;
            }
            if (page.isEmpty()) {
                break;
            }
            boolean reachedCutoff = false;
            telemetry.startStep(RunTelemetry.STEP_EXTRACT);
            int kept = 0;
            for (ChannelMessage message : page) {
                if (message.getCreatedAt() == null || message.getCreatedAt().isBefore(cutoff)) {
                    reachedCutoff = true;
                    break;
                }
                scan.messages++;
                if (consider(message, scan.best)) {
                    kept++;
                }
            }
            telemetry.endStep(RunTelemetry.STEP_EXTRACT, page.size(), kept, 0);
            if (reachedCutoff || page.size() < pageSize) {
                break;
            }
            before = page.get(page.size() - 1).getId();
        }
        return scan;
    }

    private boolean consider(ChannelMessage message, Map<String, AnalysisRecord> channelBest) {
        if (message.isBot() || message.safeText().isBlank()) {
            return false;
        }
        List<Candidate> candidates = analyzer.candidates(message);
        if (candidates.isEmpty()) {
            return false;
        }
        MessageLinks found = links == null ? MessageLinks.NONE : links.extract(message);
        double score = quality.score(message.safeText(), found);
        if (score < minScore) {
            return false;
        }
        List<String> tickers = MessageAnalyzer.tickersOf(candidates);
        AnalysisRecord rec = analyzer.toRecord(message, tickers, score, found);
        boolean used = false;
        for (String ticker : tickers) {
            if (shouldReplace(channelBest.get(ticker), rec, margin)) {
                channelBest.put(ticker, rec);
                used = true;
            }
        }
        return used;
    }

    private boolean pace() {
        if (paceMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(paceMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class ChannelScan {
        private final Map<String, AnalysisRecord> best = new HashMap<>();
        private int messages;
        private String failure;
        private boolean cancelled;
    }
}
