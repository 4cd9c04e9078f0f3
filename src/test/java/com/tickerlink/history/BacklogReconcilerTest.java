package com.tickerlink.history;

import com.tickerlink.config.Config;
import com.tickerlink.config.Lexicon;
import com.tickerlink.core.RunTelemetry;
import com.tickerlink.index.AnalysisIndex;
import com.tickerlink.index.FreshnessPolicy;
import com.tickerlink.model.AnalysisRecord;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.pipeline.MessageAnalyzer;
import com.tickerlink.source.ContentLinkExtractor;
import com.tickerlink.source.JsonHistorySource;
import com.tickerlink.source.MessageUrls;
import com.tickerlink.symbol.SymbolExtractor;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BacklogReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-06-10T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final String ANALYSIS = "NVDA analysis: bullish continuation after the breakout above resistance."
            + " Price target 150 while the 50 day average holds as support, volume confirms the move"
            + " and the weekly chart shows a clean base. Watching the gap near 118 as the risk line,"
            + " a close below it invalidates the setup. Relative strength versus the index keeps improving"
            + " and sector peers confirm, so the plan stays the same into next week with a partial at 140"
            + " and a trailing stop under the rising ten day line.";

    @Test
    void reconcile_shouldKeepEarlierAnalysisOverLaterTickerList() {
        JsonHistorySource source = new JsonHistorySource(List.of(
                msg("1", "a1", "2024-06-10T09:00:00Z", ANALYSIS),
                msg("2", "a1", "2024-06-10T10:30:00Z", "NVDA / AMD / TSLA / META")
        ));

        ReconcileResult result = reconciler(Map.of(), source).reconcile(List.of("a1"), telemetry());

        assertEquals("1", result.records.get("NVDA").sourceMessageId);
        assertEquals("2", result.records.get("AMD").sourceMessageId);
        assertEquals(0.1, result.records.get("AMD").relevanceScore, 1e-9);

        AnalysisIndex index = new AnalysisIndex(20, new FreshnessPolicy(Duration.ofDays(7), CLOCK));
        index.loadFromBulk(result.records);
        assertEquals("1", index.latest("NVDA").orElseThrow().sourceMessageId);
    }

    @Test
    void shouldReplace_shouldBeQualityFirstInEitherOrder() {
        AnalysisRecord a = rec("A", "2024-06-10T10:00:00Z", 0.9);
        AnalysisRecord b = rec("B", "2024-06-10T11:00:00Z", 0.2);

        assertFalse(BacklogReconciler.shouldReplace(a, b, 0.1));
        assertTrue(BacklogReconciler.shouldReplace(b, a, 0.1));
    }

    @Test
    void shouldReplace_shouldPreferLaterTimestampWithinMargin() {
        AnalysisRecord early = rec("early", "2024-06-10T10:00:00Z", 0.8);
        AnalysisRecord late = rec("late", "2024-06-10T11:00:00Z", 0.7);
        AnalysisRecord sameTime = rec("same", "2024-06-10T10:00:00Z", 0.85);

        assertTrue(BacklogReconciler.shouldReplace(early, late, 0.1));
        assertFalse(BacklogReconciler.shouldReplace(late, early, 0.1));
        assertFalse(BacklogReconciler.shouldReplace(early, sameTime, 0.1));
        assertTrue(BacklogReconciler.shouldReplace(null, early, 0.1));
    }

    @Test
    void reconcile_shouldPageBackToCutoffAndSkipBots() {
        List<ChannelMessage> rows = new ArrayList<>();
        rows.add(msg("1", "a1", "2024-06-10T11:00:00Z", "AMD analysis with price target"));
        rows.add(msg("2", "a1", "2024-06-09T11:00:00Z", "SMCI analysis with price target"));
        rows.add(msg("3", "a1", "2024-06-08T11:00:00Z", "MU analysis with price target"));
        rows.add(ChannelMessage.builder().id("4").channelId("a1").authorId("bot").bot(true)
                .text("ARM analysis with price target").createdAt(Instant.parse("2024-06-07T11:00:00Z")).build());
        rows.add(msg("5", "a1", "2024-06-06T11:00:00Z", "AVGO analysis with price target"));
        rows.add(msg("6", "a1", "2024-05-20T11:00:00Z", "INTC analysis with price target"));

        ReconcileResult result = reconciler(Map.of("reconcile.page_size", 2), new JsonHistorySource(rows))
                .reconcile(List.of("a1"), telemetry());

        assertEquals(List.of("AVGO", "MU", "SMCI", "AMD"), new ArrayList<>(result.records.keySet()));
        assertEquals(5, result.messagesScanned);
    }

    @Test
    void reconcile_shouldSkipChannelWhenPageFetchFails() {
        JsonHistorySource good = new JsonHistorySource(List.of(msg("1", "a1", "2024-06-10T09:00:00Z", ANALYSIS)));
        ChannelHistorySource flaky = (channelId, beforeId, limit) -> {
            if (channelId.equals("broken")) {
                throw new IOException("HTTP 503");
            }
            return good.fetchPage(channelId, beforeId, limit);
        };
        RunTelemetry telemetry = telemetry();

        ReconcileResult result = reconciler(Map.of(), flaky).reconcile(List.of("broken", "a1"), telemetry);

        assertEquals(List.of("broken"), result.failedChannels);
        assertEquals(List.of("a1"), result.scannedChannels);
        assertTrue(result.records.containsKey("NVDA"));
        assertEquals(1, telemetry.errorsTotal());
        assertTrue(telemetry.getSummary().contains("channels_skipped=1"));
    }

    @Test
    void reconcile_shouldStopWhenCancelled() {
        JsonHistorySource source = new JsonHistorySource(List.of(msg("1", "a1", "2024-06-10T09:00:00Z", ANALYSIS)));

        ReconcileResult result = reconciler(Map.of(), source).reconcile(List.of("a1"), telemetry(), () -> true);

        assertTrue(result.cancelled);
        assertTrue(result.records.isEmpty());
    }

    @Test
    void reconcile_shouldApplyMinimumScore() {
        JsonHistorySource source = new JsonHistorySource(List.of(
                msg("1", "a1", "2024-06-10T10:30:00Z", "NVDA / AMD / TSLA / META")));

        ReconcileResult result = reconciler(Map.of("reconcile.min_score", 0.5), source)
                .reconcile(List.of("a1"), telemetry());

        assertTrue(result.records.isEmpty());
    }

    private static BacklogReconciler reconciler(Map<String, ?> overrides, ChannelHistorySource source) {
        Map<String, Object> values = new HashMap<>();
        values.put("reconcile.pace_ms", 0);
        values.putAll(overrides);
        Config config = Config.fromMap(Path.of("."), values);
        MessageAnalyzer analyzer = new MessageAnalyzer(
                new SymbolExtractor(Lexicon.defaults()), new MessageUrls("https://discord.com"), true);
        return new BacklogReconciler(config, source, analyzer, new QualityScorer(Lexicon.defaults()),
                new ContentLinkExtractor(), CLOCK);
    }

    private static RunTelemetry telemetry() {
        return new RunTelemetry("RECONCILE", NOW);
    }

    private static ChannelMessage msg(String id, String channel, String ts, String text) {
        return ChannelMessage.builder()
                .id(id)
                .channelId(channel)
                .guildId("g1")
                .authorId("u1")
                .text(text)
                .createdAt(Instant.parse(ts))
                .build();
    }

    private static AnalysisRecord rec(String id, String ts, double score) {
        return AnalysisRecord.builder()
                .sourceMessageId(id)
                .timestamp(Instant.parse(ts))
                .relevanceScore(score)
                .build();
    }
}
