package com.tickerlink.pipeline;

import com.tickerlink.config.Config;
import com.tickerlink.config.Lexicon;
import com.tickerlink.index.AnalysisIndex;
import com.tickerlink.index.FreshnessPolicy;
import com.tickerlink.model.AnalysisRecord;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.scoring.IndexGate;
import com.tickerlink.scoring.RelevanceScorer;
import com.tickerlink.source.ContentLinkExtractor;
import com.tickerlink.source.MessageUrls;
import com.tickerlink.symbol.SymbolAllowlist;
import com.tickerlink.symbol.SymbolExtractor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisPipelineTest {

    private static final Instant NOW = Instant.parse("2024-06-10T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final Lexicon lexicon = Lexicon.defaults();
    private final SymbolAllowlist allowlist = new SymbolAllowlist(lexicon, Duration.ofDays(7), CLOCK);
    private final AnalysisIndex index = new AnalysisIndex(20, new FreshnessPolicy(Duration.ofDays(7), CLOCK));
    private final AnalysisPipeline pipeline = pipeline(Map.of(
            "channels.analysis", "a1",
            "channels.discussion", "d1",
            "channels.notices", "n1",
            "discussion.manager_id", "mgr"
    ));

    @Test
    void onMessage_shouldIndexSubstantiveAnalysis() {
        IngestOutcome outcome = pipeline.onMessage(msg("m1", "a1", "u1",
                "$AAPL breakout above resistance, price target $200"));

        assertTrue(outcome.indexed());
        assertEquals(List.of("AAPL"), outcome.tickers);
        AnalysisRecord rec = index.latest("AAPL").orElseThrow();
        assertEquals("https://discord.com/channels/g1/a1/m1", rec.canonicalUrl);
        assertEquals(1.0, rec.relevanceScore, 1e-9);
        assertTrue(index.isFresh("AAPL"));
    }

    @Test
    void onMessage_shouldRejectBareTicker() {
        IngestOutcome outcome = pipeline.onMessage(msg("m1", "a1", "u1", "AAPL"));

        assertEquals(IngestOutcome.Status.REJECTED_SCORE, outcome.status);
        assertEquals(0.5, outcome.score, 1e-9);
        assertTrue(index.latest("AAPL").isEmpty());
    }

    @Test
    void onMessage_shouldRejectTickerLists() {
        IngestOutcome outcome = pipeline.onMessage(msg("m1", "a1", "u1", "AAPL / TSLA / NVDA / MSFT / AMZN / META / GOOGL"));

        assertEquals(IngestOutcome.Status.REJECTED_SCORE, outcome.status);
        assertEquals(0.1, outcome.score, 1e-9);
        assertTrue(index.allFreshTickers().isEmpty());
    }

    @Test
    void onMessage_shouldReportNoTickers() {
        assertEquals(IngestOutcome.Status.NO_TICKERS, pipeline.onMessage(msg("m1", "a1", "u1", "F alone")).status);
    }

    @Test
    void onMessage_shouldRouteByChannelAndAuthor() {
        String text = "$NVDA bullish analysis, price target 150";

        assertEquals(IngestOutcome.Status.SKIPPED_AUTHOR, pipeline.onMessage(msg("m1", "d1", "u1", text)).status);
        assertEquals(IngestOutcome.Status.SKIPPED_CHANNEL, pipeline.onMessage(msg("m2", "n1", "mgr", text)).status);
        assertEquals(IngestOutcome.Status.SKIPPED_CHANNEL, pipeline.onMessage(msg("m3", "other", "u1", text)).status);
        assertTrue(index.latest("NVDA").isEmpty());

        assertTrue(pipeline.onMessage(msg("m4", "d1", "mgr", text)).indexed());
        assertEquals("m4", index.latest("NVDA").orElseThrow().sourceMessageId);
    }

    @Test
    void onMessage_shouldSkipBots() {
        ChannelMessage bot = ChannelMessage.builder().id("m1").channelId("a1").authorId("b").bot(true)
                .text("$AAPL analysis target").createdAt(NOW).build();

        assertEquals(IngestOutcome.Status.SKIPPED_BOT, pipeline.onMessage(bot).status);
    }

    @Test
    void onMessage_shouldExtractTickersFromHeadlineOnly() {
        IngestOutcome outcome = pipeline.onMessage(msg("m1", "a1", "u1",
                "NVDA analysis bullish breakout\nalso watching AMD and SMCI"));

        assertTrue(outcome.indexed());
        assertEquals(List.of("NVDA"), outcome.tickers);
        assertTrue(index.latest("AMD").isEmpty());
    }

    @Test
    void onMessage_shouldLearnManagerSymbols() {
        pipeline.onMessage(msg("m1", "d1", "mgr", "adding $F here"));

        assertTrue(allowlist.isAllowed("F"));
        assertFalse(allowlist.isAllowed("WXYZ"));
    }

    @Test
    void onMessage_shouldAttachChartLinks() {
        ChannelMessage message = ChannelMessage.builder()
                .id("m9").channelId("a1").guildId("g1").authorId("u1")
                .text("$TSLA bullish analysis https://www.tradingview.com/x/AbCd/")
                .attachmentUrl("https://cdn.discordapp.com/attachments/1/2/chart.png")
                .createdAt(NOW)
                .build();

        assertTrue(pipeline.onMessage(message).indexed());

        AnalysisRecord rec = index.latest("TSLA").orElseThrow();
        assertTrue(rec.hasCharts);
        assertEquals(List.of("https://www.tradingview.com/x/AbCd/"), rec.chartUrls);
        assertEquals(1, rec.attachmentUrls.size());
    }

    @Test
    void onMessage_shouldTreatEveryUnroutedChannelAsAnalysisWhenNoneConfigured() {
        AnalysisPipeline open = pipeline(Map.of("channels.notices", "n1"));

        assertTrue(open.onMessage(msg("m1", "anything", "u1", "$AMD bullish analysis")).indexed());
        assertEquals(IngestOutcome.Status.SKIPPED_CHANNEL, open.onMessage(msg("m2", "n1", "u1", "$AMD analysis")).status);
    }

    private AnalysisPipeline pipeline(Map<String, ?> overrides) {
        Config config = Config.fromMap(Path.of("."), overrides);
        SymbolExtractor extractor = new SymbolExtractor(lexicon, allowlist, 25, null);
        MessageAnalyzer analyzer = new MessageAnalyzer(extractor, MessageUrls.fromConfig(config), true);
        return new AnalysisPipeline(config, analyzer, new RelevanceScorer(lexicon), new IndexGate(0.7), index,
                allowlist, new ContentLinkExtractor());
    }

    private static ChannelMessage msg(String id, String channel, String author, String text) {
        return ChannelMessage.builder()
                .id(id)
                .channelId(channel)
                .guildId("g1")
                .authorId(author)
                .text(text)
                .createdAt(NOW.minusSeconds(60))
                .build();
    }
}
