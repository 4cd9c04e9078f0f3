package com.tickerlink.pipeline;

import com.tickerlink.config.Config;
import com.tickerlink.index.AnalysisIndex;
import com.tickerlink.model.AnalysisRecord;
import com.tickerlink.model.Candidate;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.model.MessageLinks;
import com.tickerlink.scoring.GateDecision;
import com.tickerlink.scoring.IndexGate;
import com.tickerlink.scoring.RelevanceScorer;
import com.tickerlink.source.LinkExtractor;
import com.tickerlink.symbol.SymbolAllowlist;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;

/**
 * Live path: route, extract, score, gate and index one message at a time.
 *
 * <p>Analysis channels are always processed; with no analysis channel configured, every
 * channel that is neither a discussion nor a notices channel counts as one. Discussion
 * channels are processed only for the configured manager, and with no manager configured
 * they are ignored. Notices posts belong to {@link PicksResolver}.</p>
 */
public final class AnalysisPipeline {
    private static final Logger LOG = LogManager.getLogger(AnalysisPipeline.class);

    private final MessageAnalyzer analyzer;
    private final RelevanceScorer scorer;
    private final IndexGate gate;
    private final AnalysisIndex index;
    private final SymbolAllowlist allowlist;
    private final LinkExtractor linkExtractor;
    private final Set<String> analysisChannels;
    private final Set<String> discussionChannels;
    private final Set<String> noticesChannels;
    private final String managerId;

    public AnalysisPipeline(
            Config config,
            MessageAnalyzer analyzer,
            RelevanceScorer scorer,
            IndexGate gate,
            AnalysisIndex index,
            SymbolAllowlist allowlist,
            LinkExtractor linkExtractor
    ) {
        this.analyzer = analyzer;
        this.scorer = scorer;
        this.gate = gate;
        this.index = index;
        this.allowlist = allowlist;
        this.linkExtractor = linkExtractor;
        this.analysisChannels = Set.copyOf(config.getList("channels.analysis"));
        this.discussionChannels = Set.copyOf(config.getList("channels.discussion"));
        this.noticesChannels = Set.copyOf(config.getList("channels.notices"));
        this.managerId = config.getString("discussion.manager_id");
    }

    public IngestOutcome onMessage(ChannelMessage message) {
        MessageLinks links = message == null || linkExtractor == null ? MessageLinks.NONE : linkExtractor.extract(message);
        return onMessage(message, links);
    }

    public IngestOutcome onMessage(ChannelMessage message, MessageLinks links) {
        if (message == null) {
            return IngestOutcome.skipped(IngestOutcome.Status.SKIPPED_CHANNEL, "null message");
        }
        if (message.isBot()) {
            return IngestOutcome.skipped(IngestOutcome.Status.SKIPPED_BOT, "bot author");
        }
        boolean fromManager = !managerId.isEmpty() && managerId.equals(message.getAuthorId());
        if (fromManager && allowlist != null) {
            allowlist.learnFrom(message.safeText());
        }

        String channelId = message.getChannelId();
        if (noticesChannels.contains(channelId)) {
            return IngestOutcome.skipped(IngestOutcome.Status.SKIPPED_CHANNEL, "notices channel");
        }
        if (discussionChannels.contains(channelId)) {
            if (!fromManager) {
                return IngestOutcome.skipped(IngestOutcome.Status.SKIPPED_AUTHOR, "discussion author is not the manager");
            }
        } else if (!analysisChannels.isEmpty() && !analysisChannels.contains(channelId)) {
            return IngestOutcome.skipped(IngestOutcome.Status.SKIPPED_CHANNEL, "unrouted channel");
        }

        List<Candidate> candidates = analyzer.candidates(message);
        if (candidates.isEmpty()) {
            return IngestOutcome.noTickers();
        }
        List<String> tickers = MessageAnalyzer.tickersOf(candidates);
        double score = scorer.score(message.safeText(), tickers.size(), message.isReply());
        GateDecision decision = gate.evaluate(score, tickers.size(), scorer.isTickerList(message.safeText()));
        if (!decision.accepted()) {
            LOG.debug("message {} rejected: {}", message.getId(), decision.reason());
            return IngestOutcome.rejected(tickers, score, decision.reason());
        }

        AnalysisRecord rec = analyzer.toRecord(message, tickers, score, links);
        for (String ticker : tickers) {
            index.record(ticker, rec);
        }
        LOG.info("indexed message {} for {} score={}", message.getId(), tickers, String.format("%.2f", score));
        return IngestOutcome.indexed(tickers, score, decision.reason());
    }
}
