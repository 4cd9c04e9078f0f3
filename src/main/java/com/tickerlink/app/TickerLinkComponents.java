package com.tickerlink.app;

import com.tickerlink.config.Config;
import com.tickerlink.config.Lexicon;
import com.tickerlink.history.BacklogReconciler;
import com.tickerlink.history.ChannelHistorySource;
import com.tickerlink.history.QualityScorer;
import com.tickerlink.history.RecentMessageFetcher;
import com.tickerlink.index.AnalysisIndex;
import com.tickerlink.index.FreshnessPolicy;
import com.tickerlink.index.FreshnessSweeper;
import com.tickerlink.pipeline.AnalysisPipeline;
import com.tickerlink.pipeline.MessageAnalyzer;
import com.tickerlink.pipeline.PicksResolver;
import com.tickerlink.scoring.IndexGate;
import com.tickerlink.scoring.RelevanceScorer;
import com.tickerlink.source.ContentLinkExtractor;
import com.tickerlink.source.LinkExtractor;
import com.tickerlink.source.MessageUrls;
import com.tickerlink.symbol.HistoryCorroborator;
import com.tickerlink.symbol.SymbolAllowlist;
import com.tickerlink.symbol.SymbolExtractor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Object graph for one process, assembled from {@link Config}.
 */
public final class TickerLinkComponents {
    public final Config config;
    public final Lexicon lexicon;
    public final SymbolAllowlist allowlist;
    public final SymbolExtractor extractor;
    public final RelevanceScorer scorer;
    public final IndexGate gate;
    public final AnalysisIndex index;
    public final LinkExtractor links;
    public final MessageAnalyzer analyzer;
    public final AnalysisPipeline pipeline;
    public final PicksResolver picks;
    public final Clock clock;

    private TickerLinkComponents(Config config, Clock clock, RecentMessageFetcher recentFetcher) {
        this.config = config;
        this.clock = clock;
        this.lexicon = Lexicon.fromConfig(config);
        this.allowlist = new SymbolAllowlist(
                lexicon,
                Duration.ofDays(Math.max(0, config.getInt("allowlist.learned_ttl_days", 7))),
                clock
        );

        HistoryCorroborator corroborator = null;
        if (recentFetcher != null && config.getBoolean("corroborate.enabled", false)) {
            corroborator = new HistoryCorroborator(
                    recentFetcher,
                    corroborationChannels(config),
                    config.getInt("corroborate.limit", 50),
                    config.getLong("corroborate.pace_ms", 100L)
            );
        }
        int maxCandidates = config.getInt("extract.max_candidates", SymbolExtractor.DEFAULT_MAX_CANDIDATES);
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("extract.max_candidates must be positive: " + maxCandidates);
        }
        this.extractor = new SymbolExtractor(lexicon, allowlist, maxCandidates, corroborator);
        this.scorer = new RelevanceScorer(lexicon);
        this.gate = new IndexGate(config.getDouble("relevance.gate", IndexGate.DEFAULT_THRESHOLD));
        this.index = new AnalysisIndex(
                config.getInt("index.history_cap", AnalysisIndex.DEFAULT_HISTORY_CAP),
                new FreshnessPolicy(Duration.ofDays(Math.max(1, config.getInt("index.freshness_days", 7))), clock)
        );
        this.links = new ContentLinkExtractor();
        this.analyzer = new MessageAnalyzer(
                extractor,
                MessageUrls.fromConfig(config),
                config.getBoolean("extract.headline_only", true)
        );
        this.pipeline = new AnalysisPipeline(config, analyzer, scorer, gate, index, allowlist, links);
        this.picks = new PicksResolver(extractor, index);
    }

    public static TickerLinkComponents build(Config config, Clock clock, RecentMessageFetcher recentFetcher) {
        return new TickerLinkComponents(config, clock == null ? Clock.systemUTC() : clock, recentFetcher);
    }

    /**
     * Analysis channels first, then discussion channels, without duplicates.
     */
    static List<String> corroborationChannels(Config config) {
        Set<String> channels = new LinkedHashSet<>(config.getList("channels.analysis"));
        channels.addAll(config.getList("channels.discussion"));
        return new ArrayList<>(channels);
    }

    public BacklogReconciler reconciler(ChannelHistorySource source) {
        return new BacklogReconciler(config, source, analyzer, new QualityScorer(lexicon), links, clock);
    }

    public FreshnessSweeper sweeper() {
        return new FreshnessSweeper(
                index,
                allowlist,
                Duration.ofMinutes(Math.max(1, config.getInt("index.sweep_interval_minutes", 60)))
        );
    }
}
