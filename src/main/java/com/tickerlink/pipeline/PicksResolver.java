package com.tickerlink.pipeline;

import com.tickerlink.index.AnalysisIndex;
import com.tickerlink.model.Candidate;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.symbol.SymbolExtractor;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a top-picks post into the picks that have fresh analysis behind them.
 */
public final class PicksResolver {
    private final SymbolExtractor extractor;
    private final AnalysisIndex index;

    public PicksResolver(SymbolExtractor extractor, AnalysisIndex index) {
        this.extractor = extractor;
        this.index = index;
    }

    public List<Candidate> resolve(ChannelMessage message) {
        if (message == null || message.isBot()) {
            return List.of();
        }
        List<Candidate> out = new ArrayList<>();
        for (Candidate pick : extractor.extractTopPicks(message.safeText())) {
            if (index.isFresh(pick.ticker)) {
                out.add(pick);
            }
        }
        return out;
    }
}
