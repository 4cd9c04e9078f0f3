package com.tickerlink.pipeline;

import com.tickerlink.model.AnalysisRecord;
import com.tickerlink.model.Candidate;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.model.MessageLinks;
import com.tickerlink.source.MessageUrls;
import com.tickerlink.symbol.SymbolExtractor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ticker extraction and record building shared by the live path and backlog reconciliation.
 */
public final class MessageAnalyzer {
    private final SymbolExtractor extractor;
    private final MessageUrls urls;
    private final boolean headlineOnly;

    public MessageAnalyzer(SymbolExtractor extractor, MessageUrls urls, boolean headlineOnly) {
        this.extractor = extractor;
        this.urls = urls;
        this.headlineOnly = headlineOnly;
    }

    public List<Candidate> candidates(ChannelMessage message) {
        if (message == null) {
            return List.of();
        }
        return extractor.extract(headlineOnly ? message.headline() : message.safeText());
    }

    public static List<String> tickersOf(List<Candidate> candidates) {
        List<String> out = new ArrayList<>();
        for (Candidate c : candidates) {
            out.add(c.ticker);
        }
        return out;
    }

    public AnalysisRecord toRecord(ChannelMessage message, List<String> tickers, double score, MessageLinks links) {
        MessageLinks safeLinks = links == null ? MessageLinks.NONE : links;
        return AnalysisRecord.builder()
                .sourceMessageId(message.getId())
                .sourceChannelId(message.getChannelId())
                .authorId(message.getAuthorId())
                .rawText(message.safeText())
                .tickers(tickers)
                .timestamp(message.getCreatedAt())
                .relevanceScore(score)
                .canonicalUrl(urls.canonical(message.getGuildId(), message.getChannelId(), message.getId()))
                .chartUrls(safeLinks.chartUrls)
                .attachmentUrls(safeLinks.attachmentUrls)
                .hasCharts(safeLinks.hasCharts)
                .build();
    }
}
