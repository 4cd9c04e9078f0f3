package com.tickerlink.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * An indexed analysis message. Never mutated after construction.
 */
public final class AnalysisRecord {
    public final String sourceMessageId;
    public final String sourceChannelId;
    public final String authorId;
    public final String rawText;
    public final List<String> tickers;
    public final Instant timestamp;
    public final double relevanceScore;
    public final String canonicalUrl;
    public final List<String> chartUrls;
    public final List<String> attachmentUrls;
    public final boolean hasCharts;

    @Builder
    public AnalysisRecord(
            String sourceMessageId,
            String sourceChannelId,
            String authorId,
            String rawText,
            List<String> tickers,
            Instant timestamp,
            double relevanceScore,
            String canonicalUrl,
            List<String> chartUrls,
            List<String> attachmentUrls,
            boolean hasCharts
    ) {
        this.sourceMessageId = sourceMessageId == null ? "" : sourceMessageId;
        this.sourceChannelId = sourceChannelId == null ? "" : sourceChannelId;
        this.authorId = authorId == null ? "" : authorId;
        this.rawText = rawText == null ? "" : rawText;
        this.tickers = tickers == null ? List.of() : List.copyOf(tickers);
        this.timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        this.relevanceScore = Math.max(0.0, Math.min(1.0, relevanceScore));
        this.canonicalUrl = canonicalUrl == null ? "" : canonicalUrl;
        this.chartUrls = chartUrls == null ? List.of() : List.copyOf(chartUrls);
        this.attachmentUrls = attachmentUrls == null ? List.of() : List.copyOf(attachmentUrls);
        this.hasCharts = hasCharts;
    }

    @Override
    public String toString() {
        return "AnalysisRecord{id=" + sourceMessageId
                + ", tickers=" + tickers
                + ", ts=" + timestamp
                + ", score=" + relevanceScore + "}";
    }
}
