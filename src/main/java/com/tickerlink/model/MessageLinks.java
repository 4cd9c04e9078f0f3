package com.tickerlink.model;

import java.util.List;

/**
 * Chart and attachment URLs found on a message by a link extractor.
 */
public final class MessageLinks {
    public static final MessageLinks NONE = new MessageLinks(List.of(), List.of());

    public final List<String> chartUrls;
    public final List<String> attachmentUrls;
    public final boolean hasCharts;

    public MessageLinks(List<String> chartUrls, List<String> attachmentUrls) {
        this.chartUrls = chartUrls == null ? List.of() : List.copyOf(chartUrls);
        this.attachmentUrls = attachmentUrls == null ? List.of() : List.copyOf(attachmentUrls);
        this.hasCharts = !this.chartUrls.isEmpty() || !this.attachmentUrls.isEmpty();
    }
}
