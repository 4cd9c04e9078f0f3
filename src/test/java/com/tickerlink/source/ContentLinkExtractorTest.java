package com.tickerlink.source;

import com.tickerlink.model.ChannelMessage;
import com.tickerlink.model.MessageLinks;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentLinkExtractorTest {

    private final ContentLinkExtractor extractor = new ContentLinkExtractor();

    @Test
    void extract_shouldKeepChartHostsAndImages() {
        ChannelMessage message = ChannelMessage.builder()
                .id("1")
                .text("setup https://www.tradingview.com/x/AbC/, news https://www.reuters.com/markets and"
                        + " https://i.imgur.com/zz.png. also https://example.org/c.JPG")
                .embedUrl("https://finviz.com/quote.ashx?t=NVDA")
                .createdAt(Instant.parse("2024-06-10T10:00:00Z"))
                .build();

        MessageLinks links = extractor.extract(message);

        assertEquals(List.of(
                "https://www.tradingview.com/x/AbC/",
                "https://i.imgur.com/zz.png",
                "https://example.org/c.JPG",
                "https://finviz.com/quote.ashx?t=NVDA"
        ), links.chartUrls);
        assertTrue(links.attachmentUrls.isEmpty());
        assertTrue(links.hasCharts);
    }

    @Test
    void extract_shouldPassAttachmentsThrough() {
        ChannelMessage message = ChannelMessage.builder()
                .id("1")
                .text("no links")
                .attachmentUrl("https://cdn.discordapp.com/a.pdf")
                .attachmentUrl("https://cdn.discordapp.com/a.pdf")
                .createdAt(Instant.parse("2024-06-10T10:00:00Z"))
                .build();

        MessageLinks links = extractor.extract(message);

        assertEquals(List.of("https://cdn.discordapp.com/a.pdf"), links.attachmentUrls);
        assertTrue(links.chartUrls.isEmpty());
        assertTrue(links.hasCharts);
    }

    @Test
    void extract_shouldReportNoChartsForPlainText() {
        assertFalse(extractor.extract(ChannelMessage.builder().id("1").text("NVDA").build()).hasCharts);
        assertSame(MessageLinks.NONE, extractor.extract(null));
        assertFalse(ContentLinkExtractor.isChartUrl("not a url"));
    }

    @Test
    void canonical_shouldUseUnknownForMissingGuild() {
        MessageUrls urls = new MessageUrls("https://discord.com/");

        assertEquals("https://discord.com/channels/g1/c1/m1", urls.canonical("g1", "c1", "m1"));
        assertEquals("https://discord.com/channels/unknown/c1/m1", urls.canonical(" ", "c1", "m1"));
    }
}
