package com.tickerlink.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Inbound chat message as delivered by a live event or a history page.
 * Attachment and embed URLs are carried raw; the link extractor decides what they mean.
 */
@Value
@Builder
public class ChannelMessage {
    String id;
    String channelId;
    String guildId;
    String authorId;
    String text;
    Instant createdAt;
    boolean bot;
    boolean reply;
    @Singular
    List<String> attachmentUrls;
    @Singular
    List<String> embedUrls;

    public String safeText() {
        return text == null ? "" : text;
    }

    /**
     * First line of the message, the place analysis posts name their ticker.
     */
    public String headline() {
        String body = safeText();
        int newline = body.indexOf('\n');
        return newline < 0 ? body : body.substring(0, newline);
    }
}
