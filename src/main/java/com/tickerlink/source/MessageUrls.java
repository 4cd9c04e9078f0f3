package com.tickerlink.source;

import com.tickerlink.config.Config;

/**
 * Canonical message links in the {@code <platform>/channels/<guild>/<channel>/<message>} shape.
 */
public final class MessageUrls {
    public static final String UNKNOWN_GUILD = "unknown";

    private final String baseUrl;

    public MessageUrls(String baseUrl) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.baseUrl = base;
    }

    public static MessageUrls fromConfig(Config config) {
        return new MessageUrls(config.getString("link.base_url"));
    }

    public String canonical(String guildId, String channelId, String messageId) {
        String guild = guildId == null || guildId.isBlank() ? UNKNOWN_GUILD : guildId.trim();
        return baseUrl + "/channels/" + guild + "/" + channelId + "/" + messageId;
    }
}
