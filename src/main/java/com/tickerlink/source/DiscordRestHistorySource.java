package com.tickerlink.source;

import com.tickerlink.config.Config;
import com.tickerlink.history.ChannelHistorySource;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.source.http.HttpClientEx;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Channel history over the Discord REST API. Each call is one request; no retries.
 */
public final class DiscordRestHistorySource implements ChannelHistorySource {
    public static final String TOKEN_ENV = "TICKERLINK_DISCORD_TOKEN";
    static final int MAX_PAGE = 100;

    private final HttpClientEx http;
    private final String apiBase;
    private final String token;
    private final String guildId;
    private final int timeoutSec;

    public DiscordRestHistorySource(HttpClientEx http, String apiBase, String token, String guildId, int timeoutSec) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("discord token is required for REST history");
        }
        this.http = http;
        this.apiBase = stripSlash(apiBase);
        this.token = token.trim();
        this.guildId = guildId == null ? "" : guildId.trim();
        this.timeoutSec = Math.max(5, timeoutSec);
    }

    public static DiscordRestHistorySource fromConfig(Config config, HttpClientEx http) {
        String env = System.getenv(TOKEN_ENV);
        String token = env == null || env.isBlank() ? config.getString("discord.token") : env;
        return new DiscordRestHistorySource(
                http,
                config.getString("discord.api.base_url"),
                token,
                config.getString("discord.guild_id"),
                config.getInt("discord.timeout_sec", 20)
        );
    }

    @Override
    public List<ChannelMessage> fetchPage(String channelId, String beforeId, int limit) throws Exception {
        String url = pageUrl(channelId, beforeId, limit);
        String body = http.getText(url, timeoutSec, Map.of("Authorization", "Bot " + token));
        List<ChannelMessage> page = new ArrayList<>(DiscordMessageJson.parseArray(body, channelId, guildId));
        page.sort(Comparator.comparing(ChannelMessage::getCreatedAt).reversed());
        return page;
    }

    String pageUrl(String channelId, String beforeId, int limit) {
        int size = Math.max(1, Math.min(MAX_PAGE, limit));
        StringBuilder url = new StringBuilder(apiBase)
                .append("/channels/")
                .append(URLEncoder.encode(channelId, StandardCharsets.UTF_8))
                .append("/messages?limit=")
                .append(size);
        if (beforeId != null && !beforeId.isBlank()) {
            url.append("&before=").append(URLEncoder.encode(beforeId, StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    private static String stripSlash(String value) {
        String out = value == null ? "" : value.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
