package com.tickerlink.source;

import com.tickerlink.model.ChannelMessage;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps Discord message objects (REST payloads and channel exports) to {@link ChannelMessage}.
 * Entries without an id or a parseable timestamp are dropped.
 */
public final class DiscordMessageJson {
    private static final int TYPE_REPLY = 19;

    private DiscordMessageJson() {
    }

    public static List<ChannelMessage> parseArray(String body, String fallbackChannelId, String fallbackGuildId) {
        if (body == null || body.trim().isEmpty()) {
            return List.of();
        }
        String raw = body.trim();
        JSONArray arr;
        if (raw.startsWith("[")) {
            arr = new JSONArray(raw);
        } else {
            JSONObject root = new JSONObject(raw);
            arr = root.optJSONArray("messages");
            if (arr == null) {
                return List.of();
            }
        }
        return parseArray(arr, fallbackChannelId, fallbackGuildId);
    }

    public static List<ChannelMessage> parseArray(JSONArray arr, String fallbackChannelId, String fallbackGuildId) {
        List<ChannelMessage> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject row = arr.optJSONObject(i);
            if (row == null) {
                continue;
            }
            ChannelMessage message = parse(row, fallbackChannelId, fallbackGuildId);
            if (message != null) {
                out.add(message);
            }
        }
        return out;
    }

    public static ChannelMessage parse(JSONObject row, String fallbackChannelId, String fallbackGuildId) {
        String id = text(row, "id");
        Instant createdAt = timestamp(text(row, "timestamp"));
        if (id.isEmpty() || createdAt == null) {
            return null;
        }
        JSONObject author = row.optJSONObject("author");
        String channelId = text(row, "channel_id");
        String guildId = text(row, "guild_id");

        ChannelMessage.ChannelMessageBuilder builder = ChannelMessage.builder()
                .id(id)
                .channelId(channelId.isEmpty() ? nullToEmpty(fallbackChannelId) : channelId)
                .guildId(guildId.isEmpty() ? nullToEmpty(fallbackGuildId) : guildId)
                .authorId(author == null ? "" : text(author, "id"))
                .bot(author != null && author.optBoolean("bot", false))
                .text(row.optString("content", ""))
                .createdAt(createdAt)
                .reply(row.optInt("type", 0) == TYPE_REPLY || row.optJSONObject("message_reference") != null);

        JSONArray attachments = row.optJSONArray("attachments");
        if (attachments != null) {
            for (int i = 0; i < attachments.length(); i++) {
                JSONObject a = attachments.optJSONObject(i);
                String url = a == null ? "" : text(a, "url");
                if (!url.isEmpty()) {
                    builder.attachmentUrl(url);
                }
            }
        }
        JSONArray embeds = row.optJSONArray("embeds");
        if (embeds != null) {
            for (int i = 0; i < embeds.length(); i++) {
                JSONObject e = embeds.optJSONObject(i);
                if (e == null) {
                    continue;
                }
                addEmbedUrl(builder, text(e, "url"));
                addEmbedUrl(builder, nestedUrl(e, "image"));
                addEmbedUrl(builder, nestedUrl(e, "thumbnail"));
            }
        }
        return builder.build();
    }

    private static void addEmbedUrl(ChannelMessage.ChannelMessageBuilder builder, String url) {
        if (!url.isEmpty()) {
            builder.embedUrl(url);
        }
    }

    private static String nestedUrl(JSONObject parent, String key) {
        JSONObject nested = parent.optJSONObject(key);
        return nested == null ? "" : text(nested, "url");
    }

    private static Instant timestamp(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static String text(JSONObject row, String key) {
        try {
            Object value = row.opt(key);
            if (value == null || value == JSONObject.NULL) {
                return "";
            }
            return String.valueOf(value).trim();
        } catch (JSONException e) {
            return "";
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
