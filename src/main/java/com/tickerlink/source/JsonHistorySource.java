package com.tickerlink.source;

import com.tickerlink.history.ChannelHistorySource;
import com.tickerlink.model.ChannelMessage;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * History served from a Discord-style JSON export held in memory.
 *
 * <p>Accepted shapes: a bare message array, {@code {"messages": [...]}}, or
 * {@code {"guild_id": "...", "channels": {"<id>": [...]}}}.</p>
 */
public final class JsonHistorySource implements ChannelHistorySource {
    private static final Comparator<ChannelMessage> NEWEST_FIRST = Comparator
            .comparing(ChannelMessage::getCreatedAt)
            .thenComparing(ChannelMessage::getId, JsonHistorySource::compareIds)
            .reversed();

    private final Map<String, List<ChannelMessage>> byChannel;

    public JsonHistorySource(List<ChannelMessage> messages) {
        Map<String, List<ChannelMessage>> grouped = new LinkedHashMap<>();
        for (ChannelMessage m : messages) {
            grouped.computeIfAbsent(m.getChannelId(), k -> new ArrayList<>()).add(m);
        }
        Map<String, List<ChannelMessage>> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, List<ChannelMessage>> e : grouped.entrySet()) {
            List<ChannelMessage> rows = new ArrayList<>(e.getValue());
            rows.sort(NEWEST_FIRST);
            sorted.put(e.getKey(), List.copyOf(rows));
        }
        this.byChannel = sorted;
    }

    public static JsonHistorySource load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static JsonHistorySource parse(String json) {
        String raw = json == null ? "" : json.trim();
        if (raw.isEmpty()) {
            return new JsonHistorySource(List.of());
        }
        if (raw.startsWith("[")) {
            return new JsonHistorySource(DiscordMessageJson.parseArray(new JSONArray(raw), "", ""));
        }
        JSONObject root = new JSONObject(raw);
        String guildId = root.optString("guild_id", "");
        List<ChannelMessage> all = new ArrayList<>();
        JSONArray flat = root.optJSONArray("messages");
        if (flat != null) {
            all.addAll(DiscordMessageJson.parseArray(flat, "", guildId));
        }
        JSONObject channels = root.optJSONObject("channels");
        if (channels != null) {
            for (String channelId : new TreeSet<>(channels.keySet())) {
                JSONArray rows = channels.optJSONArray(channelId);
                if (rows != null) {
                    all.addAll(DiscordMessageJson.parseArray(rows, channelId, guildId));
                }
            }
        }
        return new JsonHistorySource(all);
    }

    @Override
    public List<ChannelMessage> fetchPage(String channelId, String beforeId, int limit) {
        List<ChannelMessage> rows = byChannel.getOrDefault(channelId, List.of());
        int from = 0;
        if (beforeId != null) {
            from = -1;
            for (int i = 0; i < rows.size(); i++) {
                if (rows.get(i).getId().equals(beforeId)) {
                    from = i + 1;
                    break;
                }
            }
            if (from < 0) {
                return List.of();
            }
        }
        int to = Math.min(rows.size(), from + Math.max(0, limit));
        return from >= to ? List.of() : rows.subList(from, to);
    }

    @Override
    public List<ChannelMessage> fetchRecent(String channelId, int limit) {
        return fetchPage(channelId, null, limit);
    }

    public List<String> channelIds() {
        return List.copyOf(byChannel.keySet());
    }

    /** Every message, oldest first, across all channels. */
    public List<ChannelMessage> chronological() {
        List<ChannelMessage> all = new ArrayList<>();
        for (List<ChannelMessage> rows : byChannel.values()) {
            all.addAll(rows);
        }
        all.sort(NEWEST_FIRST.reversed());
        return all;
    }

    public int size() {
        int n = 0;
        for (List<ChannelMessage> rows : byChannel.values()) {
            n += rows.size();
        }
        return n;
    }

    private static int compareIds(String a, String b) {
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }
}
