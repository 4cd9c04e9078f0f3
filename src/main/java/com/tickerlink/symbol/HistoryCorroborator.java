package com.tickerlink.symbol;

import com.tickerlink.history.RecentMessageFetcher;
import com.tickerlink.model.ChannelMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Confirms single-letter symbols by finding them written with a {@code $} or {@code #}
 * prefix in recent channel history. A channel that cannot be read is skipped.
 */
public final class HistoryCorroborator {
    private static final Logger LOG = LogManager.getLogger(HistoryCorroborator.class);

    private final RecentMessageFetcher fetcher;
    private final List<String> channelIds;
    private final int limit;
    private final long paceMs;

    public HistoryCorroborator(RecentMessageFetcher fetcher, List<String> channelIds, int limit, long paceMs) {
        this.fetcher = fetcher;
        this.channelIds = channelIds == null ? List.of() : List.copyOf(channelIds);
        this.limit = Math.max(1, limit);
        this.paceMs = Math.max(0L, paceMs);
    }

    public Set<String> corroborate(Collection<String> symbols) {
        Set<String> pending = new LinkedHashSet<>(symbols == null ? List.of() : symbols);
        Set<String> confirmed = new LinkedHashSet<>();
        if (pending.isEmpty()) {
            return confirmed;
        }
        for (int i = 0; i < channelIds.size() && !pending.isEmpty(); i++) {
            String channelId = channelIds.get(i);
            if (i > 0 && !pace()) {
                break;
            }
            List<ChannelMessage> recent;
            try {
                recent = fetcher.fetchRecent(channelId, limit);
            } catch (Exception e) {
                LOG.warn("corroboration skipped channel {}: {}", channelId, e.getMessage());
                continue;
            }
            for (String symbol : List.copyOf(pending)) {
                if (mentionedWithPrefix(recent, symbol)) {
                    pending.remove(symbol);
                    confirmed.add(symbol);
                }
            }
        }
        return confirmed;
    }

    static boolean mentionedWithPrefix(List<ChannelMessage> messages, String symbol) {
        if (messages == null) {
            return false;
        }
        Pattern prefixed = Pattern.compile("[$#]" + Pattern.quote(symbol) + "(?![A-Za-z0-9])");
        for (ChannelMessage message : messages) {
            if (message != null && prefixed.matcher(message.safeText()).find()) {
                return true;
            }
        }
        return false;
    }

    private boolean pace() {
        if (paceMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(paceMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
