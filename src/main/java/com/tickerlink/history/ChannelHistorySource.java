package com.tickerlink.history;

import com.tickerlink.model.ChannelMessage;

import java.util.List;

/**
 * Paged access to a channel's message history. Pages come most recent first.
 */
public interface ChannelHistorySource extends RecentMessageFetcher {

    /**
     * Up to {@code limit} messages older than {@code beforeId}, or the newest ones when
     * {@code beforeId} is null. An empty page means the history is exhausted.
     */
    List<ChannelMessage> fetchPage(String channelId, String beforeId, int limit) throws Exception;

    @Override
    default List<ChannelMessage> fetchRecent(String channelId, int limit) throws Exception {
        return fetchPage(channelId, null, limit);
    }
}
