package com.tickerlink.history;

import com.tickerlink.model.ChannelMessage;

import java.util.List;

/**
 * Latest messages of one channel, most recent first.
 */
@FunctionalInterface
public interface RecentMessageFetcher {
    List<ChannelMessage> fetchRecent(String channelId, int limit) throws Exception;
}
