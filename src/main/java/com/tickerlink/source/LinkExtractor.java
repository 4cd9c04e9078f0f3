package com.tickerlink.source;

import com.tickerlink.model.ChannelMessage;
import com.tickerlink.model.MessageLinks;

@FunctionalInterface
public interface LinkExtractor {
    MessageLinks extract(ChannelMessage message);
}
