package com.tickerlink.history;

import com.tickerlink.model.AnalysisRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a backlog pass. {@code records} is ordered oldest first, ready for a bulk index load.
 */
public final class ReconcileResult {
    public final Map<String, AnalysisRecord> records;
    public final List<String> scannedChannels;
    public final List<String> failedChannels;
    public final int messagesScanned;
    public final boolean cancelled;

    public ReconcileResult(
            Map<String, AnalysisRecord> records,
            List<String> scannedChannels,
            List<String> failedChannels,
            int messagesScanned,
            boolean cancelled
    ) {
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.scannedChannels = List.copyOf(scannedChannels);
        this.failedChannels = List.copyOf(failedChannels);
        this.messagesScanned = messagesScanned;
        this.cancelled = cancelled;
    }
}
