package com.tickerlink.index;

import com.tickerlink.model.AnalysisRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-ticker store of indexed analysis: a latest pointer plus a bounded history.
 *
 * <p>The latest pointer moves only to a strictly newer record. History keeps the
 * {@code historyCap} newest records. Every mutation is synchronized on the index, so the
 * freshness sweep and live {@link #record} calls never see a half-written entry.</p>
 *
 * <p>{@link #loadFromBulk} is for start-up only. Calling it after a live {@link #record}
 * is a programming error and throws {@link IllegalStateException}.</p>
 */
public final class AnalysisIndex {
    private static final Logger LOG = LogManager.getLogger(AnalysisIndex.class);

    public static final int DEFAULT_HISTORY_CAP = 20;

    private static final Comparator<AnalysisRecord> NEWEST_FIRST =
            Comparator.comparing((AnalysisRecord r) -> r.timestamp).reversed();

    private final int historyCap;
    private final FreshnessPolicy freshness;
    private final Map<String, AnalysisRecord> latest = new HashMap<>();
    private final Map<String, List<AnalysisRecord>> history = new HashMap<>();
    private boolean liveStarted;

    public AnalysisIndex(int historyCap, FreshnessPolicy freshness) {
        if (historyCap <= 0) {
            throw new IllegalArgumentException("history cap must be positive: " + historyCap);
        }
        this.historyCap = historyCap;
        this.freshness = freshness;
    }

    public synchronized void record(String ticker, AnalysisRecord rec) {
        liveStarted = true;
        insert(normalize(ticker), rec);
    }

    /**
     * Replaces the whole index. Records are inserted in the map's iteration order through the
     * same latest-pointer rule as {@link #record}, so callers pass a chronologically ordered map.
     */
    public synchronized void loadFromBulk(Map<String, AnalysisRecord> records) {
        if (liveStarted) {
            throw new IllegalStateException("bulk load after live records were indexed");
        }
        latest.clear();
        history.clear();
        if (records == null) {
            return;
        }
        for (Map.Entry<String, AnalysisRecord> e : records.entrySet()) {
            insert(normalize(e.getKey()), e.getValue());
        }
        LOG.info("index loaded {} tickers from bulk", latest.size());
    }

    public synchronized Optional<AnalysisRecord> latest(String ticker) {
        return Optional.ofNullable(latest.get(normalize(ticker)));
    }

    /**
     * Up to {@code n} fresh records for {@code ticker}, ranked by recency weight plus relevance.
     */
    public synchronized List<AnalysisRecord> recent(String ticker, int n) {
        List<AnalysisRecord> rows = history.get(normalize(ticker));
        if (rows == null || n <= 0) {
            return List.of();
        }
        List<AnalysisRecord> fresh = new ArrayList<>();
        for (AnalysisRecord r : rows) {
            if (freshness.isFresh(r.timestamp)) {
                fresh.add(r);
            }
        }
        fresh.sort(Comparator.comparingDouble((AnalysisRecord r) -> freshness.timeDecay(r.timestamp) + r.relevanceScore)
                .reversed());
        return List.copyOf(fresh.subList(0, Math.min(n, fresh.size())));
    }

    public synchronized boolean isFresh(String ticker) {
        AnalysisRecord rec = latest.get(normalize(ticker));
        return rec != null && freshness.isFresh(rec.timestamp);
    }

    public synchronized Set<String> allFreshTickers() {
        Set<String> out = new TreeSet<>();
        for (Map.Entry<String, AnalysisRecord> e : latest.entrySet()) {
            if (freshness.isFresh(e.getValue().timestamp)) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    /**
     * Drops records strictly older than the freshness window. Returns how many history rows went.
     */
    public synchronized int pruneStale() {
        int removed = 0;
        Iterator<Map.Entry<String, List<AnalysisRecord>>> it = history.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, List<AnalysisRecord>> e = it.next();
            int before = e.getValue().size();
            e.getValue().removeIf(r -> !freshness.isFresh(r.timestamp));
            removed += before - e.getValue().size();
            if (e.getValue().isEmpty()) {
                it.remove();
            }
        }
        latest.values().removeIf(r -> !freshness.isFresh(r.timestamp));
        return removed;
    }

    public synchronized IndexStats stats() {
        int rows = 0;
        for (List<AnalysisRecord> list : history.values()) {
            rows += list.size();
        }
        int fresh = 0;
        for (AnalysisRecord r : latest.values()) {
            if (freshness.isFresh(r.timestamp)) {
                fresh++;
            }
        }
        return new IndexStats(latest.size(), rows, fresh);
    }

    private void insert(String ticker, AnalysisRecord rec) {
        if (ticker.isEmpty()) {
            throw new IllegalArgumentException("blank ticker");
        }
        if (rec == null) {
            throw new IllegalArgumentException("null record for " + ticker);
        }
        List<AnalysisRecord> rows = history.computeIfAbsent(ticker, k -> new ArrayList<>());
        boolean duplicate = false;
        for (AnalysisRecord r : rows) {
            if (!rec.sourceMessageId.isEmpty() && r.sourceMessageId.equals(rec.sourceMessageId)) {
                duplicate = true;
                break;
            }
        }
        if (!duplicate) {
            rows.add(rec);
            rows.sort(NEWEST_FIRST);
            while (rows.size() > historyCap) {
                rows.remove(rows.size() - 1);
            }
        }
        AnalysisRecord current = latest.get(ticker);
        if (current == null || rec.timestamp.isAfter(current.timestamp)) {
            latest.put(ticker, rec);
        }
    }

    private static String normalize(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }
}
