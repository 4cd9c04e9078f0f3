package com.tickerlink.picks;

import com.tickerlink.model.Candidate;
import com.tickerlink.model.Priority;

import java.util.ArrayList;
import java.util.List;

/**
 * Long and short sides of a top-picks block, in the order they were written.
 */
public final class TopPicks {
    public static final TopPicks EMPTY = new TopPicks(false, List.of(), List.of());

    public final boolean markerFound;
    public final List<String> longs;
    public final List<String> shorts;

    public TopPicks(boolean markerFound, List<String> longs, List<String> shorts) {
        this.markerFound = markerFound;
        this.longs = longs == null ? List.of() : List.copyOf(longs);
        this.shorts = shorts == null ? List.of() : List.copyOf(shorts);
    }

    public boolean isEmpty() {
        return longs.isEmpty() && shorts.isEmpty();
    }

    /** Every pick at full confidence; a ticker on both sides keeps its long entry. */
    public List<Candidate> toCandidates() {
        List<Candidate> out = new ArrayList<>();
        for (String ticker : longs) {
            out.add(new Candidate(ticker, 1.0, 0, Priority.TOP_LONG));
        }
        for (String ticker : shorts) {
            out.add(new Candidate(ticker, 1.0, 0, Priority.TOP_SHORT));
        }
        return out;
    }

    @Override
    public String toString() {
        return "TopPicks{long=" + longs + ", short=" + shorts + "}";
    }
}
