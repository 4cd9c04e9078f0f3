package com.tickerlink.symbol;

import com.tickerlink.config.Lexicon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Symbols that are always tickers: the configured list plus symbols a trusted author
 * has written as {@code $SYMBOL}. Learned entries expire after the TTL.
 */
public final class SymbolAllowlist {
    private static final Logger LOG = LogManager.getLogger(SymbolAllowlist.class);
    private static final Pattern DOLLAR_SYMBOL = Pattern.compile("(?<![A-Za-z0-9])\\$([A-Z]{1,5})(?![A-Za-z0-9])");

    private final Set<String> configured;
    private final Map<String, Instant> learned = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public SymbolAllowlist(Lexicon lexicon, Duration ttl, Clock clock) {
        this.configured = lexicon.allowlist();
        this.ttl = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static SymbolAllowlist staticOnly(Lexicon lexicon) {
        return new SymbolAllowlist(lexicon, Duration.ZERO, Clock.systemUTC());
    }

    public boolean isAllowed(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return false;
        }
        if (configured.contains(symbol)) {
            return true;
        }
        Instant learnedAt = learned.get(symbol);
        return learnedAt != null && !isExpired(learnedAt);
    }

    /**
     * Records every {@code $SYMBOL} in {@code text}. Returns the symbols that were new or refreshed.
     */
    public List<String> learnFrom(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty() || ttl.isZero()) {
            return out;
        }
        Matcher matcher = DOLLAR_SYMBOL.matcher(text);
        Instant now = clock.instant();
        while (matcher.find()) {
            String symbol = matcher.group(1);
            if (configured.contains(symbol)) {
                continue;
            }
            learned.put(symbol, now);
            if (!out.contains(symbol)) {
                out.add(symbol);
            }
        }
        if (!out.isEmpty()) {
            LOG.debug("allowlist learned {}", out);
        }
        return out;
    }

    public int pruneExpired() {
        int before = learned.size();
        learned.entrySet().removeIf(e -> isExpired(e.getValue()));
        int removed = before - learned.size();
        if (removed > 0) {
            LOG.info("allowlist expired {} learned symbols", removed);
        }
        return removed;
    }

    public Set<String> learnedSymbols() {
        Set<String> out = new TreeSet<>();
        for (Map.Entry<String, Instant> e : learned.entrySet()) {
            if (!isExpired(e.getValue())) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    private boolean isExpired(Instant learnedAt) {
        return learnedAt.plus(ttl).isBefore(clock.instant());
    }
}
