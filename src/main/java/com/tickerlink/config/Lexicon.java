package com.tickerlink.config;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable word tables used by extraction and scoring.
 * Built once and passed to the components that need it; tests build their own copies.
 */
public final class Lexicon {

    private static final Set<String> DEFAULT_DISALLOW = Set.of(
            "THE", "AND", "FOR", "ARE", "BUT", "NOT", "YOU", "ALL", "CAN", "HER", "WAS", "ONE", "OUR",
            "HAD", "HAS", "HIS", "HOW", "MAN", "NEW", "NOW", "OLD", "SEE", "TWO", "WHO", "BOY", "DID",
            "ITS", "LET", "PUT", "SAY", "SHE", "TOO", "USE", "DAY", "GET", "MAY", "WAY", "GOT", "OUT",
            "TOP", "RUN", "TRY", "WIN", "YES", "YET", "BAD", "BIG", "END", "FAR", "FEW", "LOT", "OFF",
            "RED", "SET", "SIX", "TEN", "USD", "CEO", "IPO", "SEC", "FDA", "API", "URL", "PDF", "FAQ",
            "THIS", "THAT", "WHAT", "WHEN", "WHERE", "WHICH", "WHILE", "WITH", "WILL", "WELL",
            "VERY", "THAN", "THEY", "THEM", "THEN", "THERE", "THESE", "THOSE", "WANT", "WORK", "YEAR",
            "OVER", "INTO", "FROM", "BEEN", "HAVE", "ONLY", "SOME", "TIME", "BACK", "AFTER", "FIRST",
            "QUICK", "BROWN", "FOX", "JUMPS", "HANDS",
            "LONG", "SHORT", "BUY", "SELL", "HOLD", "STOP", "LOSS", "CALL", "CALLS", "PUTS", "ENTRY", "EXIT",
            "EMA", "SMA", "DMA", "RSI", "MACD", "ATR", "ADX", "VWAP", "AVWAP", "ATH", "ATL", "HTF",
            "EPS", "ETF", "YTD", "GDP", "CPI", "FOMC", "IBD", "US", "UK", "EU", "USA",
            "OK", "LOL", "IMO", "FOMO", "YOLO", "DD", "TA"
    );

    private static final Set<String> DEFAULT_ALLOWLIST = Set.of(
            "SPY", "QQQ", "IWM", "TLT", "VIX", "GDX", "DXY", "WH", "AU"
    );

    private static final List<String> DEFAULT_STOCK_VOCABULARY = List.of(
            "stock", "ticker", "symbol", "shares", "equity", "trade",
            "buy", "sell", "analysis", "chart", "price", "target"
    );

    private static final List<String> DEFAULT_STRONG = List.of(
            "analysis", "target", "price target", "bullish", "bearish", "recommendation"
    );
    private static final List<String> DEFAULT_MEDIUM = List.of(
            "chart", "technical", "support", "resistance", "breakout", "trend"
    );
    private static final List<String> DEFAULT_WEAK = List.of(
            "buy", "sell", "hold", "watch", "trade"
    );

    private static final List<String> DEFAULT_HEBREW_STRONG = List.of(
            "ברייקאאוט", "פריצה", "relative strength", "שיא", "ווליום", "ממוצע", "AVWAP", "EMA20",
            "50DMA", "HTF", "קו פריצה", "בלו סקייס", "אלכסון", "קונסולדיציה", "ריטטס",
            "אינסייד קנדל", "falling wedge", "ליברמור", "ATH"
    );
    private static final List<String> DEFAULT_HEBREW_MEDIUM = List.of(
            "עולה", "נע", "מעל", "שמירה", "המשכיות", "טרנד", "מומנטום", "סטאפ", "באונס",
            "כריטסט", "רייד ווינרס", "IBD50", "Sector Leaders", "פוקוס"
    );
    private static final List<String> DEFAULT_HEBREW_WEAK = List.of(
            "מניה", "מניית", "watch", "יום", "שבוע", "חדש", "נהדר"
    );

    private final Set<String> disallow;
    private final Set<String> allowlist;
    private final List<String> stockVocabulary;
    private final List<String> strongKeywords;
    private final List<String> mediumKeywords;
    private final List<String> weakKeywords;
    private final List<String> hebrewStrong;
    private final List<String> hebrewMedium;
    private final List<String> hebrewWeak;

    public Lexicon(
            Set<String> disallow,
            Set<String> allowlist,
            List<String> stockVocabulary,
            List<String> strongKeywords,
            List<String> mediumKeywords,
            List<String> weakKeywords,
            List<String> hebrewStrong,
            List<String> hebrewMedium,
            List<String> hebrewWeak
    ) {
        this.disallow = upperSet(disallow);
        this.allowlist = upperSet(allowlist);
        this.stockVocabulary = lowerList(stockVocabulary);
        this.strongKeywords = lowerList(strongKeywords);
        this.mediumKeywords = lowerList(mediumKeywords);
        this.weakKeywords = lowerList(weakKeywords);
        this.hebrewStrong = copy(hebrewStrong);
        this.hebrewMedium = copy(hebrewMedium);
        this.hebrewWeak = copy(hebrewWeak);
    }

    public static Lexicon defaults() {
        return new Lexicon(
                DEFAULT_DISALLOW,
                DEFAULT_ALLOWLIST,
                DEFAULT_STOCK_VOCABULARY,
                DEFAULT_STRONG,
                DEFAULT_MEDIUM,
                DEFAULT_WEAK,
                DEFAULT_HEBREW_STRONG,
                DEFAULT_HEBREW_MEDIUM,
                DEFAULT_HEBREW_WEAK
        );
    }

    /**
     * Defaults plus the extra allowlist/disallow entries named by {@code lexicon.allowlist} and {@code lexicon.disallow}.
     */
    public static Lexicon fromConfig(Config config) {
        Lexicon base = defaults();
        Set<String> allow = new LinkedHashSet<>(base.allowlist);
        allow.addAll(config.getList("lexicon.allowlist"));
        Set<String> deny = new LinkedHashSet<>(base.disallow);
        deny.addAll(config.getList("lexicon.disallow"));
        return base.withAllowlist(allow).withDisallow(deny);
    }

    public Lexicon withAllowlist(Set<String> replacement) {
        return new Lexicon(disallow, replacement, stockVocabulary, strongKeywords, mediumKeywords, weakKeywords,
                hebrewStrong, hebrewMedium, hebrewWeak);
    }

    public Lexicon withDisallow(Set<String> replacement) {
        return new Lexicon(replacement, allowlist, stockVocabulary, strongKeywords, mediumKeywords, weakKeywords,
                hebrewStrong, hebrewMedium, hebrewWeak);
    }

    public boolean isDisallowed(String token) {
        return token != null && disallow.contains(token.toUpperCase(Locale.ROOT));
    }

    public boolean isAllowlisted(String token) {
        return token != null && allowlist.contains(token.toUpperCase(Locale.ROOT));
    }

    public Set<String> allowlist() {
        return allowlist;
    }

    public List<String> stockVocabulary() {
        return stockVocabulary;
    }

    public List<String> strongKeywords() {
        return strongKeywords;
    }

    public List<String> mediumKeywords() {
        return mediumKeywords;
    }

    public List<String> weakKeywords() {
        return weakKeywords;
    }

    /**
     * Highest Hebrew tier bonus present in {@code text}: 0.3 strong, 0.2 medium, 0.1 weak, else 0.
     * Tiers do not add up.
     */
    public double hebrewTierBonus(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        if (containsAny(text, hebrewStrong)) {
            return 0.3;
        }
        if (containsAny(text, hebrewMedium)) {
            return 0.2;
        }
        if (containsAny(text, hebrewWeak)) {
            return 0.1;
        }
        return 0.0;
    }

    public boolean hasHebrewStrong(String text) {
        return text != null && containsAny(text, hebrewStrong);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> upperSet(Set<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw != null) {
            for (String item : raw) {
                if (item != null && !item.isBlank()) {
                    out.add(item.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return Set.copyOf(out);
    }

    private static List<String> lowerList(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    private static List<String> copy(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream().filter(s -> s != null && !s.isBlank()).toList();
    }
}
