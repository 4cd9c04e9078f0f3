package com.tickerlink.scoring;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises messages that are bare ticker lists ("AAPL / TSLA / NVDA ...") rather than analysis.
 */
public final class ListPatternDetector {
    static final int MIN_PAIRS = 3;
    static final double MIN_COVERAGE = 0.30;
    static final int MIN_TOKENS = 6;
    static final double MAX_WORDS_PER_TOKEN = 1.5;

    private static final String TICKER_LIKE = "\\$?[A-Z]{1,5}(?![A-Za-z0-9])";
    private static final Pattern PAIR = Pattern.compile(
            "(?<![A-Za-z0-9$])" + TICKER_LIKE + "\\s*[/,|]\\s*(?=(" + TICKER_LIKE + "))");
    private static final Pattern TOKEN = Pattern.compile("(?<![A-Za-z0-9$])" + TICKER_LIKE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** What the detector measured on one text. */
    public static final class Shape {
        public final int pairs;
        public final double coverage;
        public final int tickerTokens;
        public final int otherWords;
        public final boolean tickerList;

        Shape(int pairs, double coverage, int tickerTokens, int otherWords, boolean tickerList) {
            this.pairs = pairs;
            this.coverage = coverage;
            this.tickerTokens = tickerTokens;
            this.otherWords = otherWords;
            this.tickerList = tickerList;
        }
    }

    public boolean isTickerList(String text) {
        return inspect(text).tickerList;
    }

    public Shape inspect(String text) {
        if (text == null || text.isBlank()) {
            return new Shape(0, 0.0, 0, 0, false);
        }
        boolean[] covered = new boolean[text.length()];
        int pairs = 0;
        Matcher pair = PAIR.matcher(text);
        while (pair.find()) {
            pairs++;
            int end = pair.end() + pair.group(1).length();
            for (int i = pair.start(); i < end; i++) {
                covered[i] = true;
            }
        }
        int coveredChars = 0;
        for (boolean c : covered) {
            if (c) {
                coveredChars++;
            }
        }
        double coverage = (double) coveredChars / text.length();

        int tokens = 0;
        Matcher token = TOKEN.matcher(text);
        while (token.find()) {
            tokens++;
        }
        int otherWords = 0;
        for (String word : WHITESPACE.split(text.trim())) {
            if (hasLetter(word) && !TOKEN.matcher(word).find()) {
                otherWords++;
            }
        }

        boolean byPairs = pairs >= MIN_PAIRS && coverage > MIN_COVERAGE;
        boolean byDensity = tokens >= MIN_TOKENS && (double) otherWords / tokens < MAX_WORDS_PER_TOKEN;
        return new Shape(pairs, coverage, tokens, otherWords, byPairs || byDensity);
    }

    private static boolean hasLetter(String word) {
        return word.codePoints().anyMatch(Character::isLetter);
    }
}
