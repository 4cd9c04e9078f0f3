package com.tickerlink.scoring;

import com.tickerlink.config.Lexicon;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores how likely a message is to be a real analysis post rather than chatter or a ticker list.
 */
public final class RelevanceScorer {
    public static final double LIST_SCORE = 0.1;
    static final double BASE = 0.3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Lexicon lexicon;
    private final ListPatternDetector listDetector;

    public RelevanceScorer(Lexicon lexicon) {
        this(lexicon, new ListPatternDetector());
    }

    public RelevanceScorer(Lexicon lexicon, ListPatternDetector listDetector) {
        this.lexicon = lexicon;
        this.listDetector = listDetector;
    }

    public boolean isTickerList(String text) {
        return listDetector.isTickerList(text == null ? "" : text);
    }

    public double score(String text, int tickerCount) {
        return score(text, tickerCount, false);
    }

    public double score(String text, int tickerCount, boolean reply) {
        String body = text == null ? "" : text;
        if (listDetector.isTickerList(body)) {
            return LIST_SCORE;
        }
        double score = BASE;
        score -= densityPenalty(body, tickerCount);

        String lower = body.toLowerCase(Locale.ROOT);
        score += 0.3 * hits(lower, lexicon.strongKeywords());
        score += 0.2 * hits(lower, lexicon.mediumKeywords());
        score += 0.1 * hits(lower, lexicon.weakKeywords());
        score += lexicon.hebrewTierBonus(body);

        if (body.length() > 200) {
            score += 0.1;
        }
        if (body.length() > 400) {
            score += 0.1;
        }
        score += countShape(tickerCount);
        if (reply) {
            score += 0.2;
        }
        return clamp(score);
    }

    static double densityPenalty(String text, int tickerCount) {
        if (tickerCount <= 3) {
            return 0.0;
        }
        double wordsPerTicker = (double) wordCount(text) / tickerCount;
        if (wordsPerTicker < 2) {
            return 0.4;
        }
        if (wordsPerTicker < 3) {
            return 0.3;
        }
        if (wordsPerTicker < 4) {
            return 0.2;
        }
        if (wordsPerTicker < 5) {
            return 0.1;
        }
        return 0.0;
    }

    static double countShape(int tickerCount) {
        if (tickerCount == 1) {
            return 0.2;
        }
        if (tickerCount == 2 || tickerCount == 3) {
            return 0.1;
        }
        if (tickerCount > 5) {
            return -0.05 * (tickerCount - 5);
        }
        return 0.0;
    }

    private static int hits(String lowerText, List<String> keywords) {
        int count = 0;
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                count++;
            }
        }
        return count;
    }

    private static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
