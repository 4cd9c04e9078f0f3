package com.tickerlink.history;

import com.tickerlink.config.Lexicon;
import com.tickerlink.model.MessageLinks;
import com.tickerlink.scoring.ListPatternDetector;
import com.tickerlink.scoring.RelevanceScorer;

import java.util.Locale;

/**
 * Quality score for backlog messages: substance (length, charts, strong keywords) rather
 * than the live gate's mix of signals. Ticker lists keep the list veto.
 */
public final class QualityScorer {
    static final double BASE = 0.3;
    static final double CHART_BONUS = 0.2;
    static final double STRONG_KEYWORD_BONUS = 0.15;
    static final int MAX_KEYWORD_HITS = 3;

    private final Lexicon lexicon;
    private final ListPatternDetector listDetector;

    public QualityScorer(Lexicon lexicon) {
        this(lexicon, new ListPatternDetector());
    }

    public QualityScorer(Lexicon lexicon, ListPatternDetector listDetector) {
        this.lexicon = lexicon;
        this.listDetector = listDetector;
    }

    public double score(String text, MessageLinks links) {
        String body = text == null ? "" : text;
        if (listDetector.isTickerList(body)) {
            return RelevanceScorer.LIST_SCORE;
        }
        double score = BASE;
        if (body.length() > 200) {
            score += 0.1;
        }
        if (body.length() > 400) {
            score += 0.1;
        }
        if (body.length() > 800) {
            score += 0.1;
        }
        if (links != null && links.hasCharts) {
            score += CHART_BONUS;
        }
        int hits = 0;
        String lower = body.toLowerCase(Locale.ROOT);
        for (String keyword : lexicon.strongKeywords()) {
            if (lower.contains(keyword)) {
                hits++;
            }
        }
        if (lexicon.hasHebrewStrong(body)) {
            hits++;
        }
        score += STRONG_KEYWORD_BONUS * Math.min(MAX_KEYWORD_HITS, hits);
        return Math.max(0.0, Math.min(1.0, score));
    }
}
