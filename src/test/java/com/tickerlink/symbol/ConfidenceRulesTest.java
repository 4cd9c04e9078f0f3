package com.tickerlink.symbol;

import com.tickerlink.config.Lexicon;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfidenceRulesTest {

    private final Lexicon lexicon = Lexicon.defaults();

    @Test
    void whitespaceRule_shouldRequireBothNeighbours() {
        assertEquals(0.7, score(" AAPL ", 1), 1e-9);
        assertEquals(0.6, score("AAPL ", 0), 1e-9);
    }

    @Test
    void hebrewRule_shouldUseHighestTierOnly() {
        double strongOnly = score("NVDA פריצה", 0);
        double strongAndWeak = score("NVDA פריצה מניה", 0);

        assertEquals(strongOnly, strongAndWeak, 1e-9);
        assertEquals(0.5 + 0.1 + 0.3, strongOnly, 1e-9);
    }

    @Test
    void hashPrefix_shouldAddLessThanDollar() {
        assertTrue(score("$AMD", 1) > score("#AMD", 1));
        assertEquals(0.9, score("#AMD", 1), 1e-9);
    }

    @Test
    void clamp_shouldCapAtOne() {
        assertEquals(1.0, score("$SPY stock analysis", 1), 1e-9);
    }

    @Test
    void plus_shouldReturnSameInstanceForZeroDelta() {
        ScoredToken token = ScoredToken.start(new TokenMatch("AMD", 0, TokenMatch.NO_PREFIX));

        assertSame(token, token.plus(0.0, "noop"));
        assertEquals(1, token.plus(0.5, "base").notes.size());
        assertTrue(token.notes.isEmpty());
    }

    private double score(String text, int offset) {
        ScanContext context = new ScanContext(text, lexicon, SymbolAllowlist.staticOnly(lexicon));
        TokenMatch match = SymbolExtractor.scanTokens(text).stream()
                .filter(t -> t.offset == offset)
                .findFirst()
                .orElseThrow();
        return ConfidenceRules.score(match, context).confidence;
    }
}
