package com.tickerlink.picks;

import com.tickerlink.config.Lexicon;
import com.tickerlink.symbol.SymbolAllowlist;
import com.tickerlink.symbol.SymbolValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopPicksParserTest {

    private final TopPicksParser parser = new TopPicksParser(
            new SymbolValidator(Lexicon.defaults(), SymbolAllowlist.staticOnly(Lexicon.defaults())));

    @Test
    void parse_shouldReadEnglishSectionWithMixedSeparators() {
        TopPicks picks = parser.parse("Weekly notes\nTOP PICKS:\nLong: NVDA / AMD，SMCI\nShort: TSLA | RIVN");

        assertTrue(picks.markerFound);
        assertEquals(List.of("NVDA", "AMD", "SMCI"), picks.longs);
        assertEquals(List.of("TSLA", "RIVN"), picks.shorts);
    }

    @Test
    void parse_shouldRecoverSingleLetterOnlyWithValidNeighbour() {
        TopPicks picks = parser.parse("Top picks:\nLong: F\nShort: TSLA, T");

        assertTrue(picks.longs.isEmpty());
        assertEquals(List.of("TSLA", "T"), picks.shorts);
    }

    @Test
    void parse_shouldDropGazetteerWordsAndDuplicates() {
        TopPicks picks = parser.parse("טופ פיקס\n📈 Long: NVDA, EMA, NVDA, $AMD 🔥");

        assertEquals(List.of("NVDA", "AMD"), picks.longs);
        assertTrue(picks.shorts.isEmpty());
    }

    @Test
    void parse_shouldIgnoreLongLinesBeforeMarker() {
        TopPicks picks = parser.parse("Long: AAPL\nTop picks:\nShort: TSLA");

        assertTrue(picks.longs.isEmpty());
        assertEquals(List.of("TSLA"), picks.shorts);
    }

    @Test
    void parse_shouldReturnEmptyWithoutMarker() {
        TopPicks picks = parser.parse("Long: NVDA\nShort: TSLA");

        assertFalse(picks.markerFound);
        assertTrue(picks.isEmpty());
        assertTrue(picks.toCandidates().isEmpty());
    }
}
