package com.tickerlink.symbol;

import com.tickerlink.config.Lexicon;
import com.tickerlink.history.RecentMessageFetcher;
import com.tickerlink.model.Candidate;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.model.Priority;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolExtractorTest {

    private final SymbolExtractor extractor = new SymbolExtractor(Lexicon.defaults());

    @Test
    void extract_shouldScoreBareTickerAtBasePlusLength() {
        List<Candidate> out = extractor.extract("AAPL");

        assertEquals(1, out.size());
        assertEquals("AAPL", out.get(0).ticker);
        assertEquals(0.6, out.get(0).confidence, 1e-9);
        assertEquals(Priority.REGULAR, out.get(0).priority);
    }

    @Test
    void extract_shouldGiveHighConfidenceToDollarTickerWithVocabulary() {
        List<Candidate> out = extractor.extract("$AAPL breakout above resistance, price target $200");

        assertEquals(1, out.size());
        assertEquals("AAPL", out.get(0).ticker);
        assertTrue(out.get(0).confidence >= 0.9);
        assertEquals(1, out.get(0).sourceOffset);
    }

    @Test
    void extract_shouldAdmitPrefixedSingleLetter() {
        List<Candidate> out = extractor.extract("$F target raised");

        assertEquals(1, out.size());
        assertEquals("F", out.get(0).ticker);
        assertTrue(out.get(0).confidence > 0.7);
    }

    @Test
    void extract_shouldDropLoneSingleLetter() {
        assertTrue(extractor.extract("F alone").isEmpty());
    }

    @Test
    void extract_shouldReturnEmptyForBlankInput() {
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void extract_shouldRejectDisallowedWords() {
        assertTrue(extractor.extract("THE stock is above EMA and RSI").isEmpty());
    }

    @Test
    void extract_shouldLetAllowlistOverrideDisallow() {
        Lexicon lexicon = Lexicon.defaults().withDisallow(Set.of("WH", "THE"));
        SymbolExtractor custom = new SymbolExtractor(lexicon);

        List<Candidate> out = custom.extract("WH earnings");

        assertEquals(1, out.size());
        assertEquals("WH", out.get(0).ticker);
        assertEquals(1.0, out.get(0).confidence, 1e-9);
    }

    @Test
    void extract_shouldTrustSingleLettersWhenTwoTickersAccepted() {
        List<Candidate> out = extractor.extract("AAPL TSLA F");

        Candidate f = find(out, "F");
        assertEquals(3, out.size());
        assertEquals(0.7, f.confidence, 1e-9);
    }

    @Test
    void extract_shouldAdmitSingleLetterAdjacentToTicker() {
        List<Candidate> out = extractor.extract("NVDA/F breakout");

        assertEquals(2, out.size());
        assertEquals(0.65, find(out, "F").confidence, 1e-9);
    }

    @Test
    void extract_shouldTreatEmojiAsAdjacencySeparator() {
        List<Candidate> out = extractor.extract("AMD 🚀 F");

        assertEquals(0.65, find(out, "F").confidence, 1e-9);
    }

    @Test
    void extract_shouldHonourCallerListContext() {
        List<Candidate> out = extractor.extract("F", true);

        assertEquals(1, out.size());
        assertEquals(0.7, out.get(0).confidence, 1e-9);
        assertTrue(extractor.extract("F", false).isEmpty());
    }

    @Test
    void extract_shouldKeepHighestConfidencePerTicker() {
        List<Candidate> out = extractor.extract("$AAPL and AAPL");

        assertEquals(1, out.size());
        assertEquals(1.0, out.get(0).confidence, 1e-9);
        assertEquals(1, out.get(0).sourceOffset);
    }

    @Test
    void extract_shouldOrderByConfidenceThenOffset() {
        List<Candidate> out = extractor.extract("MSFT then $AMD");

        assertEquals("AMD", out.get(0).ticker);
        assertEquals("MSFT", out.get(1).ticker);
    }

    @Test
    void extract_shouldBeIdempotent() {
        String text = "NVDA/F breakout, $AMD and MSFT with 🚀 A";

        assertEquals(extractor.extract(text).toString(), extractor.extract(text).toString());
    }

    @Test
    void extract_shouldCapFreeformResults() {
        List<Candidate> out = extractor.extract(String.join(" ", generatedTickers(30)));

        assertEquals(SymbolExtractor.DEFAULT_MAX_CANDIDATES, out.size());
    }

    @Test
    void extractTopPicks_shouldReturnPrioritisedUncappedPicks() {
        String text = "❕ טופ פיקס:\n📈 Long: NVDA, AMD, F\n📉 Short: TSLA";

        List<Candidate> out = extractor.extractTopPicks(text);

        assertEquals(List.of("NVDA", "AMD", "F", "TSLA"), out.stream().map(c -> c.ticker).toList());
        assertEquals(Priority.TOP_LONG, out.get(0).priority);
        assertEquals(Priority.TOP_SHORT, out.get(3).priority);
        assertTrue(out.stream().allMatch(c -> c.confidence == 1.0 && c.sourceOffset == 0));
    }

    @Test
    void extractTopPicks_shouldNotCapLongLists() {
        String text = "Top picks:\nLong: " + String.join(", ", generatedTickers(30));

        assertEquals(30, extractor.extractTopPicks(text).size());
    }

    @Test
    void extractTopPicks_shouldReturnEmptyWithoutMarker() {
        assertTrue(extractor.extractTopPicks("Long: NVDA, AMD").isEmpty());
    }

    @Test
    void extract_shouldDeferPrefixedLetterToHistoryWhenCorroboratorConfigured() {
        RecentFetcherStub history = new RecentFetcherStub(List.of("$F earnings next week"));
        SymbolExtractor withHistory = new SymbolExtractor(
                Lexicon.defaults(),
                SymbolAllowlist.staticOnly(Lexicon.defaults()),
                SymbolExtractor.DEFAULT_MAX_CANDIDATES,
                new HistoryCorroborator(history, List.of("a1"), 50, 0L)
        );

        List<Candidate> out = withHistory.extract("$F looks good");

        assertEquals(1, out.size());
        assertEquals("F", out.get(0).ticker);
        assertEquals(1.0, out.get(0).confidence, 1e-9);
        assertEquals(1, history.calls);
    }

    @Test
    void extract_shouldDropPrefixedLetterWhenHistoryDoesNotConfirm() {
        SymbolExtractor withHistory = new SymbolExtractor(
                Lexicon.defaults(),
                SymbolAllowlist.staticOnly(Lexicon.defaults()),
                SymbolExtractor.DEFAULT_MAX_CANDIDATES,
                new HistoryCorroborator(new RecentFetcherStub(List.of("F is a letter")), List.of("a1"), 50, 0L)
        );

        assertTrue(withHistory.extract("$F looks good").isEmpty());
    }

    @Test
    void isLikelySymbol_shouldApplyGazetteerRules() {
        assertTrue(extractor.isLikelySymbol("NVDA"));
        assertTrue(extractor.isLikelySymbol("A"));
        assertFalse(extractor.isLikelySymbol("F"));
        assertFalse(extractor.isLikelySymbol("EMA"));
        assertFalse(extractor.isLikelySymbol("nvda"));
        assertFalse(extractor.isLikelySymbol("TOOLONG"));
    }

    private static Candidate find(List<Candidate> candidates, String ticker) {
        return candidates.stream()
                .filter(c -> c.ticker.equals(ticker))
                .findFirst()
                .orElseThrow(() -> new AssertionError(ticker + " missing from " + candidates));
    }

    private static List<String> generatedTickers(int count) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add("Z" + (char) ('A' + i / 26) + (char) ('A' + i % 26));
        }
        return out;
    }

    private static final class RecentFetcherStub implements RecentMessageFetcher {
        private final List<String> texts;
        private int calls;

        private RecentFetcherStub(List<String> texts) {
            this.texts = texts;
        }

        @Override
        public List<ChannelMessage> fetchRecent(String channelId, int limit) {
            calls++;
            List<ChannelMessage> out = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                out.add(ChannelMessage.builder()
                        .id(String.valueOf(i))
                        .channelId(channelId)
                        .text(texts.get(i))
                        .createdAt(Instant.parse("2024-06-10T10:00:00Z"))
                        .build());
            }
            return out;
        }
    }
}
