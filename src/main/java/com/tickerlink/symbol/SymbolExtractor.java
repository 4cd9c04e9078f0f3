package com.tickerlink.symbol;

import com.tickerlink.config.Lexicon;
import com.tickerlink.model.Candidate;
import com.tickerlink.picks.TopPicks;
import com.tickerlink.picks.TopPicksParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds ticker mentions in free text.
 *
 * <p>Pass one scores every ticker-shaped token and keeps the ones above the confidence floor.
 * Single letters other than A and I are held back. Pass two re-admits them when the message
 * already reads like a list of tickers, when they carry a prefix, or when they sit next to an
 * accepted multi-letter ticker. With a {@link HistoryCorroborator} configured, prefixed single
 * letters wait for pass three, which admits the ones seen prefixed in recent history.</p>
 */
public final class SymbolExtractor {
    private static final Logger LOG = LogManager.getLogger(SymbolExtractor.class);

    static final Pattern TOKEN = Pattern.compile("(?<![A-Za-z0-9$#])([$#]?)([A-Z]{1,5})(?![A-Za-z0-9])");

    static final double MIN_CONFIDENCE = 0.3;
    static final double MIN_ALLOWLISTED = 0.2;
    static final double BONUS_TRUSTED_CONTEXT = 0.2;
    static final double BONUS_PREFIX = 0.1;
    static final double BONUS_ADJACENT = 0.15;
    static final double BONUS_CORROBORATED = 0.3;

    public static final int DEFAULT_MAX_CANDIDATES = 25;

    private final Lexicon lexicon;
    private final SymbolAllowlist allowlist;
    private final SymbolValidator validator;
    private final TopPicksParser topPicksParser;
    private final HistoryCorroborator corroborator;
    private final int maxCandidates;

    public SymbolExtractor(Lexicon lexicon) {
        this(lexicon, SymbolAllowlist.staticOnly(lexicon), DEFAULT_MAX_CANDIDATES, null);
    }

    public SymbolExtractor(Lexicon lexicon, SymbolAllowlist allowlist, int maxCandidates, HistoryCorroborator corroborator) {
        this.lexicon = lexicon;
        this.allowlist = allowlist;
        this.validator = new SymbolValidator(lexicon, allowlist);
        this.topPicksParser = new TopPicksParser(validator);
        this.corroborator = corroborator;
        this.maxCandidates = maxCandidates;
    }

    public List<Candidate> extract(String text) {
        return extract(text, false);
    }

    /**
     * @param listContext caller already knows the message is a ticker list, so held-back single letters are trusted
     */
    public List<Candidate> extract(String text, boolean listContext) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        ScanContext context = new ScanContext(text, lexicon, allowlist);
        PassResult result = passOne(scanTokens(text), context);
        result = passTwo(result, context, listContext);
        if (corroborator != null) {
            result = passThree(result, context);
        }
        List<Candidate> out = finalizeCandidates(result.accepted, maxCandidates);
        if (LOG.isDebugEnabled() && !out.isEmpty()) {
            LOG.debug("extracted {} from '{}'", out, abbreviate(text));
        }
        return out;
    }

    /**
     * Tickers named by a top-picks block, long side first. Empty when the text has no marker.
     * Not capped.
     */
    public List<Candidate> extractTopPicks(String text) {
        return finalizeCandidates(parseTopPicks(text).toCandidates(), 0);
    }

    public TopPicks parseTopPicks(String text) {
        return topPicksParser.parse(text);
    }

    public boolean isLikelySymbol(String token) {
        return validator.isValid(token);
    }

    static List<TokenMatch> scanTokens(String text) {
        List<TokenMatch> out = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String prefix = matcher.group(1);
            char p = prefix.isEmpty() ? TokenMatch.NO_PREFIX : prefix.charAt(0);
            out.add(new TokenMatch(matcher.group(2), matcher.start(2), p));
        }
        return out;
    }

    PassResult passOne(List<TokenMatch> tokens, ScanContext context) {
        List<Candidate> accepted = new ArrayList<>();
        List<TokenMatch> held = new ArrayList<>();
        for (TokenMatch token : tokens) {
            SymbolValidator.Verdict verdict = validator.check(token.symbol);
            switch (verdict) {
                case VALID -> {
                    ScoredToken scored = ConfidenceRules.score(token, context);
                    boolean allowed = allowlist.isAllowed(token.symbol);
                    if (scored.confidence >= MIN_CONFIDENCE || (allowed && scored.confidence >= MIN_ALLOWLISTED)) {
                        accepted.add(scored.toCandidate());
                    } else {
                        LOG.trace("below floor {}", scored);
                    }
                }
                case SINGLE_LETTER -> held.add(token);
                default -> LOG.trace("rejected {} as {}", token.symbol, verdict);
            }
        }
        return new PassResult(accepted, held);
    }

    PassResult passTwo(PassResult first, ScanContext context, boolean listContext) {
        if (first.held.isEmpty()) {
            return first;
        }
        boolean trusted = listContext || first.accepted.size() >= 2;
        List<Candidate> accepted = new ArrayList<>(first.accepted);
        List<TokenMatch> stillHeld = new ArrayList<>();
        for (TokenMatch token : first.held) {
            if (trusted) {
                accepted.add(ConfidenceRules.scoreWithBonus(token, context, BONUS_TRUSTED_CONTEXT, "list").toCandidate());
            } else if (token.hasPrefix()) {
                if (corroborator != null) {
                    stillHeld.add(token);
                } else {
                    accepted.add(ConfidenceRules.scoreWithBonus(token, context, BONUS_PREFIX, "prefixed").toCandidate());
                }
            } else if (isAdjacentToMultiLetter(token, first.accepted, context.text)) {
                accepted.add(ConfidenceRules.scoreWithBonus(token, context, BONUS_ADJACENT, "adjacent").toCandidate());
            } else {
                stillHeld.add(token);
            }
        }
        return new PassResult(accepted, stillHeld);
    }

    PassResult passThree(PassResult second, ScanContext context) {
        Set<String> wanted = new LinkedHashSet<>();
        for (TokenMatch token : second.held) {
            if (token.hasPrefix()) {
                wanted.add(token.symbol);
            }
        }
        if (wanted.isEmpty()) {
            return second;
        }
        Set<String> confirmed = corroborator.corroborate(wanted);
        List<Candidate> accepted = new ArrayList<>(second.accepted);
        List<TokenMatch> stillHeld = new ArrayList<>();
        for (TokenMatch token : second.held) {
            if (token.hasPrefix() && confirmed.contains(token.symbol)) {
                accepted.add(ConfidenceRules.scoreWithBonus(token, context, BONUS_CORROBORATED, "history").toCandidate());
            } else {
                stillHeld.add(token);
            }
        }
        return new PassResult(accepted, stillHeld);
    }

    /**
     * One candidate per ticker, best first. {@code cap <= 0} means uncapped.
     */
    static List<Candidate> finalizeCandidates(List<Candidate> candidates, int cap) {
        Map<String, Candidate> best = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            Candidate existing = best.get(candidate.ticker);
            if (candidate.beats(existing)) {
                best.put(candidate.ticker, candidate);
            }
        }
        List<Candidate> out = new ArrayList<>(best.values());
        out.sort(Candidate.DISPLAY_ORDER);
        if (cap > 0 && out.size() > cap) {
            return List.copyOf(out.subList(0, cap));
        }
        return List.copyOf(out);
    }

    static boolean isAdjacentToMultiLetter(TokenMatch token, List<Candidate> accepted, String text) {
        for (Candidate candidate : accepted) {
            if (candidate.ticker.length() < 2) {
                continue;
            }
            int candidateEnd = candidate.sourceOffset + candidate.ticker.length();
            if (candidateEnd <= token.start() && isSeparatorGap(text, candidateEnd, token.start())) {
                return true;
            }
            if (token.end() <= candidate.sourceOffset && isSeparatorGap(text, token.end(), candidate.sourceOffset)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSeparatorGap(String text, int from, int to) {
        if (from >= to) {
            return false;
        }
        int i = from;
        while (i < to) {
            int cp = text.codePointAt(i);
            if (!isSeparator(cp)) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }

    private static boolean isSeparator(int cp) {
        if (Character.isWhitespace(cp) || cp == '/' || cp == ',' || cp == '$' || cp == '#') {
            return true;
        }
        int type = Character.getType(cp);
        return type == Character.OTHER_SYMBOL
                || type == Character.MODIFIER_SYMBOL
                || type == Character.NON_SPACING_MARK
                || type == Character.ENCLOSING_MARK
                || type == Character.FORMAT;
    }

    private static String abbreviate(String text) {
        String flat = text.replace('\n', ' ');
        return flat.length() <= 80 ? flat : flat.substring(0, 80) + "...";
    }

    static final class PassResult {
        final List<Candidate> accepted;
        final List<TokenMatch> held;

        PassResult(List<Candidate> accepted, List<TokenMatch> held) {
            this.accepted = List.copyOf(accepted);
            this.held = List.copyOf(held);
        }
    }
}
