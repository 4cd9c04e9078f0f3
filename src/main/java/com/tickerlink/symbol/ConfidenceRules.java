package com.tickerlink.symbol;

import java.util.List;

/**
 * The confidence pipeline for one token. Rules are pure and run in declaration order.
 */
public final class ConfidenceRules {
    public static final double BASE = 0.5;

    public static final ConfidenceRule BASE_SCORE = (token, ctx) -> token.plus(BASE, "base");

    public static final ConfidenceRule DOLLAR_PREFIX = (token, ctx) ->
            token.match.prefix == '$' ? token.plus(0.4, "dollar") : token;

    public static final ConfidenceRule HASH_PREFIX = (token, ctx) ->
            token.match.prefix == '#' ? token.plus(0.3, "hash") : token;

    public static final ConfidenceRule STOCK_VOCABULARY = (token, ctx) -> {
        for (String keyword : ctx.lexicon.stockVocabulary()) {
            if (ctx.lowerText.contains(keyword)) {
                return token.plus(0.2, "vocab");
            }
        }
        return token;
    };

    public static final ConfidenceRule HEBREW_KEYWORDS = (token, ctx) ->
            token.plus(ctx.lexicon.hebrewTierBonus(ctx.text), "hebrew");

    public static final ConfidenceRule LENGTH = (token, ctx) -> {
        int length = token.match.symbol.length();
        return length >= 2 && length <= 4 ? token.plus(0.1, "length") : token;
    };

    public static final ConfidenceRule WHITESPACE_SURROUNDED = (token, ctx) -> {
        int before = ctx.charBefore(token.match);
        int after = ctx.charAfter(token.match);
        if (before >= 0 && after >= 0 && Character.isWhitespace(before) && Character.isWhitespace(after)) {
            return token.plus(0.1, "spaced");
        }
        return token;
    };

    public static final ConfidenceRule ALLOWLISTED = (token, ctx) ->
            ctx.allowlist.isAllowed(token.match.symbol) ? token.plus(0.4, "allowlist") : token;

    public static final ConfidenceRule CLAMP = (token, ctx) -> token.capped();

    public static final List<ConfidenceRule> STANDARD = List.of(
            BASE_SCORE,
            DOLLAR_PREFIX,
            HASH_PREFIX,
            STOCK_VOCABULARY,
            HEBREW_KEYWORDS,
            LENGTH,
            WHITESPACE_SURROUNDED,
            ALLOWLISTED,
            CLAMP
    );

    private ConfidenceRules() {
    }

    public static ScoredToken score(TokenMatch match, ScanContext context) {
        return apply(ScoredToken.start(match), context, STANDARD);
    }

    /** Standard score plus a recovery bonus, clamped again. */
    public static ScoredToken scoreWithBonus(TokenMatch match, ScanContext context, double bonus, String note) {
        return score(match, context).plus(bonus, note).capped();
    }

    public static ScoredToken apply(ScoredToken token, ScanContext context, List<ConfidenceRule> rules) {
        ScoredToken current = token;
        for (ConfidenceRule rule : rules) {
            current = rule.apply(current, context);
        }
        return current;
    }
}
