package com.tickerlink.symbol;

import com.tickerlink.config.Lexicon;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a bare uppercase token may stand for a ticker.
 */
public final class SymbolValidator {
    public enum Verdict {
        VALID,
        SINGLE_LETTER,
        DISALLOWED,
        MALFORMED
    }

    private static final Pattern TICKER_SHAPE = Pattern.compile("^[A-Z]{1,5}$");
    private static final Set<String> KNOWN_SINGLE_LETTERS = Set.of("A", "I");

    private final Lexicon lexicon;
    private final SymbolAllowlist allowlist;

    public SymbolValidator(Lexicon lexicon, SymbolAllowlist allowlist) {
        this.lexicon = lexicon;
        this.allowlist = allowlist;
    }

    public Verdict check(String token) {
        if (token == null || !TICKER_SHAPE.matcher(token).matches()) {
            return Verdict.MALFORMED;
        }
        if (allowlist.isAllowed(token)) {
            return Verdict.VALID;
        }
        if (lexicon.isDisallowed(token)) {
            return Verdict.DISALLOWED;
        }
        if (token.length() == 1 && !KNOWN_SINGLE_LETTERS.contains(token)) {
            return Verdict.SINGLE_LETTER;
        }
        return Verdict.VALID;
    }

    public boolean isValid(String token) {
        return check(token) == Verdict.VALID;
    }
}
