package com.tickerlink.symbol;

/**
 * A ticker-shaped run of uppercase letters as it appeared in the text.
 * {@code offset} points at the first letter, not at the prefix.
 */
public final class TokenMatch {
    public static final char NO_PREFIX = '\0';

    public final String symbol;
    public final int offset;
    public final char prefix;

    public TokenMatch(String symbol, int offset, char prefix) {
        this.symbol = symbol == null ? "" : symbol;
        this.offset = Math.max(0, offset);
        this.prefix = prefix == '$' || prefix == '#' ? prefix : NO_PREFIX;
    }

    public boolean hasPrefix() {
        return prefix != NO_PREFIX;
    }

    public boolean isSingleLetter() {
        return symbol.length() == 1;
    }

    /** Offset of the prefix when present, else of the first letter. */
    public int start() {
        return hasPrefix() ? offset - 1 : offset;
    }

    public int end() {
        return offset + symbol.length();
    }
}
