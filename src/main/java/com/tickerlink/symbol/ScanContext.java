package com.tickerlink.symbol;

import com.tickerlink.config.Lexicon;

import java.util.Locale;

/**
 * Read-only view of one message shared by all rules of a scan.
 */
public final class ScanContext {
    public final String text;
    public final String lowerText;
    public final Lexicon lexicon;
    public final SymbolAllowlist allowlist;

    public ScanContext(String text, Lexicon lexicon, SymbolAllowlist allowlist) {
        this.text = text == null ? "" : text;
        this.lowerText = this.text.toLowerCase(Locale.ROOT);
        this.lexicon = lexicon;
        this.allowlist = allowlist;
    }

    /** Character before the token (the prefix if it has one), or -1 at the start of the text. */
    public int charBefore(TokenMatch match) {
        int index = match.offset - 1;
        return index >= 0 ? text.charAt(index) : -1;
    }

    /** Character after the token, or -1 at the end of the text. */
    public int charAfter(TokenMatch match) {
        int index = match.end();
        return index < text.length() ? text.charAt(index) : -1;
    }
}
