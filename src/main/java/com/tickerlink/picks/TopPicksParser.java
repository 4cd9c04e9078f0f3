package com.tickerlink.picks;

import com.tickerlink.symbol.SymbolValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the structured "top picks" post format:
 * <pre>
 * ❕ טופ פיקס:
 * 📈 Long: NVDA, AMD, F
 * 📉 Short: TSLA
 * </pre>
 * Single letters are kept only when another valid ticker shares their list.
 */
public final class TopPicksParser {
    private static final Pattern MARKER = Pattern.compile(
            "(?:טופ\\s*פיקס|top\\s*picks?)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern LONG_LINE = Pattern.compile(
            "(?<![A-Za-z])long\\s*[:：]\\s*(.*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHORT_LINE = Pattern.compile(
            "(?<![A-Za-z])short\\s*[:：]\\s*(.*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATORS = Pattern.compile("[,，、/／|\\s]+");
    private static final Pattern SYMBOL = Pattern.compile("(?<![A-Za-z0-9])[A-Z]{1,5}(?![A-Za-z0-9])");

    private final SymbolValidator validator;

    public TopPicksParser(SymbolValidator validator) {
        this.validator = validator;
    }

    public TopPicks parse(String text) {
        if (text == null || text.isBlank()) {
            return TopPicks.EMPTY;
        }
        Matcher marker = MARKER.matcher(text);
        if (!marker.find()) {
            return TopPicks.EMPTY;
        }
        List<String> longs = null;
        List<String> shorts = null;
        for (String line : text.substring(marker.end()).split("\\r?\\n")) {
            if (longs == null) {
                Matcher m = LONG_LINE.matcher(line);
                if (m.find()) {
                    longs = symbolsOf(m.group(1));
                    continue;
                }
            }
            if (shorts == null) {
                Matcher m = SHORT_LINE.matcher(line);
                if (m.find()) {
                    shorts = symbolsOf(m.group(1));
                }
            }
        }
        return new TopPicks(true, longs, shorts);
    }

    List<String> symbolsOf(String listText) {
        List<String> raw = new ArrayList<>();
        Matcher matcher = SYMBOL.matcher(SEPARATORS.matcher(listText).replaceAll(" "));
        while (matcher.find()) {
            raw.add(matcher.group());
        }
        boolean hasValidNeighbour = false;
        for (String token : raw) {
            if (validator.isValid(token)) {
                hasValidNeighbour = true;
                break;
            }
        }
        List<String> out = new ArrayList<>();
        for (String token : raw) {
            SymbolValidator.Verdict verdict = validator.check(token);
            boolean keep = verdict == SymbolValidator.Verdict.VALID
                    || (verdict == SymbolValidator.Verdict.SINGLE_LETTER && hasValidNeighbour);
            if (keep && !out.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }
}
