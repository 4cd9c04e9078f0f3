package com.tickerlink.index;

public record IndexStats(int tickers, int records, int freshTickers) {
}
