package com.tickerlink.symbol;

@FunctionalInterface
public interface ConfidenceRule {
    ScoredToken apply(ScoredToken token, ScanContext context);
}
