package com.tickerlink.scoring;

/**
 * Result of the index gate for one message.
 */
public record GateDecision(boolean accepted, double score, String reason) {
}
