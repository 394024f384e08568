package com.spreadengine.decision;

/**
 * Resolved market context for one ticker. Everything but the price may be unknown.
 */
public record MarketContext(double currentPrice, Double rsi, Double ma50, Double ma200, Double support1) {}
