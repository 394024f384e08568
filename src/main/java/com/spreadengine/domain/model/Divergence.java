package com.spreadengine.domain.model;

/**
 * A bullish divergence between two price swing lows: price made a lower low while the
 * oscillator made a higher one. Indexes are relative to the scanned window.
 */
public record Divergence(
        int firstIndex, int secondIndex, double firstPrice, double secondPrice, double firstValue, double secondValue) {}
