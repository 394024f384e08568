package com.spreadengine.screening;

/**
 * A ticker whose evaluation failed inside a batch.
 */
public record ScreeningFailure(String ticker, String message) {}
