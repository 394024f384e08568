package com.spreadengine.domain.enums;

/**
 * Spread variant being evaluated. Each variant carries its own scoring, confidence,
 * sizing and timing tables (see {@link com.spreadengine.decision.StrategyProfile}).
 */
public enum StrategyType {
    /** Bull put credit spread: short higher strike put, long lower strike put. */
    CREDIT_SPREAD,
    /** Deep in-the-money call debit spread. */
    DEBIT_SPREAD
}
