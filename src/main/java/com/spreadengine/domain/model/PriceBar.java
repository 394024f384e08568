package com.spreadengine.domain.model;

import java.time.LocalDate;

/**
 * One daily OHLCV bar. Series are passed oldest first.
 */
public record PriceBar(LocalDate date, double open, double high, double low, double close, long volume) {}
