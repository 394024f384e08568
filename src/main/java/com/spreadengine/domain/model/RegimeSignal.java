package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.SignalDirection;

/**
 * One weighted vote in the regime classification.
 *
 * @param value percent distance behind the vote (price vs MA, MA50 vs MA200)
 */
public record RegimeSignal(String name, double value, SignalDirection signal, double weight) {}
