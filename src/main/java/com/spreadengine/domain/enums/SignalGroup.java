package com.spreadengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Theme a technical signal belongs to. Correlated signals within one group share a
 * points cap so that five moving-average signals cannot dominate the score.
 *
 * <p>A cap of {@code -1} marks an uncapped group.
 */
@Getter
@RequiredArgsConstructor
public enum SignalGroup {
    MOVING_AVERAGE(15),
    MOMENTUM(12),
    PRICE_POSITION(12),
    PULLBACK(15),
    RECOVERY(10),
    TREND(-1),
    VOLUME(-1);

    private final int defaultCap;

    public boolean isCapped() {
        return defaultCap >= 0;
    }
}
