package com.spreadengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Discrete position tiers and the share of the maximum position each represents.
 */
@Getter
@RequiredArgsConstructor
public enum PositionSize {
    FULL(100),
    THREE_QUARTER(75),
    HALF(50),
    QUARTER(25),
    SKIP(0);

    private final int percentage;
}
