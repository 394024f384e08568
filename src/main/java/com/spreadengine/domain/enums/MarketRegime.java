package com.spreadengine.domain.enums;

public enum MarketRegime {
    BULL,
    NEUTRAL,
    CAUTION,
    BEAR
}
