package com.spreadengine.domain.enums;

public enum SignalDirection {
    BULLISH,
    BEARISH,
    NEUTRAL
}
