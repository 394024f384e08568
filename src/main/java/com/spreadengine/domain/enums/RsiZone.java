package com.spreadengine.domain.enums;

public enum RsiZone {
    OVERSOLD,
    IDEAL,
    NEUTRAL,
    EXTENDED,
    OVERBOUGHT
}
