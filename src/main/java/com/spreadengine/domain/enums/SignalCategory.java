package com.spreadengine.domain.enums;

public enum SignalCategory {
    TECHNICAL,
    ANALYST
}
