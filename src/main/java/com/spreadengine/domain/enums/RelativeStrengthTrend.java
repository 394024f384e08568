package com.spreadengine.domain.enums;

public enum RelativeStrengthTrend {
    STRONG,
    MODERATE,
    WEAK,
    UNDERPERFORMING
}
