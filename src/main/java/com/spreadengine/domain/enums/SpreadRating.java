package com.spreadengine.domain.enums;

public enum SpreadRating {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR
}
