package com.spreadengine.domain.enums;

/**
 * Bucketed confidence. Declared from lowest to highest so ordinal comparisons read naturally.
 */
public enum ConfidenceLevel {
    INSUFFICIENT,
    LOW,
    MODERATE,
    HIGH,
    VERY_HIGH
}
