package com.spreadengine.domain.enums;

public enum LevelType {
    SUPPORT,
    RESISTANCE
}
