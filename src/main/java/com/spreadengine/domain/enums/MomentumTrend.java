package com.spreadengine.domain.enums;

public enum MomentumTrend {
    IMPROVING,
    STABLE,
    DETERIORATING
}
