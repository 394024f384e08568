package com.spreadengine.domain.enums;

public enum TimingAction {
    ENTER,
    WAIT
}
