package com.spreadengine.domain.enums;

/**
 * Final entry recommendation. {@link #SCALE_IN} is part of the vocabulary for callers
 * that stage entries themselves; the decision engine does not emit it.
 */
public enum EntryAction {
    ENTER_NOW,
    SCALE_IN,
    WAIT_FOR_PULLBACK,
    PASS
}
