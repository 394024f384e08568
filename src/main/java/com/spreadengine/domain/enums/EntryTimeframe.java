package com.spreadengine.domain.enums;

public enum EntryTimeframe {
    IMMEDIATE,
    ONE_TO_THREE_DAYS,
    THIS_WEEK,
    NEXT_WEEK
}
