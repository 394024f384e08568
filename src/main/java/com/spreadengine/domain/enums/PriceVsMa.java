package com.spreadengine.domain.enums;

public enum PriceVsMa {
    ABOVE,
    BELOW,
    AT
}
