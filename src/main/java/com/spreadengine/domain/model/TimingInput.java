package com.spreadengine.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Market context for entry timing. Every field except price may be missing.
 */
@Value
@Builder
public class TimingInput {

    double currentPrice;
    Double rsi;
    Double ma50;
    Double support1;
    Double ivRank;
}
