package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.SignalCategory;
import com.spreadengine.domain.enums.SignalGroup;
import lombok.Builder;
import lombok.Value;

/**
 * A named bullish observation on a price series worth a number of points.
 *
 * <p>{@code value} carries the measurement that triggered the signal (RSI reading,
 * percent distance, ADX level) and is null when the signal is purely structural.
 */
@Value
@Builder(toBuilder = true)
public class TechnicalSignal {

    String name;

    @Builder.Default
    SignalCategory category = SignalCategory.TECHNICAL;

    SignalGroup group;

    int points;

    String description;

    Double value;
}
