package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.SpreadRating;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpreadQualityScore {

    /** Sum of component points, clamped to 0..100. */
    int total;

    /** Points per component, in scoring order. */
    Map<String, Integer> breakdown;

    SpreadRating rating;
}
