package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.ConfidenceLevel;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConfidenceScore {

    int total;
    ConfidenceLevel level;
    Map<String, Integer> breakdown;
}
