package com.spreadengine.api.dto.response;

import com.spreadengine.domain.model.NearestSupport;
import com.spreadengine.domain.model.SupportResistanceLevel;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Detected support/resistance levels plus the nearest support below the current price
 * (null when there is none).
 */
@Value
@Builder
public class SupportLevelsResponse {

    double currentPrice;
    List<SupportResistanceLevel> levels;
    NearestSupport nearestSupport;
}
