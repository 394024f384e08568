package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.MarketRegime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegimeResult {

    MarketRegime regime;

    /** 0..1 */
    double confidence;

    List<RegimeSignal> signals;
    RegimeAdjustments adjustments;
    String recommendation;
}
