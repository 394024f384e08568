package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.MomentumTrend;
import com.spreadengine.domain.enums.RelativeStrengthTrend;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConfidenceInput {

    /** Externally supplied stock score, 0..100. */
    double stockScore;

    int checklistPassed;
    int checklistTotal;

    MomentumTrend momentumOverall;

    /** Per-indicator momentum directions, used for the consensus adjustment. */
    List<MomentumTrend> momentumSignals;

    RelativeStrengthTrend relativeStrengthTrend;
    MarketRegime marketRegime;
    Double ivRank;
}
