package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.PriceVsMa;
import com.spreadengine.domain.enums.RsiZone;
import com.spreadengine.domain.enums.TimingAction;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TimingAnalysis {

    TimingAction action;
    RsiZone rsiZone;
    PriceVsMa priceVsMa;

    /** Percent distance from price down to support. */
    double distanceToSupport;

    boolean ivRankFavorable;

    /** Price level worth waiting for; set only when the action is WAIT. */
    Double waitTarget;

    String reason;
}
