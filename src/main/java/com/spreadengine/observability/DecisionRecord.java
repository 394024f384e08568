package com.spreadengine.observability;

import com.spreadengine.domain.enums.ConfidenceLevel;
import com.spreadengine.domain.enums.EntryAction;
import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.PositionSize;
import com.spreadengine.domain.enums.StrategyType;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Compact summary of one evaluated decision, kept in the in-memory ring buffer.
 */
@Value
@Builder
public class DecisionRecord {

    Instant timestamp;
    String ticker;
    StrategyType strategyType;
    EntryAction action;
    ConfidenceLevel confidenceLevel;
    int confidenceTotal;
    MarketRegime regime;
    PositionSize positionSize;
    int maxContracts;
    Integer spreadScore;
    List<String> reasoning;
    List<String> warnings;
}
