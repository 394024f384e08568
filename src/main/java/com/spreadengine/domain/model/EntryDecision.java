package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.EntryAction;
import com.spreadengine.domain.enums.EntryTimeframe;
import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.StrategyType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Final entry recommendation for one ticker, with every intermediate result that fed it.
 */
@Value
@Builder
public class EntryDecision {

    String ticker;
    StrategyType strategyType;

    EntryAction action;
    ConfidenceScore confidence;
    EntryTimeframe timeframe;
    PositionSizing positionSizing;

    /** Best-scoring well-formed candidate, or null when none was offered. */
    SpreadCandidate recommendedSpread;

    SpreadQualityScore spreadScore;
    TimingAnalysis timing;

    /** Regime the decision was made under, as supplied or detected from the benchmark. */
    MarketRegime regime;

    /** Technical signals on the ticker's own history, or null when no history was supplied. */
    TechnicalAnalysis technicalAnalysis;

    List<String> reasoning;
    List<String> entryGuidance;
    List<String> riskManagement;
    List<String> warnings;
}
