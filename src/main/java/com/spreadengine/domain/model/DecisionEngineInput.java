package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.MomentumTrend;
import com.spreadengine.domain.enums.RelativeStrengthTrend;
import com.spreadengine.domain.enums.StrategyType;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the decision engine needs for one ticker.
 *
 * <p>Market context ({@code currentPrice}, {@code rsiValue}, {@code ma50}, {@code ma200},
 * {@code support1}) may be given explicitly or derived from {@code priceHistory}; explicit
 * values win. {@code asOfDate} anchors days-to-expiration so evaluation never reads the clock.
 */
@Value
@Builder(toBuilder = true)
public class DecisionEngineInput {

    String ticker;

    @Builder.Default
    StrategyType strategyType = StrategyType.CREDIT_SPREAD;

    LocalDate asOfDate;

    Double currentPrice;
    List<PriceBar> priceHistory;
    Double rsiValue;
    Double ma50;
    Double ma200;
    Double support1;

    double stockScore;
    int checklistPassed;
    int checklistTotal;
    List<String> checklistFailReasons;

    MomentumTrend momentumOverall;
    List<MomentumTrend> momentumSignals;
    RelativeStrengthTrend relativeStrengthTrend;

    /** Current market regime; detected from {@code benchmarkHistory} when null. */
    MarketRegime marketRegime;

    List<PriceBar> benchmarkHistory;

    Double ivRank;
    Integer daysToEarnings;

    List<SpreadCandidate> spreadCandidates;

    /** Overrides the configured account size when set. */
    Double accountSize;

    /** Overrides the configured max risk percent when set. */
    Double maxRiskPercent;
}
