package com.spreadengine.scoring;

import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.MomentumTrend;
import com.spreadengine.domain.enums.RelativeStrengthTrend;
import java.util.EnumMap;
import java.util.Map;

/**
 * Factor weights for confidence scoring of one strategy variant.
 *
 * @param stockScoreWeight points for a perfect stock score (scaled linearly)
 * @param checklistWeight points for a fully passed checklist (scaled by pass rate)
 * @param momentumCap upper bound on momentum points after the consensus adjustment
 * @param consensusThreshold indicators needed in agreement before the consensus adjustment
 *     applies; zero disables it
 * @param ivRank ladder over IV rank; missing IV rank scores the fallback
 */
public record ConfidenceWeights(
        int stockScoreWeight,
        int checklistWeight,
        Map<MomentumTrend, Integer> momentum,
        int momentumCap,
        int consensusThreshold,
        int consensusBonus,
        int consensusPenalty,
        Map<RelativeStrengthTrend, Integer> relativeStrength,
        Map<MarketRegime, Integer> regime,
        PointLadder ivRank) {

    private static final Map<RelativeStrengthTrend, Integer> RELATIVE_STRENGTH = new EnumMap<>(Map.of(
            RelativeStrengthTrend.STRONG, 15,
            RelativeStrengthTrend.MODERATE, 10,
            RelativeStrengthTrend.WEAK, 5,
            RelativeStrengthTrend.UNDERPERFORMING, 2));

    public ConfidenceWeights {
        momentum = Map.copyOf(momentum);
        relativeStrength = Map.copyOf(relativeStrength);
        regime = Map.copyOf(regime);
    }

    public static ConfidenceWeights creditSpread() {
        return new ConfidenceWeights(
                25,
                20,
                Map.of(MomentumTrend.IMPROVING, 15, MomentumTrend.STABLE, 10, MomentumTrend.DETERIORATING, 3),
                15,
                0,
                0,
                0,
                RELATIVE_STRENGTH,
                Map.of(MarketRegime.BULL, 15, MarketRegime.NEUTRAL, 8, MarketRegime.CAUTION, 4, MarketRegime.BEAR, 0),
                PointLadder.builder().atLeast(50, 10).atLeast(30, 6).atLeast(15, 3).otherwise(0));
    }

    public static ConfidenceWeights debitSpread() {
        return new ConfidenceWeights(
                30,
                25,
                Map.of(MomentumTrend.IMPROVING, 20, MomentumTrend.STABLE, 12, MomentumTrend.DETERIORATING, 4),
                20,
                4,
                3,
                5,
                RELATIVE_STRENGTH,
                Map.of(MarketRegime.BULL, 10, MarketRegime.NEUTRAL, 6, MarketRegime.CAUTION, 4, MarketRegime.BEAR, 2),
                PointLadder.builder().otherwise(0));
    }
}
