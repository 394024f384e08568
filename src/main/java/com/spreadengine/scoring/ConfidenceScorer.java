package com.spreadengine.scoring;

import com.spreadengine.domain.enums.ConfidenceLevel;
import com.spreadengine.domain.enums.MomentumTrend;
import com.spreadengine.domain.model.ConfidenceInput;
import com.spreadengine.domain.model.ConfidenceScore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Combines stock quality, checklist, momentum, relative strength, market regime and IV rank
 * into a 0..100 confidence score and level.
 *
 * <p>A missing momentum trend scores as deteriorating; missing relative strength or regime
 * score zero.
 */
@Component
public class ConfidenceScorer {

    public ConfidenceScore score(ConfidenceInput input, ConfidenceWeights weights) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();

        double stockScore = Math.max(0, Math.min(100, input.getStockScore()));
        breakdown.put("stockScore", (int) Math.round(stockScore / 100 * weights.stockScoreWeight()));

        double passRate = input.getChecklistTotal() > 0
                ? Math.min(1.0, Math.max(0, input.getChecklistPassed()) / (double) input.getChecklistTotal())
                : 0;
        breakdown.put("checklist", (int) Math.round(passRate * weights.checklistWeight()));

        breakdown.put("momentum", momentumPoints(input, weights));
        breakdown.put("relativeStrength", lookup(weights.relativeStrength(), input.getRelativeStrengthTrend()));
        breakdown.put("marketRegime", lookup(weights.regime(), input.getMarketRegime()));
        breakdown.put(
                "ivRank",
                input.getIvRank() != null
                        ? weights.ivRank().score(input.getIvRank())
                        : weights.ivRank().score(Double.NaN));

        int sum = breakdown.values().stream().mapToInt(Integer::intValue).sum();
        int total = Math.max(0, Math.min(100, sum));
        return ConfidenceScore.builder()
                .total(total)
                .level(levelFor(total))
                .breakdown(breakdown)
                .build();
    }

    public static ConfidenceLevel levelFor(int total) {
        if (total >= 85) {
            return ConfidenceLevel.VERY_HIGH;
        }
        if (total >= 70) {
            return ConfidenceLevel.HIGH;
        }
        if (total >= 55) {
            return ConfidenceLevel.MODERATE;
        }
        if (total >= 40) {
            return ConfidenceLevel.LOW;
        }
        return ConfidenceLevel.INSUFFICIENT;
    }

    private int momentumPoints(ConfidenceInput input, ConfidenceWeights weights) {
        MomentumTrend overall =
                input.getMomentumOverall() != null ? input.getMomentumOverall() : MomentumTrend.DETERIORATING;
        int points = weights.momentum().getOrDefault(overall, 0);

        List<MomentumTrend> signals = input.getMomentumSignals();
        if (weights.consensusThreshold() > 0 && signals != null) {
            long improving = signals.stream().filter(s -> s == MomentumTrend.IMPROVING).count();
            long deteriorating = signals.stream().filter(s -> s == MomentumTrend.DETERIORATING).count();
            if (improving >= weights.consensusThreshold()) {
                points += weights.consensusBonus();
            } else if (deteriorating >= weights.consensusThreshold()) {
                points -= weights.consensusPenalty();
            }
        }
        return Math.max(0, Math.min(weights.momentumCap(), points));
    }

    private static <K> int lookup(Map<K, Integer> table, K key) {
        return key != null ? table.getOrDefault(key, 0) : 0;
    }
}
