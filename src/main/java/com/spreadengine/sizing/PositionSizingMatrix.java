package com.spreadengine.sizing;

import com.spreadengine.domain.enums.ConfidenceLevel;
import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.PositionSize;
import com.spreadengine.domain.enums.StrategyType;
import java.util.EnumMap;
import java.util.Map;

/**
 * Confidence level x market regime lookup of position tiers for one strategy variant.
 *
 * @param warnOnWeakFactors add sizing warnings for weak momentum and relative strength
 */
public record PositionSizingMatrix(
        StrategyType strategyType, Map<ConfidenceLevel, Map<MarketRegime, PositionSize>> table, boolean warnOnWeakFactors) {

    public PositionSizingMatrix {
        Map<ConfidenceLevel, Map<MarketRegime, PositionSize>> copy = new EnumMap<>(ConfidenceLevel.class);
        table.forEach((level, row) -> copy.put(level, Map.copyOf(row)));
        table = Map.copyOf(copy);
    }

    /**
     * @return the tier, SKIP for any combination the table does not list
     */
    public PositionSize lookup(ConfidenceLevel level, MarketRegime regime) {
        Map<MarketRegime, PositionSize> row = table.get(level);
        if (row == null || regime == null) {
            return PositionSize.SKIP;
        }
        return row.getOrDefault(regime, PositionSize.SKIP);
    }

    public static PositionSizingMatrix creditSpread() {
        Map<ConfidenceLevel, Map<MarketRegime, PositionSize>> table = new EnumMap<>(ConfidenceLevel.class);
        table.put(ConfidenceLevel.VERY_HIGH, row(PositionSize.FULL, PositionSize.HALF, PositionSize.QUARTER, PositionSize.QUARTER));
        table.put(ConfidenceLevel.HIGH, row(PositionSize.THREE_QUARTER, PositionSize.QUARTER, PositionSize.SKIP, PositionSize.SKIP));
        table.put(ConfidenceLevel.MODERATE, row(PositionSize.HALF, PositionSize.QUARTER, PositionSize.SKIP, PositionSize.SKIP));
        table.put(ConfidenceLevel.LOW, row(PositionSize.QUARTER, PositionSize.SKIP, PositionSize.SKIP, PositionSize.SKIP));
        table.put(ConfidenceLevel.INSUFFICIENT, row(PositionSize.SKIP, PositionSize.SKIP, PositionSize.SKIP, PositionSize.SKIP));
        return new PositionSizingMatrix(StrategyType.CREDIT_SPREAD, table, false);
    }

    public static PositionSizingMatrix debitSpread() {
        Map<ConfidenceLevel, Map<MarketRegime, PositionSize>> table = new EnumMap<>(ConfidenceLevel.class);
        table.put(ConfidenceLevel.VERY_HIGH, row(PositionSize.FULL, PositionSize.THREE_QUARTER, PositionSize.HALF, PositionSize.HALF));
        table.put(ConfidenceLevel.HIGH, row(PositionSize.THREE_QUARTER, PositionSize.HALF, PositionSize.QUARTER, PositionSize.QUARTER));
        table.put(ConfidenceLevel.MODERATE, row(PositionSize.HALF, PositionSize.QUARTER, PositionSize.SKIP, PositionSize.SKIP));
        table.put(ConfidenceLevel.LOW, row(PositionSize.QUARTER, PositionSize.SKIP, PositionSize.SKIP, PositionSize.SKIP));
        table.put(ConfidenceLevel.INSUFFICIENT, row(PositionSize.SKIP, PositionSize.SKIP, PositionSize.SKIP, PositionSize.SKIP));
        return new PositionSizingMatrix(StrategyType.DEBIT_SPREAD, table, true);
    }

    private static Map<MarketRegime, PositionSize> row(
            PositionSize bull, PositionSize neutral, PositionSize caution, PositionSize bear) {
        Map<MarketRegime, PositionSize> row = new EnumMap<>(MarketRegime.class);
        row.put(MarketRegime.BULL, bull);
        row.put(MarketRegime.NEUTRAL, neutral);
        row.put(MarketRegime.CAUTION, caution);
        row.put(MarketRegime.BEAR, bear);
        return row;
    }
}
