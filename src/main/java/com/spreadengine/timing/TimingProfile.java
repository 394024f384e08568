package com.spreadengine.timing;

import com.spreadengine.domain.enums.RsiZone;
import com.spreadengine.domain.enums.StrategyType;

/**
 * RSI zone boundaries and IV preference for entry timing of one strategy variant.
 *
 * <p>RSI below {@code oversoldBelow} is OVERSOLD, up to {@code idealUpTo} IDEAL, up to
 * {@code neutralUpTo} NEUTRAL, below {@code overboughtFrom} EXTENDED, else OVERBOUGHT.
 *
 * @param ivThreshold credit spreads want IV rank at or above it, debit spreads at or below
 */
public record TimingProfile(
        StrategyType strategyType,
        double oversoldBelow,
        double idealUpTo,
        double neutralUpTo,
        double overboughtFrom,
        double ivThreshold) {

    public static TimingProfile creditSpread() {
        return new TimingProfile(StrategyType.CREDIT_SPREAD, 30, 40, 55, 65, 30);
    }

    public static TimingProfile debitSpread() {
        return new TimingProfile(StrategyType.DEBIT_SPREAD, 30, 50, 55, 70, 50);
    }

    public RsiZone zoneOf(double rsi) {
        if (rsi < oversoldBelow) {
            return RsiZone.OVERSOLD;
        }
        if (rsi <= idealUpTo) {
            return RsiZone.IDEAL;
        }
        if (rsi <= neutralUpTo) {
            return RsiZone.NEUTRAL;
        }
        if (rsi < overboughtFrom) {
            return RsiZone.EXTENDED;
        }
        return RsiZone.OVERBOUGHT;
    }

    /**
     * Credit spreads need elevated IV (missing counts as zero); debit spreads prefer cheap
     * IV and treat missing as acceptable.
     */
    public boolean isIvFavorable(Double ivRank) {
        if (strategyType == StrategyType.CREDIT_SPREAD) {
            return ivRank != null && ivRank >= ivThreshold;
        }
        return ivRank == null || ivRank <= ivThreshold;
    }
}
