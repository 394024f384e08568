package com.spreadengine.scoring;

import com.spreadengine.domain.enums.StrategyType;

/**
 * Point tables for the seven spread-quality components of one strategy variant.
 *
 * <p>The measurements each ladder receives are computed by {@link SpreadQualityScorer}:
 * <ul>
 *   <li>{@code premiumRatio}: premium as a percent of spread width</li>
 *   <li>{@code distance}: percent from price down to the short strike (credit) or to
 *       breakeven (debit)</li>
 *   <li>{@code ivRank}: implied-volatility rank, 0..100</li>
 *   <li>{@code supportBuffer}: percent by which support sits above the protected level</li>
 *   <li>{@code daysToExpiration}</li>
 *   <li>{@code delta}: absolute delta of the scored leg</li>
 *   <li>{@code earnings}: days from expiration to earnings (negative when earnings fall
 *       before expiration)</li>
 * </ul>
 */
public record SpreadScoringProfile(
        StrategyType strategyType,
        String premiumLabel,
        PointLadder premiumRatio,
        String distanceLabel,
        PointLadder distance,
        PointLadder ivRank,
        PointLadder supportBuffer,
        int supportBelowProtectedLevel,
        int noSupport,
        PointLadder daysToExpiration,
        PointLadder delta,
        PointLadder earnings,
        int noEarnings) {

    private static final PointLadder EARNINGS = PointLadder.builder()
            .above(7, 10)
            .above(0, 7)
            .above(-5, 3)
            .otherwise(0);

    private static final PointLadder SUPPORT_BUFFER = PointLadder.builder()
            .atLeast(5, 15)
            .atLeast(3, 10)
            .atLeast(1, 6)
            .otherwise(3);

    /** Bull put credit spread: sell premium out of the money, below support. */
    public static SpreadScoringProfile creditSpread() {
        return new SpreadScoringProfile(
                StrategyType.CREDIT_SPREAD,
                "creditRatio",
                PointLadder.builder()
                        .between(28, 38, 20)
                        .between(22, 42, 15)
                        .between(18, 48, 10)
                        .atLeast(12, 5)
                        .otherwise(0),
                "distanceOtm",
                PointLadder.builder()
                        .between(7, 12, 20)
                        .between(5, 15, 15)
                        .between(3, 20, 10)
                        .atLeast(1, 5)
                        .otherwise(0),
                PointLadder.builder()
                        .atLeast(50, 15)
                        .atLeast(35, 10)
                        .atLeast(20, 6)
                        .otherwise(2),
                SUPPORT_BUFFER,
                2,
                0,
                PointLadder.builder()
                        .between(30, 45, 10)
                        .between(21, 55, 7)
                        .between(14, 70, 4)
                        .otherwise(2),
                PointLadder.builder()
                        .between(0.23, 0.32, 10)
                        .between(0.18, 0.38, 7)
                        .between(0.12, 0.45, 4)
                        .otherwise(2),
                EARNINGS,
                10);
    }

    /** Deep in-the-money call debit spread: pay most of the width for a high-probability move. */
    public static SpreadScoringProfile debitSpread() {
        return new SpreadScoringProfile(
                StrategyType.DEBIT_SPREAD,
                "debitRatio",
                PointLadder.builder()
                        .between(65, 80, 20)
                        .between(60, 85, 15)
                        .between(55, 90, 10)
                        .when(v -> v > 0 && v <= 95, 5)
                        .otherwise(0),
                "breakevenCushion",
                PointLadder.builder()
                        .atLeast(7, 20)
                        .atLeast(5, 16)
                        .atLeast(3, 10)
                        .atLeast(1, 5)
                        .otherwise(0),
                PointLadder.builder()
                        .atMost(30, 15)
                        .atMost(50, 10)
                        .atMost(70, 6)
                        .otherwise(2),
                SUPPORT_BUFFER,
                2,
                0,
                PointLadder.builder()
                        .between(21, 45, 10)
                        .between(14, 60, 7)
                        .between(7, 90, 4)
                        .otherwise(2),
                PointLadder.builder()
                        .between(0.75, 0.85, 10)
                        .between(0.70, 0.90, 7)
                        .between(0.60, 0.95, 4)
                        .otherwise(2),
                EARNINGS,
                10);
    }
}
