package com.spreadengine.decision;

import com.spreadengine.domain.enums.StrategyType;
import com.spreadengine.domain.model.SpreadCandidate;
import com.spreadengine.scoring.ConfidenceWeights;
import com.spreadengine.scoring.SpreadScoringProfile;
import com.spreadengine.sizing.PositionSizingMatrix;
import com.spreadengine.timing.TimingProfile;
import java.math.BigDecimal;
import java.util.List;

/**
 * Everything that differs between spread variants: scoring tables, confidence weights,
 * sizing matrix, timing thresholds, and the wording of trade guidance.
 *
 * <p>Two implementations exist:
 * <ul>
 *   <li>{@link CreditSpreadProfile}: bull put credit spreads</li>
 *   <li>{@link DebitSpreadProfile}: deep in-the-money call debit spreads</li>
 * </ul>
 *
 * <p>Resolved by {@link StrategyProfileFactory} based on {@link StrategyType}. The tables are
 * immutable, so both variants can be evaluated concurrently.
 */
public interface StrategyProfile {

    StrategyType getType();

    SpreadScoringProfile getScoringProfile();

    ConfidenceWeights getConfidenceWeights();

    PositionSizingMatrix getSizingMatrix();

    TimingProfile getTimingProfile();

    /**
     * Whether a price below the 200-day MA (and not oversold) should defer entry.
     */
    boolean waitsBelowMa200();

    /**
     * IV rank under which the decision carries a low-IV warning, or null for no warning.
     */
    Double lowIvWarningThreshold();

    /**
     * How to place the trade.
     *
     * @param spread the recommended spread, or null when no candidate was usable
     */
    List<String> entryGuidance(SpreadCandidate spread, double currentPrice);

    /**
     * How to manage the position once open.
     *
     * @param spread the recommended spread, or null when no candidate was usable
     * @param maxLossPerContract worst-case loss of one contract in dollars
     */
    List<String> riskManagement(SpreadCandidate spread, BigDecimal maxLossPerContract);
}
