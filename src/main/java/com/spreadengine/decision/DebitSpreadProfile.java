package com.spreadengine.decision;

import com.spreadengine.domain.enums.StrategyType;
import com.spreadengine.domain.model.SpreadCandidate;
import com.spreadengine.scoring.ConfidenceWeights;
import com.spreadengine.scoring.SpreadScoringProfile;
import com.spreadengine.sizing.PositionSizingMatrix;
import com.spreadengine.timing.TimingProfile;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Deep in-the-money call debit spread: buy a call well below price and sell one above it,
 * paying most of the width for a high probability of expiring at full value.
 */
@Component
public class DebitSpreadProfile implements StrategyProfile {

    private final SpreadScoringProfile scoringProfile = SpreadScoringProfile.debitSpread();
    private final ConfidenceWeights confidenceWeights = ConfidenceWeights.debitSpread();
    private final PositionSizingMatrix sizingMatrix = PositionSizingMatrix.debitSpread();
    private final TimingProfile timingProfile = TimingProfile.debitSpread();

    @Override
    public StrategyType getType() {
        return StrategyType.DEBIT_SPREAD;
    }

    @Override
    public SpreadScoringProfile getScoringProfile() {
        return scoringProfile;
    }

    @Override
    public ConfidenceWeights getConfidenceWeights() {
        return confidenceWeights;
    }

    @Override
    public PositionSizingMatrix getSizingMatrix() {
        return sizingMatrix;
    }

    @Override
    public TimingProfile getTimingProfile() {
        return timingProfile;
    }

    @Override
    public boolean waitsBelowMa200() {
        return true;
    }

    @Override
    public Double lowIvWarningThreshold() {
        return null;
    }

    @Override
    public List<String> entryGuidance(SpreadCandidate spread, double currentPrice) {
        if (spread == null) {
            return List.of("Look for a call spread with breakeven 5-7% below price and 21-45 days to expiration");
        }
        double width = spread.getWidth();
        double debit = spread.getNetDebit();
        double breakeven = spread.getLongStrike() + debit;
        List<String> guidance = new ArrayList<>();
        guidance.add(String.format(
                "Buy the %.2f call and sell the %.2f call expiring %s",
                spread.getLongStrike(), spread.getShortStrike(), spread.getExpiration()));
        guidance.add(String.format(
                "Pay no more than $%.2f debit (%.0f%% of the $%.2f width)", debit, debit / width * 100, width));
        guidance.add(String.format(
                "Breakeven $%.2f is %.1f%% below the current price of $%.2f",
                breakeven, (currentPrice - breakeven) / currentPrice * 100, currentPrice));
        guidance.add("Use a limit order at or near the mid price");
        return guidance;
    }

    @Override
    public List<String> riskManagement(SpreadCandidate spread, BigDecimal maxLossPerContract) {
        List<String> rules = new ArrayList<>();
        rules.add("Take profit at 50% of the maximum profit");
        if (spread != null && spread.getNetDebit() != null) {
            rules.add(String.format(
                    "Exit if price closes below breakeven at %.2f", spread.getLongStrike() + spread.getNetDebit()));
        }
        rules.add("Close by 7 days to expiration to avoid pin risk");
        rules.add("Max loss per contract: $" + maxLossPerContract.toPlainString());
        return rules;
    }
}
