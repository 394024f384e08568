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
 * Bull put credit spread: sell an out-of-the-money put below support and buy a lower put
 * for protection. Regime carries more weight here because short premium is exposed to
 * sharp selloffs.
 */
@Component
public class CreditSpreadProfile implements StrategyProfile {

    static final double LOW_IV_RANK = 20;

    private final SpreadScoringProfile scoringProfile = SpreadScoringProfile.creditSpread();
    private final ConfidenceWeights confidenceWeights = ConfidenceWeights.creditSpread();
    private final PositionSizingMatrix sizingMatrix = PositionSizingMatrix.creditSpread();
    private final TimingProfile timingProfile = TimingProfile.creditSpread();

    @Override
    public StrategyType getType() {
        return StrategyType.CREDIT_SPREAD;
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
        return false;
    }

    @Override
    public Double lowIvWarningThreshold() {
        return LOW_IV_RANK;
    }

    @Override
    public List<String> entryGuidance(SpreadCandidate spread, double currentPrice) {
        if (spread == null) {
            return List.of("Look for a put spread 7-12% below price with 30-45 days to expiration");
        }
        double width = spread.getWidth();
        double credit = spread.getNetCredit();
        List<String> guidance = new ArrayList<>();
        guidance.add(String.format(
                "Sell the %.2f put and buy the %.2f put expiring %s",
                spread.getShortStrike(), spread.getLongStrike(), spread.getExpiration()));
        guidance.add(String.format(
                "Collect at least $%.2f credit (%.0f%% of the $%.2f width)", credit, credit / width * 100, width));
        guidance.add(String.format(
                "Short strike sits %.1f%% below the current price of $%.2f",
                (currentPrice - spread.getShortStrike()) / currentPrice * 100, currentPrice));
        guidance.add("Use a limit order at or near the mid price");
        return guidance;
    }

    @Override
    public List<String> riskManagement(SpreadCandidate spread, BigDecimal maxLossPerContract) {
        List<String> rules = new ArrayList<>();
        rules.add("Take profit at 50% of the credit received");
        rules.add("Close if the spread's loss reaches 2x the credit received");
        rules.add("Close or roll at 21 days to expiration");
        if (spread != null) {
            rules.add(String.format("Exit if price closes below the %.2f short strike", spread.getShortStrike()));
        }
        rules.add("Max loss per contract: $" + maxLossPerContract.toPlainString());
        return rules;
    }
}
