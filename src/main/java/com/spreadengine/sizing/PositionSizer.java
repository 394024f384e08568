package com.spreadengine.sizing;

import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.PositionSize;
import com.spreadengine.domain.enums.StrategyType;
import com.spreadengine.domain.model.ConfidenceScore;
import com.spreadengine.domain.model.PositionSizing;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a confidence level and market regime into a position tier and contract count.
 *
 * <p>Formula: maxRisk = accountSize * maxRiskPercent / 100 * tierPercent / 100, and
 * contracts = floor(maxRisk / maxLossPerContract). Max loss per contract is
 * (width - credit) * multiplier for credit spreads and debit * multiplier for debit spreads.
 * A SKIP tier or a non-positive max loss yields zero contracts.
 */
@Component
public class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    static final int WEAK_MOMENTUM_POINTS = 10;
    static final int WEAK_RELATIVE_STRENGTH_POINTS = 8;

    private final AccountProperties accountProperties;

    public PositionSizer(AccountProperties accountProperties) {
        this.accountProperties = accountProperties;
    }

    /**
     * @param premium credit received or debit paid per share
     * @param accountSize overrides the configured account size when non-null
     * @param maxRiskPercent overrides the configured max risk percent when non-null
     */
    public PositionSizing size(
            ConfidenceScore confidence,
            MarketRegime regime,
            double spreadWidth,
            double premium,
            Double accountSize,
            Double maxRiskPercent,
            PositionSizingMatrix matrix) {
        PositionSize size = matrix.lookup(confidence.getLevel(), regime);

        BigDecimal account = accountSize != null ? BigDecimal.valueOf(accountSize) : accountProperties.getAccountSize();
        BigDecimal riskPercent =
                maxRiskPercent != null ? BigDecimal.valueOf(maxRiskPercent) : accountProperties.getMaxRiskPercent();

        // maxRisk = account * riskPercent/100 * tier/100
        BigDecimal maxRiskDollars = account.multiply(riskPercent)
                .multiply(BigDecimal.valueOf(size.getPercentage()))
                .divide(BigDecimal.valueOf(10_000), 2, RoundingMode.HALF_UP)
                .max(BigDecimal.ZERO);

        BigDecimal maxLossPerContract = maxLossPerContract(matrix.strategyType(), spreadWidth, premium);
        int contracts = 0;
        if (size != PositionSize.SKIP && maxLossPerContract.compareTo(BigDecimal.ZERO) > 0) {
            contracts = maxRiskDollars.divide(maxLossPerContract, 0, RoundingMode.DOWN).intValue();
        }

        List<String> reasoning = new ArrayList<>();
        reasoning.add(String.format("Confidence: %s (%d/100)", confidence.getLevel(), confidence.getTotal()));
        reasoning.add(String.format("Market: %s regime", regime));
        if (size == PositionSize.SKIP) {
            reasoning.add("Confidence and market conditions do not support a position");
        } else if (contracts == 0) {
            reasoning.add("Position size too small to trade");
        } else {
            reasoning.add(String.format(
                    "%d%% of max position: $%s at risk, up to %d contract(s)",
                    size.getPercentage(), maxRiskDollars.toPlainString(), contracts));
        }
        if (regime == MarketRegime.BEAR) {
            reasoning.add("Bear market: reduced position sizes");
        }
        if (matrix.warnOnWeakFactors()) {
            addFactorWarnings(confidence, reasoning);
        }

        log.debug("Sized {} {} x {}: {} ({} contracts)", matrix.strategyType(), confidence.getLevel(), regime, size, contracts);
        return PositionSizing.builder()
                .size(size)
                .percentage(size.getPercentage())
                .maxContracts(contracts)
                .maxRiskDollars(maxRiskDollars)
                .reasoning(List.copyOf(reasoning))
                .build();
    }

    /**
     * Worst-case loss of one contract, zero or negative when the inputs cannot lose money.
     */
    public BigDecimal maxLossPerContract(StrategyType strategyType, double spreadWidth, double premium) {
        double perShare = strategyType == StrategyType.CREDIT_SPREAD ? spreadWidth - premium : premium;
        return BigDecimal.valueOf(perShare)
                .multiply(BigDecimal.valueOf(accountProperties.getContractMultiplier()))
                .setScale(2, RoundingMode.HALF_UP);
    }

    private static void addFactorWarnings(ConfidenceScore confidence, List<String> reasoning) {
        Integer momentum = confidence.getBreakdown().get("momentum");
        if (momentum != null && momentum < WEAK_MOMENTUM_POINTS) {
            reasoning.add("Weak momentum: consider a smaller size");
        }
        Integer relativeStrength = confidence.getBreakdown().get("relativeStrength");
        if (relativeStrength != null && relativeStrength < WEAK_RELATIVE_STRENGTH_POINTS) {
            reasoning.add("Underperforming the market: consider a smaller size");
        }
    }
}
