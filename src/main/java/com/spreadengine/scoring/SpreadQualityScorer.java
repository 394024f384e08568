package com.spreadengine.scoring;

import com.spreadengine.domain.enums.SpreadRating;
import com.spreadengine.domain.enums.StrategyType;
import com.spreadengine.domain.model.SpreadCandidate;
import com.spreadengine.domain.model.SpreadQualityScore;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores a spread candidate on seven independent components and sums them into 0..100.
 *
 * <p>Credit spreads protect the short strike: distance is measured from price down to it and
 * support is expected above it. Debit spreads protect breakeven ({@code longStrike + debit})
 * the same way. Days to expiration count from the caller's {@code asOfDate}.
 */
@Component
public class SpreadQualityScorer {

    private static final Logger log = LoggerFactory.getLogger(SpreadQualityScorer.class);

    /**
     * Whether the candidate has every number scoring needs: finite strikes, a finite premium
     * of the profile's kind, and an expiration. Degenerate values such as a zero width still
     * score.
     */
    public boolean isWellFormed(SpreadCandidate candidate, StrategyType strategyType) {
        return candidate != null
                && isFinite(candidate.getLongStrike())
                && isFinite(candidate.getShortStrike())
                && isFinite(premiumOf(candidate, strategyType))
                && candidate.getExpiration() != null;
    }

    /**
     * Well-formed with strikes that differ and a non-negative premium, so that it can be sized.
     */
    public boolean isTradable(SpreadCandidate candidate, StrategyType strategyType) {
        return isWellFormed(candidate, strategyType)
                && candidate.getWidth() > 0
                && premiumOf(candidate, strategyType) >= 0;
    }

    /**
     * @param support nearest support level, or null when unknown
     * @param daysToEarnings days until the next earnings report, or null when none is scheduled
     * @throws IllegalArgumentException when a required number is missing or not finite
     */
    public SpreadQualityScore score(
            SpreadCandidate candidate,
            Double support,
            Integer daysToEarnings,
            double currentPrice,
            LocalDate asOfDate,
            SpreadScoringProfile profile) {
        if (!isWellFormed(candidate, profile.strategyType())) {
            throw new IllegalArgumentException("Spread candidate is missing required fields: " + candidate);
        }

        double width = candidate.getWidth();
        double premium = premiumOf(candidate, profile.strategyType());
        double protectedLevel = profile.strategyType() == StrategyType.CREDIT_SPREAD
                ? candidate.getShortStrike()
                : candidate.getLongStrike() + premium;
        long daysToExpiration = ChronoUnit.DAYS.between(asOfDate, candidate.getExpiration());

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        double premiumPct = width > 0 ? premium / width * 100 : Double.NaN;
        breakdown.put(profile.premiumLabel(), profile.premiumRatio().score(premiumPct));
        breakdown.put(profile.distanceLabel(), profile.distance().score((currentPrice - protectedLevel) / currentPrice * 100));
        breakdown.put("ivRank", profile.ivRank().score(orNaN(candidate.getIvRank())));
        breakdown.put("supportBuffer", supportPoints(support, protectedLevel, profile));
        breakdown.put("daysToExpiration", profile.daysToExpiration().score(daysToExpiration));
        breakdown.put("delta", profile.delta().score(Math.abs(orNaN(scoredDelta(candidate, profile.strategyType())))));
        breakdown.put("earningsRisk", earningsPoints(daysToEarnings, daysToExpiration, profile));

        int sum = breakdown.values().stream().mapToInt(Integer::intValue).sum();
        int total = Math.max(0, Math.min(100, sum));
        SpreadRating rating = rate(total);

        log.debug(
                "Scored {} {}/{} exp {}: {} ({})",
                profile.strategyType(),
                candidate.getLongStrike(),
                candidate.getShortStrike(),
                candidate.getExpiration(),
                total,
                breakdown);
        return SpreadQualityScore.builder()
                .total(total)
                .breakdown(breakdown)
                .rating(rating)
                .build();
    }

    public static SpreadRating rate(int total) {
        if (total >= 80) {
            return SpreadRating.EXCELLENT;
        }
        if (total >= 60) {
            return SpreadRating.GOOD;
        }
        if (total >= 40) {
            return SpreadRating.FAIR;
        }
        return SpreadRating.POOR;
    }

    /**
     * Premium collected (credit) or paid (debit) per share.
     */
    public static Double premiumOf(SpreadCandidate candidate, StrategyType strategyType) {
        return strategyType == StrategyType.CREDIT_SPREAD ? candidate.getNetCredit() : candidate.getNetDebit();
    }

    private int supportPoints(Double support, double protectedLevel, SpreadScoringProfile profile) {
        if (support == null || !Double.isFinite(support)) {
            return profile.noSupport();
        }
        if (support <= protectedLevel) {
            return profile.supportBelowProtectedLevel();
        }
        double bufferPct = (support - protectedLevel) / protectedLevel * 100;
        return profile.supportBuffer().score(bufferPct);
    }

    private int earningsPoints(Integer daysToEarnings, long daysToExpiration, SpreadScoringProfile profile) {
        if (daysToEarnings == null || daysToEarnings < 0) {
            return profile.noEarnings();
        }
        return profile.earnings().score(daysToEarnings - daysToExpiration);
    }

    private static Double scoredDelta(SpreadCandidate candidate, StrategyType strategyType) {
        if (strategyType == StrategyType.DEBIT_SPREAD && candidate.getLongDelta() != null) {
            return candidate.getLongDelta();
        }
        return candidate.getShortDelta();
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }

    private static double orNaN(Double value) {
        return value != null ? value : Double.NaN;
    }
}
