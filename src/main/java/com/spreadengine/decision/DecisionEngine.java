package com.spreadengine.decision;

import com.spreadengine.domain.enums.ConfidenceLevel;
import com.spreadengine.domain.enums.EntryAction;
import com.spreadengine.domain.enums.EntryTimeframe;
import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.MomentumTrend;
import com.spreadengine.domain.enums.PositionSize;
import com.spreadengine.domain.enums.RelativeStrengthTrend;
import com.spreadengine.domain.enums.RsiZone;
import com.spreadengine.domain.enums.TimingAction;
import com.spreadengine.domain.model.ConfidenceInput;
import com.spreadengine.domain.model.ConfidenceScore;
import com.spreadengine.domain.model.DecisionEngineInput;
import com.spreadengine.domain.model.EntryDecision;
import com.spreadengine.domain.model.PositionSizing;
import com.spreadengine.domain.model.ScoredSpread;
import com.spreadengine.domain.model.SpreadCandidate;
import com.spreadengine.domain.model.TechnicalAnalysis;
import com.spreadengine.domain.model.TimingAnalysis;
import com.spreadengine.domain.model.TimingInput;
import com.spreadengine.regime.RegimeDetector;
import com.spreadengine.scoring.ConfidenceScorer;
import com.spreadengine.scoring.SpreadQualityScorer;
import com.spreadengine.signal.TechnicalSignalDetector;
import com.spreadengine.sizing.PositionSizer;
import com.spreadengine.timing.TimingAnalyzer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Combines spread scoring, confidence, sizing and timing into one {@link EntryDecision}.
 *
 * <p>Candidates are ranked by quality total, highest first; ties keep input order. The final
 * action comes from an ordered override chain where the first matching rule wins:
 * <ol>
 *   <li>SKIP sizing tier or INSUFFICIENT confidence: PASS</li>
 *   <li>BEAR regime: PASS</li>
 *   <li>price below the 50-day MA and RSI oversold: PASS</li>
 *   <li>price below the 200-day MA and not oversold, for profiles that wait on it:
 *       WAIT_FOR_PULLBACK</li>
 *   <li>timing says WAIT: WAIT_FOR_PULLBACK</li>
 *   <li>otherwise ENTER_NOW</li>
 * </ol>
 *
 * <p>Warnings are advisory and never change the action. Evaluation is deterministic: days to
 * expiration come from {@link DecisionEngineInput#getAsOfDate()}.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final double DEFAULT_SPREAD_WIDTH = 5.0;
    static final int EARNINGS_WARNING_DAYS = 14;
    static final int CHECKLIST_FAILURE_WARNING = 2;
    static final int MAX_FAIL_REASONS = 3;

    private final StrategyProfileFactory strategyProfileFactory;
    private final MarketContextResolver marketContextResolver;
    private final TechnicalSignalDetector technicalSignalDetector;
    private final RegimeDetector regimeDetector;
    private final SpreadQualityScorer spreadQualityScorer;
    private final ConfidenceScorer confidenceScorer;
    private final PositionSizer positionSizer;
    private final TimingAnalyzer timingAnalyzer;

    public DecisionEngine(
            StrategyProfileFactory strategyProfileFactory,
            MarketContextResolver marketContextResolver,
            TechnicalSignalDetector technicalSignalDetector,
            RegimeDetector regimeDetector,
            SpreadQualityScorer spreadQualityScorer,
            ConfidenceScorer confidenceScorer,
            PositionSizer positionSizer,
            TimingAnalyzer timingAnalyzer) {
        this.strategyProfileFactory = strategyProfileFactory;
        this.marketContextResolver = marketContextResolver;
        this.technicalSignalDetector = technicalSignalDetector;
        this.regimeDetector = regimeDetector;
        this.spreadQualityScorer = spreadQualityScorer;
        this.confidenceScorer = confidenceScorer;
        this.positionSizer = positionSizer;
        this.timingAnalyzer = timingAnalyzer;
    }

    /**
     * Evaluates one ticker.
     *
     * @throws IllegalArgumentException when the input has no price, no price history, or no
     *     as-of date
     */
    public EntryDecision evaluateEntry(DecisionEngineInput input) {
        if (input.getAsOfDate() == null) {
            throw new IllegalArgumentException("asOfDate is required");
        }
        StrategyProfile profile = strategyProfileFactory.getProfile(input.getStrategyType());
        MarketContext market = marketContextResolver.resolve(input);
        List<String> warnings = new ArrayList<>();

        TechnicalAnalysis technicalAnalysis = input.getPriceHistory() != null
                ? technicalSignalDetector.detect(input.getPriceHistory())
                : null;
        MarketRegime regime = input.getMarketRegime() != null
                ? input.getMarketRegime()
                : regimeDetector.detect(input.getBenchmarkHistory()).getRegime();

        // Spread selection
        List<ScoredSpread> ranked = rankCandidates(input, market, profile, warnings);
        ScoredSpread best = ranked.isEmpty() ? null : ranked.get(0);
        SpreadCandidate spread = best != null ? best.candidate() : null;
        Double ivRank = input.getIvRank() != null ? input.getIvRank() : spread != null ? spread.getIvRank() : null;

        ConfidenceScore confidence = confidenceScorer.score(
                ConfidenceInput.builder()
                        .stockScore(input.getStockScore())
                        .checklistPassed(input.getChecklistPassed())
                        .checklistTotal(input.getChecklistTotal())
                        .momentumOverall(input.getMomentumOverall())
                        .momentumSignals(input.getMomentumSignals())
                        .relativeStrengthTrend(input.getRelativeStrengthTrend())
                        .marketRegime(regime)
                        .ivRank(ivRank)
                        .build(),
                profile.getConfidenceWeights());

        double width = spread != null ? spread.getWidth() : DEFAULT_SPREAD_WIDTH;
        double premium = spread != null ? SpreadQualityScorer.premiumOf(spread, profile.getType()) : 0;
        PositionSizing sizing = positionSizer.size(
                confidence,
                regime,
                width,
                premium,
                input.getAccountSize(),
                input.getMaxRiskPercent(),
                profile.getSizingMatrix());

        TimingAnalysis timing = timingAnalyzer.analyze(
                TimingInput.builder()
                        .currentPrice(market.currentPrice())
                        .rsi(market.rsi())
                        .ma50(market.ma50())
                        .support1(market.support1())
                        .ivRank(ivRank)
                        .build(),
                profile.getTimingProfile());

        // Override chain
        List<String> reasoning = new ArrayList<>();
        EntryAction action;
        EntryTimeframe timeframe;
        boolean oversold = timing.getRsiZone() == RsiZone.OVERSOLD;
        boolean belowMa50 = market.ma50() != null && market.currentPrice() < market.ma50();
        boolean belowMa200 = market.ma200() != null && market.currentPrice() < market.ma200();

        if (sizing.getSize() == PositionSize.SKIP || confidence.getLevel() == ConfidenceLevel.INSUFFICIENT) {
            action = EntryAction.PASS;
            timeframe = EntryTimeframe.THIS_WEEK;
            reasoning.add(String.format(
                    "Confidence %s (%d/100) does not support a position in a %s market",
                    confidence.getLevel(), confidence.getTotal(), regime));
        } else if (regime == MarketRegime.BEAR) {
            action = EntryAction.PASS;
            timeframe = EntryTimeframe.NEXT_WEEK;
            reasoning.add("Bear market: too risky for new bullish entries");
        } else if (belowMa50 && oversold) {
            action = EntryAction.PASS;
            timeframe = EntryTimeframe.THIS_WEEK;
            reasoning.add("Price below the 50-day MA and oversold: wait for the trend to stabilize");
        } else if (profile.waitsBelowMa200() && belowMa200 && !oversold) {
            action = EntryAction.WAIT_FOR_PULLBACK;
            timeframe = EntryTimeframe.THIS_WEEK;
            reasoning.add(String.format("Price below the 200-day MA (%.2f): wait for a reclaim", market.ma200()));
        } else if (timing.getAction() == TimingAction.WAIT) {
            action = EntryAction.WAIT_FOR_PULLBACK;
            timeframe = EntryTimeframe.ONE_TO_THREE_DAYS;
            reasoning.add(timing.getReason());
        } else {
            action = EntryAction.ENTER_NOW;
            timeframe = EntryTimeframe.IMMEDIATE;
            reasoning.add("Entry conditions met: " + timing.getReason());
        }
        reasoning.add(String.format("Confidence: %s (%d/100)", confidence.getLevel(), confidence.getTotal()));
        if (best != null) {
            reasoning.add(String.format(
                    "Best spread quality: %s (%d/100)",
                    best.score().getRating(), best.score().getTotal()));
        }
        reasoning.add(String.format("Market regime: %s", regime));

        addWarnings(input, profile, regime, ivRank, warnings);

        BigDecimal maxLossPerContract = positionSizer.maxLossPerContract(profile.getType(), width, premium);
        EntryDecision decision = EntryDecision.builder()
                .ticker(input.getTicker())
                .strategyType(profile.getType())
                .action(action)
                .confidence(confidence)
                .timeframe(timeframe)
                .positionSizing(sizing)
                .recommendedSpread(spread)
                .spreadScore(best != null ? best.score() : null)
                .timing(timing)
                .regime(regime)
                .technicalAnalysis(technicalAnalysis)
                .reasoning(List.copyOf(reasoning))
                .entryGuidance(entryGuidance(action, timing, spread, market, profile))
                .riskManagement(List.copyOf(profile.riskManagement(spread, maxLossPerContract)))
                .warnings(List.copyOf(warnings))
                .build();

        log.info(
                "Evaluated {} {}: {} ({}, confidence {} {}, size {})",
                input.getTicker(),
                profile.getType(),
                action,
                timeframe,
                confidence.getLevel(),
                confidence.getTotal(),
                sizing.getSize());
        return decision;
    }

    private List<ScoredSpread> rankCandidates(
            DecisionEngineInput input, MarketContext market, StrategyProfile profile, List<String> warnings) {
        List<SpreadCandidate> candidates = input.getSpreadCandidates() != null ? input.getSpreadCandidates() : List.of();
        if (candidates.isEmpty()) {
            warnings.add("No spread candidates available");
            return List.of();
        }

        List<ScoredSpread> scored = new ArrayList<>();
        int skipped = 0;
        for (SpreadCandidate candidate : candidates) {
            if (!spreadQualityScorer.isTradable(candidate, profile.getType())) {
                skipped++;
                continue;
            }
            scored.add(new ScoredSpread(
                    candidate,
                    spreadQualityScorer.score(
                            candidate,
                            market.support1(),
                            input.getDaysToEarnings(),
                            market.currentPrice(),
                            input.getAsOfDate(),
                            profile.getScoringProfile())));
        }
        if (skipped > 0) {
            log.warn("{}: skipped {} unusable spread candidate(s)", input.getTicker(), skipped);
            warnings.add(String.format("%d spread candidate(s) skipped: missing fields or zero width", skipped));
        }
        if (scored.isEmpty()) {
            warnings.add("No spread candidates available");
        }

        // List.sort is stable: the first candidate with the top score wins
        scored.sort(Comparator.comparingInt((ScoredSpread s) -> s.score().getTotal()).reversed());
        return scored;
    }

    private void addWarnings(
            DecisionEngineInput input, StrategyProfile profile, MarketRegime regime, Double ivRank, List<String> warnings) {
        Integer daysToEarnings = input.getDaysToEarnings();
        if (daysToEarnings != null && daysToEarnings >= 0 && daysToEarnings < EARNINGS_WARNING_DAYS) {
            warnings.add(String.format("Earnings in %d days: gap risk through the report", daysToEarnings));
        }
        if (regime == MarketRegime.BEAR) {
            warnings.add("Bear market: elevated risk for new bullish positions");
        }
        if (input.getMomentumOverall() == MomentumTrend.DETERIORATING) {
            warnings.add("Momentum deteriorating");
        }
        Double lowIv = profile.lowIvWarningThreshold();
        if (lowIv != null && ivRank != null && ivRank < lowIv) {
            warnings.add(String.format("IV Rank very low (%.0f): premium may not justify the risk", ivRank));
        }

        int failed = input.getChecklistTotal() - input.getChecklistPassed();
        if (failed > CHECKLIST_FAILURE_WARNING) {
            warnings.add(String.format("%d of %d checklist items failed", failed, input.getChecklistTotal()));
        }
        if (input.getChecklistFailReasons() != null) {
            input.getChecklistFailReasons().stream()
                    .limit(MAX_FAIL_REASONS)
                    .forEach(reason -> warnings.add("Checklist: " + reason));
        }
        if (input.getRelativeStrengthTrend() == RelativeStrengthTrend.UNDERPERFORMING) {
            warnings.add("Underperforming the market");
        }
    }

    private static List<String> entryGuidance(
            EntryAction action,
            TimingAnalysis timing,
            SpreadCandidate spread,
            MarketContext market,
            StrategyProfile profile) {
        List<String> guidance = new ArrayList<>();
        switch (action) {
            case PASS -> guidance.add("No entry: re-evaluate when conditions improve");
            case WAIT_FOR_PULLBACK -> {
                if (timing.getWaitTarget() != null) {
                    guidance.add(String.format("Re-evaluate near $%.2f", timing.getWaitTarget()));
                }
                guidance.addAll(profile.entryGuidance(spread, market.currentPrice()));
            }
            default -> guidance.addAll(profile.entryGuidance(spread, market.currentPrice()));
        }
        return List.copyOf(guidance);
    }
}
