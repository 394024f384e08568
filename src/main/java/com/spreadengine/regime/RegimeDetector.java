package com.spreadengine.regime;

import static com.spreadengine.indicator.IndicatorCalculator.average;

import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.SignalDirection;
import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.domain.model.RegimeAdjustments;
import com.spreadengine.domain.model.RegimeResult;
import com.spreadengine.domain.model.RegimeSignal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies the broad market from a benchmark index's daily closes.
 *
 * <p>Three weighted votes: price vs the 200-day MA (0.4), price vs the 50-day MA (0.3) and
 * MA50 vs MA200 (0.3). Each vote adds its weight when bullish and subtracts it otherwise.
 * Score above 0.5 is BULL, below -0.3 BEAR, otherwise negative CAUTION, else NEUTRAL.
 *
 * <p>Never throws: short or unusable input yields a conservative NEUTRAL result.
 */
@Component
public class RegimeDetector {

    private static final Logger log = LoggerFactory.getLogger(RegimeDetector.class);

    public static final int MIN_BARS = 200;

    static final double MA200_WEIGHT = 0.4;
    static final double MA50_WEIGHT = 0.3;
    static final double GOLDEN_CROSS_WEIGHT = 0.3;

    public static final RegimeAdjustments CONSERVATIVE_ADJUSTMENTS = new RegimeAdjustments(75, 0.5, true);

    private static final Map<MarketRegime, RegimeAdjustments> ADJUSTMENTS = new EnumMap<>(Map.of(
            MarketRegime.BULL, new RegimeAdjustments(65, 1.0, false),
            MarketRegime.NEUTRAL, new RegimeAdjustments(75, 0.8, false),
            MarketRegime.CAUTION, new RegimeAdjustments(80, 0.75, true),
            MarketRegime.BEAR, new RegimeAdjustments(85, 0.5, true)));

    public RegimeResult detect(List<PriceBar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            log.debug("Regime detection needs {} bars, got {}", MIN_BARS, bars == null ? 0 : bars.size());
            return conservativeDefault("Insufficient benchmark history, trade conservatively");
        }
        try {
            return classify(bars.stream().mapToDouble(PriceBar::close).toArray());
        } catch (RuntimeException e) {
            log.warn("Regime detection failed, using conservative default: {}", e.getMessage());
            return conservativeDefault("Regime unavailable, trade conservatively");
        }
    }

    public static RegimeAdjustments adjustmentsFor(MarketRegime regime) {
        return ADJUSTMENTS.get(regime);
    }

    private RegimeResult classify(double[] closes) {
        int n = closes.length;
        double price = closes[n - 1];
        double ma200 = average(closes, n - 200, n);
        double ma50 = average(closes, n - 50, n);
        if (!Double.isFinite(price) || !(ma200 > 0) || !(ma50 > 0)) {
            throw new IllegalArgumentException("Benchmark closes are not finite and positive");
        }

        List<RegimeSignal> signals = List.of(
                vote("Price vs MA200", (price - ma200) / ma200 * 100, price > ma200, MA200_WEIGHT),
                vote("Price vs MA50", (price - ma50) / ma50 * 100, price > ma50, MA50_WEIGHT),
                vote("Golden Cross", (ma50 - ma200) / ma200 * 100, ma50 > ma200, GOLDEN_CROSS_WEIGHT));

        double score = 0;
        for (RegimeSignal signal : signals) {
            score += signal.signal() == SignalDirection.BULLISH ? signal.weight() : -signal.weight();
        }

        MarketRegime regime;
        double confidence;
        String recommendation;
        if (score > 0.5) {
            regime = MarketRegime.BULL;
            confidence = Math.min(score, 1.0);
            recommendation = "Bull market: normal position sizes, standard entry criteria";
        } else if (score < -0.3) {
            regime = MarketRegime.BEAR;
            confidence = Math.min(Math.abs(score), 1.0);
            recommendation = "Bear market: avoid new entries or use half size on grade A setups only";
        } else if (score < 0) {
            regime = MarketRegime.CAUTION;
            confidence = 0.5;
            recommendation = "Caution: reduce size and require higher scores";
        } else {
            regime = MarketRegime.NEUTRAL;
            confidence = 0.5;
            recommendation = "Neutral market: be selective, slightly reduced size";
        }

        log.debug("Regime {} (score {}, price {}, MA50 {}, MA200 {})", regime, score, price, ma50, ma200);
        return RegimeResult.builder()
                .regime(regime)
                .confidence(confidence)
                .signals(signals)
                .adjustments(ADJUSTMENTS.get(regime))
                .recommendation(recommendation)
                .build();
    }

    private static RegimeSignal vote(String name, double value, boolean bullish, double weight) {
        return new RegimeSignal(
                name, Math.round(value * 100) / 100.0, bullish ? SignalDirection.BULLISH : SignalDirection.BEARISH, weight);
    }

    private static RegimeResult conservativeDefault(String recommendation) {
        return RegimeResult.builder()
                .regime(MarketRegime.NEUTRAL)
                .confidence(0.5)
                .signals(List.of())
                .adjustments(CONSERVATIVE_ADJUSTMENTS)
                .recommendation(recommendation)
                .build();
    }
}
