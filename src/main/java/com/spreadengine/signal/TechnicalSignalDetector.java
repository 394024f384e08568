package com.spreadengine.signal;

import static com.spreadengine.indicator.IndicatorCalculator.average;
import static com.spreadengine.indicator.IndicatorCalculator.max;
import static com.spreadengine.indicator.IndicatorCalculator.min;

import com.spreadengine.domain.enums.SignalGroup;
import com.spreadengine.domain.model.Divergence;
import com.spreadengine.domain.model.NearestSupport;
import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.domain.model.TechnicalAnalysis;
import com.spreadengine.domain.model.TechnicalSignal;
import com.spreadengine.indicator.IndicatorCalculator;
import com.spreadengine.indicator.IndicatorCalculator.BollingerBand;
import com.spreadengine.indicator.IndicatorCalculator.MacdSeries;
import com.spreadengine.indicator.PriceSeries;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scans a daily price series for bullish technical signals and scores them.
 *
 * <p>Every sub-signal has its own minimum history. When the series is too short for a
 * sub-signal, or its indicator produces a non-finite value, that sub-signal is simply
 * absent. Points are capped per {@link SignalGroup} and the sum is capped by the configured
 * ceiling. The emitted signals keep their uncapped points so callers can see what fired.
 *
 * <p>The {@code check*} methods are public so individual rules can be evaluated on
 * pre-computed data. Each returns the signal or null.
 */
@Component
public class TechnicalSignalDetector {

    private static final Logger log = LoggerFactory.getLogger(TechnicalSignalDetector.class);

    static final int MIN_BARS = 20;
    static final int RSI_PERIOD = 14;
    static final int DIVERGENCE_LOOKBACK = 20;
    static final int MACD_DIVERGENCE_MIN_BARS = 54;
    static final int YEAR_BARS = 252;
    static final int GOLDEN_CROSS_FRESH_BARS = 5;

    private final SupportResistanceDetector supportResistanceDetector;
    private final SignalProperties signalProperties;
    private final SignalGroupCaps signalGroupCaps;

    public TechnicalSignalDetector(
            SupportResistanceDetector supportResistanceDetector, SignalProperties signalProperties) {
        this.supportResistanceDetector = supportResistanceDetector;
        this.signalProperties = signalProperties;
        this.signalGroupCaps = new SignalGroupCaps(signalProperties.getGroupCaps());
    }

    /**
     * Detects all bullish signals on {@code bars} (oldest first).
     *
     * @return the capped score and the signals that fired; (0, []) for fewer than 20 bars
     */
    public TechnicalAnalysis detect(List<PriceBar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            return TechnicalAnalysis.empty();
        }

        PriceSeries series = PriceSeries.of(bars);
        MarketData data = new MarketData(series);
        List<TechnicalSignal> signals = new ArrayList<>();

        add(signals, "rsi", () -> data.size >= RSI_PERIOD + 1 ? checkRsiZone(data.lastRsi()) : null);
        add(signals, "pullback", () -> checkPullback(data));
        add(signals, "golden-cross", () -> checkGoldenCross(data));
        addAll(signals, "ma-position", () -> checkMaPosition(data));
        add(signals, "ma-proximity", () -> checkMaProximity(data));
        add(signals, "volume", () -> checkVolumeSurge(data));
        add(signals, "support", () -> checkNearSupport(data, bars));
        add(signals, "obv", () -> checkObvTrend(data));
        add(signals, "macd", () -> checkMacd(data));
        add(signals, "52-week", () -> checkYearRange(data));
        add(signals, "adx", () -> checkAdx(data));
        add(signals, "bollinger", () -> checkBollinger(data));
        add(signals, "rsi-divergence", () -> data.size >= DIVERGENCE_LOOKBACK + RSI_PERIOD
                ? checkRsiDivergence(data.closes, data.rsi())
                : null);
        add(signals, "macd-divergence", () -> data.size >= MACD_DIVERGENCE_MIN_BARS
                ? checkMacdDivergence(data.closes, data.macd().histogram())
                : null);

        int score = Math.min(signalGroupCaps.cappedTotal(signals), signalProperties.getScoreCeiling());
        log.debug("Detected {} signals over {} bars, score {}", signals.size(), data.size, score);
        return new TechnicalAnalysis(score, List.copyOf(signals));
    }

    // ---- RSI ----

    public TechnicalSignal checkRsiZone(double rsi) {
        if (!Double.isFinite(rsi)) {
            return null;
        }
        if (rsi >= 35 && rsi <= 50) {
            return signal("RSI Entry Zone", SignalGroup.MOMENTUM, 10, "RSI in the 35-50 entry zone", rsi);
        }
        if (rsi >= 30 && rsi < 35) {
            return signal("RSI Approaching Oversold", SignalGroup.MOMENTUM, 7, "RSI nearing oversold", rsi);
        }
        if (rsi < 30) {
            return signal("RSI Oversold", SignalGroup.MOMENTUM, 5, "RSI below 30, may bounce", rsi);
        }
        if (rsi <= 55) {
            return signal("RSI Acceptable", SignalGroup.MOMENTUM, 4, "RSI slightly above the entry zone", rsi);
        }
        if (rsi < 70) {
            return signal("RSI Extended", SignalGroup.MOMENTUM, 1, "RSI extended, entry less favorable", rsi);
        }
        return null;
    }

    // ---- Moving averages ----

    private TechnicalSignal checkPullback(MarketData data) {
        if (data.size < 200) {
            return null;
        }
        double price = data.price;
        double ma20 = data.last(data.sma20());
        double ma50 = data.last(data.sma50());
        double ma200 = data.last(data.sma200());
        if (price <= ma200) {
            return null;
        }

        double distanceToMa50 = Math.abs(price - ma50) / price;
        if (ma50 > ma200 && distanceToMa50 < 0.03) {
            return signal(
                    "Pullback to MA50",
                    SignalGroup.PULLBACK,
                    12,
                    "Uptrend pullback to the 50-day MA",
                    round2(distanceToMa50 * 100));
        }
        double distanceToMa20 = Math.abs(price - ma20) / price;
        if (ma20 > ma50 && ma50 > ma200 && distanceToMa20 < 0.02) {
            return signal(
                    "Pullback to MA20",
                    SignalGroup.PULLBACK,
                    8,
                    "Strong uptrend pullback to the 20-day MA",
                    round2(distanceToMa20 * 100));
        }
        double recentHigh = max(data.closes, data.size - 20, data.size);
        double pullbackPct = (recentHigh - price) / recentHigh * 100;
        if (pullbackPct >= 5 && pullbackPct <= 15) {
            return signal(
                    "Healthy Pullback",
                    SignalGroup.PULLBACK,
                    7,
                    String.format("Pulled back %.1f%% from the 20-day high in an uptrend", pullbackPct),
                    round2(pullbackPct));
        }
        return null;
    }

    private TechnicalSignal checkGoldenCross(MarketData data) {
        if (data.size < 201) {
            return null;
        }
        double[] sma50 = data.sma50();
        double[] sma200 = data.sma200();
        int last = data.size - 1;
        if (sma50[last] <= sma200[last]) {
            return null;
        }
        int earliest = Math.max(200, data.size - GOLDEN_CROSS_FRESH_BARS);
        for (int i = last; i >= earliest; i--) {
            if (sma50[i] > sma200[i] && sma50[i - 1] <= sma200[i - 1]) {
                return signal("Golden Cross", SignalGroup.MOVING_AVERAGE, 10, "MA50 just crossed above MA200", null);
            }
        }
        return signal("Golden Cross Active", SignalGroup.MOVING_AVERAGE, 6, "MA50 above MA200", null);
    }

    private List<TechnicalSignal> checkMaPosition(MarketData data) {
        List<TechnicalSignal> signals = new ArrayList<>();
        double price = data.price;

        if (data.size >= 200) {
            double ma200 = data.last(data.sma200());
            if (price > ma200) {
                signals.add(signal(
                        "Above MA200",
                        SignalGroup.MOVING_AVERAGE,
                        5,
                        "Price above the 200-day MA",
                        round2((price - ma200) / ma200 * 100)));
            } else {
                TechnicalSignal reclaim = checkNearMa200Reclaim(price, data.closes);
                if (reclaim != null) {
                    signals.add(reclaim);
                }
            }
        }

        int counted = 0;
        int above = 0;
        for (int period : new int[] {20, 50, 200}) {
            if (data.size >= period) {
                counted++;
                if (price > data.last(data.sma(period))) {
                    above++;
                }
            }
        }
        if (counted >= 2) {
            double ratio = (double) above / counted;
            if (ratio >= 0.66) {
                signals.add(signal(
                        "Strong MA Position",
                        SignalGroup.MOVING_AVERAGE,
                        5,
                        String.format("Above %d of %d moving averages", above, counted),
                        ratio));
            } else if (ratio >= 0.5) {
                signals.add(signal(
                        "Mixed MA Position",
                        SignalGroup.MOVING_AVERAGE,
                        2,
                        String.format("Above %d of %d moving averages", above, counted),
                        ratio));
            }
        }
        return signals;
    }

    /**
     * Price slightly below the 200-day MA with signs of recovery: a rising MA50, price above
     * the MA50, and higher recent lows. Two of the three signs are required.
     *
     * @param closes closing prices, oldest first, at least 200 of them
     */
    public TechnicalSignal checkNearMa200Reclaim(double price, double[] closes) {
        int n = closes.length;
        if (n < 200) {
            return null;
        }
        double ma200 = average(closes, n - 200, n);
        double pctBelow = (ma200 - price) / ma200 * 100;
        if (pctBelow <= 0 || pctBelow > 5) {
            return null;
        }

        double ma50 = average(closes, n - 50, n);
        double ma50FiveAgo = average(closes, n - 55, n - 5);
        boolean ma50Rising = ma50 > ma50FiveAgo;
        boolean aboveMa50 = price > ma50;
        boolean higherLows = min(closes, n - 5, n) > min(closes, n - 10, n - 5);

        int recoverySigns = (ma50Rising ? 1 : 0) + (aboveMa50 ? 1 : 0) + (higherLows ? 1 : 0);
        if (recoverySigns < 2) {
            return null;
        }
        return signal(
                "Near MA200 Reclaim",
                SignalGroup.RECOVERY,
                recoverySigns == 3 ? 8 : 5,
                String.format("%.1f%% below MA200 with %d of 3 recovery signs", pctBelow, recoverySigns),
                round2(pctBelow));
    }

    private TechnicalSignal checkMaProximity(MarketData data) {
        if (data.size < 50) {
            return null;
        }
        double price = data.price;
        double ma50 = data.last(data.sma50());
        double belowMa50 = (ma50 - price) / ma50;
        if (price <= ma50 && belowMa50 <= 0.03) {
            return signal(
                    "Near MA50 Support",
                    SignalGroup.MOVING_AVERAGE,
                    4,
                    "Price testing the 50-day MA from above",
                    round2(belowMa50 * 100));
        }
        if (data.size >= 200) {
            double ma200 = data.last(data.sma200());
            double belowMa200 = (ma200 - price) / ma200;
            if (price <= ma200 && belowMa200 <= 0.03) {
                return signal(
                        "Near MA200 Support",
                        SignalGroup.MOVING_AVERAGE,
                        6,
                        "Price testing the 200-day MA",
                        round2(belowMa200 * 100));
            }
        }
        return null;
    }

    // ---- Volume and support ----

    private TechnicalSignal checkVolumeSurge(MarketData data) {
        if (data.size < 11) {
            return null;
        }
        double[] volumes = data.series.volumes();
        double averageVolume = average(volumes, data.size - 11, data.size - 1);
        double lastVolume = volumes[data.size - 1];
        if (averageVolume > 0 && lastVolume >= averageVolume * 1.5) {
            return signal(
                    "Volume Surge",
                    SignalGroup.VOLUME,
                    5,
                    "Volume at least 1.5x the 10-day average",
                    round2(lastVolume / averageVolume));
        }
        return null;
    }

    private TechnicalSignal checkNearSupport(MarketData data, List<PriceBar> bars) {
        NearestSupport nearest = supportResistanceDetector.findNearestSupport(data.price, bars);
        if (SupportResistanceDetector.isNearSupport(nearest, SupportResistanceDetector.NEAR_SUPPORT_THRESHOLD)) {
            return signal(
                    "Near Support",
                    SignalGroup.PRICE_POSITION,
                    5,
                    String.format("Within %.1f%% of support at %.2f", nearest.distance() * 100, nearest.level()),
                    round2(nearest.level()));
        }
        return null;
    }

    // ---- Momentum ----

    private TechnicalSignal checkObvTrend(MarketData data) {
        double[] obv = IndicatorCalculator.onBalanceVolume(data.series.barSeries());
        double recent = average(obv, data.size - 5, data.size);
        double prior = average(obv, data.size - 10, data.size - 5);
        if (recent - prior > Math.abs(prior) * 0.05) {
            return signal("OBV Uptrend", SignalGroup.MOMENTUM, 5, "On-balance volume rising, accumulation", null);
        }
        return null;
    }

    private TechnicalSignal checkMacd(MarketData data) {
        if (data.size < 35) {
            return null;
        }
        MacdSeries macd = data.macd();
        int last = data.size - 1;
        double macdNow = macd.macd()[last];
        double signalNow = macd.signal()[last];
        if (macdNow > signalNow && macd.macd()[last - 1] <= macd.signal()[last - 1]) {
            return signal("MACD Bullish", SignalGroup.MOMENTUM, 5, "MACD crossed above its signal line", macdNow);
        }
        if (macdNow > signalNow && macdNow > 0) {
            return signal("MACD Positive", SignalGroup.MOMENTUM, 3, "MACD above signal and zero", macdNow);
        }
        return null;
    }

    /**
     * Bullish RSI divergence over the last {@value #DIVERGENCE_LOOKBACK} bars: price makes a
     * lower swing low (at least 1% lower) while RSI at that low is more than 3 points higher.
     *
     * @param closes closing prices, oldest first
     * @param rsiValues RSI values aligned with {@code closes}
     */
    public TechnicalSignal checkRsiDivergence(double[] closes, double[] rsiValues) {
        if (closes.length < DIVERGENCE_LOOKBACK || rsiValues.length != closes.length) {
            return null;
        }
        Divergence divergence =
                DivergenceDetector.findBullish(tail(closes), tail(rsiValues), 0.01, 3.0);
        if (divergence == null) {
            return null;
        }
        return signal(
                "Bullish RSI Divergence",
                SignalGroup.MOMENTUM,
                8,
                String.format(
                        "Price lower low (%.2f to %.2f) while RSI rose (%.1f to %.1f)",
                        divergence.firstPrice(),
                        divergence.secondPrice(),
                        divergence.firstValue(),
                        divergence.secondValue()),
                round2(divergence.secondValue()));
    }

    /**
     * Bullish MACD-histogram divergence over the last {@value #DIVERGENCE_LOOKBACK} bars,
     * using the same price swing lows as the RSI check.
     */
    public TechnicalSignal checkMacdDivergence(double[] closes, double[] histogram) {
        if (closes.length < DIVERGENCE_LOOKBACK || histogram.length != closes.length) {
            return null;
        }
        Divergence divergence = DivergenceDetector.findBullish(tail(closes), tail(histogram), 0.01, 0.0);
        if (divergence == null) {
            return null;
        }
        return signal(
                "Bullish MACD Divergence",
                SignalGroup.MOMENTUM,
                6,
                "Price lower low while the MACD histogram made a higher low",
                divergence.secondValue());
    }

    // ---- Price position and trend ----

    private TechnicalSignal checkYearRange(MarketData data) {
        if (data.size < YEAR_BARS) {
            return null;
        }
        double low = min(data.series.lows(), data.size - YEAR_BARS, data.size);
        double high = max(data.series.highs(), data.size - YEAR_BARS, data.size);
        double range = high - low;
        if (range <= 0) {
            return null;
        }
        double price = data.price;
        double aboveLowPct = (price - low) / low * 100;
        if (aboveLowPct <= 10) {
            return signal(
                    "Near 52-Week Low",
                    SignalGroup.PRICE_POSITION,
                    8,
                    String.format("%.1f%% above the 52-week low", aboveLowPct),
                    round2(aboveLowPct));
        }
        double position = (price - low) / range;
        if (position <= 0.25) {
            return signal(
                    "Lower 52-Week Range",
                    SignalGroup.PRICE_POSITION,
                    4,
                    "In the bottom quarter of the 52-week range",
                    round2(position * 100));
        }
        return null;
    }

    private TechnicalSignal checkAdx(MarketData data) {
        double[] adx = IndicatorCalculator.adx(data.series.barSeries(), 14);
        double value = adx[data.size - 1];
        if (!Double.isFinite(value)) {
            return null;
        }
        if (value > 30) {
            return signal("Strong Trend", SignalGroup.TREND, 5, "ADX above 30", round2(value));
        }
        if (value > 25) {
            return signal("Trending", SignalGroup.TREND, 3, "ADX above 25", round2(value));
        }
        if (value < 20) {
            return signal("Consolidating", SignalGroup.TREND, 2, "ADX below 20, range-bound", round2(value));
        }
        return null;
    }

    private TechnicalSignal checkBollinger(MarketData data) {
        if (data.size < 25) {
            return null;
        }
        BollingerBand band = IndicatorCalculator.bollinger(data.series.barSeries(), 20, 2.0);
        if (!(band.width() > 0)) {
            return null;
        }
        double percentB = band.percentB(data.price);
        if (percentB < 0.15) {
            return signal(
                    "Near Lower Bollinger", SignalGroup.PRICE_POSITION, 5, "Price at the lower band", round2(percentB));
        }
        if (percentB < 0.35) {
            return signal(
                    "Lower Bollinger Zone",
                    SignalGroup.PRICE_POSITION,
                    3,
                    "Price in the lower part of the bands",
                    round2(percentB));
        }
        return null;
    }

    // ---- Helpers ----

    private void add(List<TechnicalSignal> signals, String check, Supplier<TechnicalSignal> supplier) {
        addAll(signals, check, () -> {
            TechnicalSignal signal = supplier.get();
            return signal != null ? List.of(signal) : List.of();
        });
    }

    private void addAll(List<TechnicalSignal> signals, String check, Supplier<List<TechnicalSignal>> supplier) {
        try {
            signals.addAll(supplier.get());
        } catch (RuntimeException e) {
            log.warn("Signal check '{}' skipped: {}", check, e.getMessage());
        }
    }

    private static TechnicalSignal signal(
            String name, SignalGroup group, int points, String description, Double value) {
        return TechnicalSignal.builder()
                .name(name)
                .group(group)
                .points(points)
                .description(description)
                .value(value)
                .build();
    }

    private static double[] tail(double[] values) {
        return Arrays.copyOfRange(values, values.length - DIVERGENCE_LOOKBACK, values.length);
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    /**
     * Indicator arrays for one series, computed on first use.
     */
    private static final class MarketData {

        private final PriceSeries series;
        private final double[] closes;
        private final int size;
        private final double price;

        private double[] sma20;
        private double[] sma50;
        private double[] sma200;
        private double[] rsi;
        private MacdSeries macd;

        MarketData(PriceSeries series) {
            this.series = series;
            this.closes = series.closes();
            this.size = closes.length;
            this.price = series.lastClose();
        }

        double last(double[] values) {
            return values[size - 1];
        }

        double[] sma(int period) {
            return switch (period) {
                case 20 -> sma20();
                case 50 -> sma50();
                case 200 -> sma200();
                default -> IndicatorCalculator.sma(series.barSeries(), period);
            };
        }

        double[] sma20() {
            if (sma20 == null) {
                sma20 = IndicatorCalculator.sma(series.barSeries(), 20);
            }
            return sma20;
        }

        double[] sma50() {
            if (sma50 == null) {
                sma50 = IndicatorCalculator.sma(series.barSeries(), 50);
            }
            return sma50;
        }

        double[] sma200() {
            if (sma200 == null) {
                sma200 = IndicatorCalculator.sma(series.barSeries(), 200);
            }
            return sma200;
        }

        double[] rsi() {
            if (rsi == null) {
                rsi = IndicatorCalculator.rsi(series.barSeries(), RSI_PERIOD);
            }
            return rsi;
        }

        double lastRsi() {
            return last(rsi());
        }

        MacdSeries macd() {
            if (macd == null) {
                macd = IndicatorCalculator.macd(series.barSeries(), 12, 26, 9);
            }
            return macd;
        }
    }
}
