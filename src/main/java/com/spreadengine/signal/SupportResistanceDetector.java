package com.spreadengine.signal;

import com.spreadengine.domain.enums.LevelType;
import com.spreadengine.domain.model.NearestSupport;
import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.domain.model.SupportResistanceLevel;
import com.spreadengine.indicator.SwingPointScanner;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives support and resistance levels from swing points.
 *
 * <p>Swing lows of bar lows become support candidates and swing highs of bar highs become
 * resistance candidates. Candidates within {@code tolerance} (fraction) of a level's running
 * average are merged into it; a level's strength is the number of merged touches. Only the
 * most recent {@value #LOOKBACK_BARS} bars are scanned.
 */
@Component
public class SupportResistanceDetector {

    public static final double DEFAULT_TOLERANCE = 0.02;
    public static final int DEFAULT_MIN_TOUCHES = 2;
    public static final double NEAR_SUPPORT_THRESHOLD = 0.03;

    static final int MIN_BARS = 10;
    static final int LOOKBACK_BARS = 120;

    public List<SupportResistanceLevel> detect(List<PriceBar> bars) {
        return detect(bars, DEFAULT_TOLERANCE, DEFAULT_MIN_TOUCHES);
    }

    /**
     * @return levels sorted by price ascending; empty for fewer than {@value #MIN_BARS} bars
     */
    public List<SupportResistanceLevel> detect(List<PriceBar> bars, double tolerance, int minTouches) {
        if (bars == null || bars.size() < MIN_BARS) {
            return List.of();
        }
        List<PriceBar> window = bars.subList(Math.max(0, bars.size() - LOOKBACK_BARS), bars.size());
        double[] lows = window.stream().mapToDouble(PriceBar::low).toArray();
        double[] highs = window.stream().mapToDouble(PriceBar::high).toArray();

        List<SupportResistanceLevel> levels = new ArrayList<>();
        levels.addAll(group(
                pricesAt(lows, SwingPointScanner.swingLows(lows, SwingPointScanner.DEFAULT_RADIUS)),
                LevelType.SUPPORT,
                tolerance,
                minTouches));
        levels.addAll(group(
                pricesAt(highs, SwingPointScanner.swingHighs(highs, SwingPointScanner.DEFAULT_RADIUS)),
                LevelType.RESISTANCE,
                tolerance,
                minTouches));
        levels.sort(Comparator.comparingDouble(SupportResistanceLevel::price));
        return levels;
    }

    /**
     * Highest support level strictly below {@code currentPrice}.
     *
     * @return the level and its fractional distance, or null when no support lies below
     */
    public NearestSupport findNearestSupport(double currentPrice, List<PriceBar> bars) {
        return detect(bars).stream()
                .filter(level -> level.type() == LevelType.SUPPORT && level.price() < currentPrice)
                .max(Comparator.comparingDouble(SupportResistanceLevel::price))
                .map(level -> new NearestSupport(level.price(), (currentPrice - level.price()) / currentPrice))
                .orElse(null);
    }

    public boolean isNearSupport(double currentPrice, List<PriceBar> bars, double threshold) {
        return isNearSupport(findNearestSupport(currentPrice, bars), threshold);
    }

    /**
     * @param nearest result of {@link #findNearestSupport}, may be null
     */
    public static boolean isNearSupport(NearestSupport nearest, double threshold) {
        return nearest != null && nearest.distance() <= threshold;
    }

    private static List<Double> pricesAt(double[] values, List<Integer> indexes) {
        return indexes.stream().map(i -> values[i]).toList();
    }

    private static List<SupportResistanceLevel> group(
            List<Double> prices, LevelType type, double tolerance, int minTouches) {
        List<Double> sorted = prices.stream().sorted().toList();
        List<SupportResistanceLevel> levels = new ArrayList<>();

        double sum = 0;
        int count = 0;
        for (double price : sorted) {
            if (count > 0) {
                double average = sum / count;
                if (Math.abs(price - average) / average > tolerance) {
                    addIfStrong(levels, sum / count, type, count, minTouches);
                    sum = 0;
                    count = 0;
                }
            }
            sum += price;
            count++;
        }
        if (count > 0) {
            addIfStrong(levels, sum / count, type, count, minTouches);
        }
        return levels;
    }

    private static void addIfStrong(
            List<SupportResistanceLevel> levels, double price, LevelType type, int touches, int minTouches) {
        if (touches >= minTouches) {
            levels.add(new SupportResistanceLevel(price, type, touches));
        }
    }
}
