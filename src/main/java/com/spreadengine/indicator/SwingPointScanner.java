package com.spreadengine.indicator;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds local extrema in a numeric series.
 *
 * <p>A swing low at {@code i} is strictly lower than every value within {@code radius}
 * bars on either side; swing highs are the mirror image. Points closer than
 * {@code radius} to either end cannot qualify.
 */
public final class SwingPointScanner {

    public static final int DEFAULT_RADIUS = 2;
    public static final int DEFAULT_MIN_SEPARATION = 3;

    private SwingPointScanner() {}

    public static List<Integer> swingLows(double[] values, int radius) {
        return scan(values, radius, true);
    }

    public static List<Integer> swingHighs(double[] values, int radius) {
        return scan(values, radius, false);
    }

    /**
     * Pairs the earliest swing point with the latest one at least {@code minSeparation}
     * bars after it.
     *
     * @return the pair, or null when fewer than two sufficiently separated points exist
     */
    public static SwingPair pairAtLeastApart(List<Integer> points, int minSeparation) {
        if (points.size() < 2) {
            return null;
        }
        int first = points.get(0);
        Integer second = null;
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i) - first >= minSeparation) {
                second = points.get(i);
            }
        }
        return second != null ? new SwingPair(first, second) : null;
    }

    private static List<Integer> scan(double[] values, int radius, boolean lows) {
        List<Integer> points = new ArrayList<>();
        for (int i = radius; i < values.length - radius; i++) {
            boolean extreme = true;
            for (int j = i - radius; j <= i + radius && extreme; j++) {
                if (j == i) {
                    continue;
                }
                extreme = lows ? values[i] < values[j] : values[i] > values[j];
            }
            if (extreme) {
                points.add(i);
            }
        }
        return points;
    }

    public record SwingPair(int first, int second) {}
}
