package com.spreadengine.signal;

import com.spreadengine.domain.model.Divergence;
import com.spreadengine.indicator.SwingPointScanner;
import com.spreadengine.indicator.SwingPointScanner.SwingPair;
import java.util.List;

/**
 * Detects bullish divergence between price and an oscillator sampled at the same bars.
 *
 * <p>Swing lows are taken from price. The oscillator is read at those two bars: price must
 * make a lower low by at least {@code minPriceDrop} (fraction) while the oscillator rises by
 * more than {@code minOscillatorRise}.
 */
public final class DivergenceDetector {

    private DivergenceDetector() {}

    /**
     * @return the divergence, or null when the arrays differ in length, no separated swing
     *     lows exist, or the lows do not diverge
     */
    public static Divergence findBullish(
            double[] prices, double[] oscillator, double minPriceDrop, double minOscillatorRise) {
        if (prices.length != oscillator.length) {
            return null;
        }
        List<Integer> lows = SwingPointScanner.swingLows(prices, SwingPointScanner.DEFAULT_RADIUS);
        SwingPair pair = SwingPointScanner.pairAtLeastApart(lows, SwingPointScanner.DEFAULT_MIN_SEPARATION);
        if (pair == null) {
            return null;
        }

        double price1 = prices[pair.first()];
        double price2 = prices[pair.second()];
        double value1 = oscillator[pair.first()];
        double value2 = oscillator[pair.second()];
        if (!Double.isFinite(value1) || !Double.isFinite(value2)) {
            return null;
        }

        boolean lowerLow = price2 < price1 * (1 - minPriceDrop);
        boolean higherOscillator = value2 > value1 + minOscillatorRise;
        if (lowerLow && higherOscillator) {
            return new Divergence(pair.first(), pair.second(), price1, price2, value1, value2);
        }
        return null;
    }
}
