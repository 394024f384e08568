package com.spreadengine.indicator;

import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.indicators.volume.OnBalanceVolumeIndicator;
import org.ta4j.core.num.Num;

/**
 * Evaluates ta4j indicators over a whole {@link BarSeries} into primitive arrays aligned
 * with the bar index.
 *
 * <p>ta4j returns a value for every index, including the warm-up region before an
 * indicator has a full window. Callers only read indexes past the warm-up.
 */
public final class IndicatorCalculator {

    private IndicatorCalculator() {}

    public static double[] sma(BarSeries series, int period) {
        return values(new SMAIndicator(new ClosePriceIndicator(series), period), series.getBarCount());
    }

    public static double[] rsi(BarSeries series, int period) {
        return values(new RSIIndicator(new ClosePriceIndicator(series), period), series.getBarCount());
    }

    public static MacdSeries macd(BarSeries series, int shortPeriod, int longPeriod, int signalPeriod) {
        MACDIndicator macd = new MACDIndicator(new ClosePriceIndicator(series), shortPeriod, longPeriod);
        EMAIndicator signal = new EMAIndicator(macd, signalPeriod);

        int count = series.getBarCount();
        double[] macdValues = values(macd, count);
        double[] signalValues = values(signal, count);
        double[] histogram = new double[count];
        for (int i = 0; i < count; i++) {
            histogram[i] = macdValues[i] - signalValues[i];
        }
        return new MacdSeries(macdValues, signalValues, histogram);
    }

    public static double[] adx(BarSeries series, int period) {
        return values(new ADXIndicator(series, period), series.getBarCount());
    }

    /**
     * Bollinger bands at the last bar.
     */
    public static BollingerBand bollinger(BarSeries series, int period, double multiplier) {
        ClosePriceIndicator closePrice = new ClosePriceIndicator(series);
        SMAIndicator sma = new SMAIndicator(closePrice, period);
        StandardDeviationIndicator stdDev = new StandardDeviationIndicator(closePrice, period);
        Num k = series.numOf(multiplier);

        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(sma);
        BollingerBandsUpperIndicator upper = new BollingerBandsUpperIndicator(middle, stdDev, k);
        BollingerBandsLowerIndicator lower = new BollingerBandsLowerIndicator(middle, stdDev, k);

        int last = series.getEndIndex();
        return new BollingerBand(
                upper.getValue(last).doubleValue(),
                middle.getValue(last).doubleValue(),
                lower.getValue(last).doubleValue());
    }

    public static double[] onBalanceVolume(BarSeries series) {
        return values(new OnBalanceVolumeIndicator(series), series.getBarCount());
    }

    /**
     * Mean of {@code values[from..to)}; NaN for an empty range.
     */
    public static double average(double[] values, int from, int to) {
        if (to <= from) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double min(double[] values, int from, int to) {
        double min = Double.POSITIVE_INFINITY;
        for (int i = from; i < to; i++) {
            min = Math.min(min, values[i]);
        }
        return min;
    }

    public static double max(double[] values, int from, int to) {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            max = Math.max(max, values[i]);
        }
        return max;
    }

    private static double[] values(Indicator<Num> indicator, int count) {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = indicator.getValue(i).doubleValue();
        }
        return out;
    }

    /** MACD line, its signal line and the histogram between them, index-aligned with the series. */
    public record MacdSeries(double[] macd, double[] signal, double[] histogram) {}

    public record BollingerBand(double upper, double middle, double lower) {

        public double width() {
            return upper - lower;
        }

        /**
         * Position of {@code price} within the bands: 0 at the lower band, 1 at the upper.
         */
        public double percentB(double price) {
            return (price - lower) / width();
        }
    }
}
