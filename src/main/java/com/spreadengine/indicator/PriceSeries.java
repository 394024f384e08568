package com.spreadengine.indicator;

import com.spreadengine.domain.model.PriceBar;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.num.DoubleNum;

/**
 * Read-only view of a daily bar list as primitive arrays plus a ta4j {@link BarSeries}.
 *
 * <p>Bars are expected oldest first. ta4j requires strictly increasing end times, so bars
 * without a date, or with a date not after the previous bar, are placed one day after
 * their predecessor. Instances are built per evaluation and never shared between threads.
 */
public final class PriceSeries {

    private static final LocalDate SYNTHETIC_START = LocalDate.of(2000, 1, 3);

    private final double[] closes;
    private final double[] highs;
    private final double[] lows;
    private final double[] volumes;
    private final BarSeries barSeries;

    private PriceSeries(String name, List<PriceBar> bars) {
        int size = bars.size();
        this.closes = new double[size];
        this.highs = new double[size];
        this.lows = new double[size];
        this.volumes = new double[size];
        this.barSeries = new BaseBarSeriesBuilder()
                .withName(name)
                .withNumTypeOf(DoubleNum.class)
                .build();

        ZonedDateTime previousEnd = null;
        for (int i = 0; i < size; i++) {
            PriceBar bar = bars.get(i);
            closes[i] = bar.close();
            highs[i] = bar.high();
            lows[i] = bar.low();
            volumes[i] = bar.volume();

            ZonedDateTime endTime = endTimeOf(bar, i, previousEnd);
            barSeries.addBar(endTime, bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
            previousEnd = endTime;
        }
    }

    public static PriceSeries of(List<PriceBar> bars) {
        return new PriceSeries("series", bars);
    }

    public static PriceSeries of(String name, List<PriceBar> bars) {
        return new PriceSeries(name != null ? name : "series", bars);
    }

    public int size() {
        return closes.length;
    }

    public double lastClose() {
        return closes[closes.length - 1];
    }

    public double[] closes() {
        return closes.clone();
    }

    public double[] highs() {
        return highs.clone();
    }

    public double[] lows() {
        return lows.clone();
    }

    public double[] volumes() {
        return volumes.clone();
    }

    public BarSeries barSeries() {
        return barSeries;
    }

    private static ZonedDateTime endTimeOf(PriceBar bar, int index, ZonedDateTime previousEnd) {
        LocalDate date = bar.date() != null ? bar.date() : SYNTHETIC_START.plusDays(index);
        ZonedDateTime endTime = date.atTime(21, 0).atZone(ZoneOffset.UTC);
        if (previousEnd != null && !endTime.isAfter(previousEnd)) {
            endTime = previousEnd.plusDays(1);
        }
        return endTime;
    }
}
