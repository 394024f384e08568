package com.spreadengine.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.indicator.IndicatorCalculator;
import com.spreadengine.indicator.PriceSeries;
import com.spreadengine.unit.PriceBarFixtures;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ta4j.core.BarSeries;

class PriceSeriesTest {

    @Test
    @DisplayName("exposes closes and the last close")
    void exposesCloses() {
        PriceSeries series = PriceSeries.of(PriceBarFixtures.fromCloses(10, 11, 12));

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.closes()).containsExactly(10, 11, 12);
        assertThat(series.lastClose()).isEqualTo(12);
    }

    @Test
    @DisplayName("returned arrays are copies")
    void arraysAreCopies() {
        PriceSeries series = PriceSeries.of(PriceBarFixtures.fromCloses(10, 11, 12));

        series.closes()[2] = 99;

        assertThat(series.lastClose()).isEqualTo(12);
    }

    @Test
    @DisplayName("bars without dates or with repeated dates still get increasing end times")
    void endTimesStrictlyIncrease() {
        LocalDate day = LocalDate.of(2024, 5, 1);
        List<PriceBar> bars = List.of(
                new PriceBar(null, 10, 11, 9, 10, 100),
                new PriceBar(null, 10, 11, 9, 10.5, 100),
                new PriceBar(day, 10, 11, 9, 11, 100),
                new PriceBar(day, 10, 11, 9, 11.5, 100));

        BarSeries barSeries = PriceSeries.of("TEST", bars).barSeries();

        assertThat(barSeries.getBarCount()).isEqualTo(4);
        for (int i = 1; i < barSeries.getBarCount(); i++) {
            assertThat(barSeries.getBar(i).getEndTime()).isAfter(barSeries.getBar(i - 1).getEndTime());
        }
    }

    @Test
    @DisplayName("SMA over a flat series equals the price")
    void smaOfFlatSeries() {
        PriceSeries series = PriceSeries.of(PriceBarFixtures.flat(60, 42));

        double[] sma = IndicatorCalculator.sma(series.barSeries(), 50);

        assertThat(sma[59]).isCloseTo(42, within(1e-9));
    }

    @Test
    @DisplayName("average, min and max work on half-open ranges")
    void rangeHelpers() {
        double[] values = {1, 2, 3, 4, 5};

        assertThat(IndicatorCalculator.average(values, 1, 4)).isEqualTo(3);
        assertThat(IndicatorCalculator.min(values, 2, 5)).isEqualTo(3);
        assertThat(IndicatorCalculator.max(values, 0, 2)).isEqualTo(2);
        assertThat(IndicatorCalculator.average(values, 3, 3)).isNaN();
    }
}
