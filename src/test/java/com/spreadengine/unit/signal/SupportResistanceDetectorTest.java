package com.spreadengine.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.spreadengine.domain.enums.LevelType;
import com.spreadengine.domain.model.NearestSupport;
import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.domain.model.SupportResistanceLevel;
import com.spreadengine.signal.SupportResistanceDetector;
import com.spreadengine.unit.PriceBarFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SupportResistanceDetectorTest {

    private final SupportResistanceDetector detector = new SupportResistanceDetector();

    @Nested
    @DisplayName("Level detection")
    class Detection {

        @Test
        @DisplayName("finds support from swing lows and resistance from swing highs")
        void detectsBothSides() {
            List<SupportResistanceLevel> levels = detector.detect(PriceBarFixtures.sawtooth(40));

            assertThat(levels).containsExactly(
                    new SupportResistanceLevel(100, LevelType.SUPPORT, 4),
                    new SupportResistanceLevel(118, LevelType.RESISTANCE, 5));
        }

        @Test
        @DisplayName("nearby lows within the tolerance merge into one averaged level")
        void groupsWithinTolerance() {
            List<PriceBar> bars = new ArrayList<>(PriceBarFixtures.sawtooth(40));
            setLow(bars, 8, 101);
            setLow(bars, 16, 99.5);
            setLow(bars, 24, 100.5);

            SupportResistanceLevel support = detector.detect(bars).stream()
                    .filter(level -> level.type() == LevelType.SUPPORT)
                    .findFirst()
                    .orElseThrow();

            assertThat(support.strength()).isEqualTo(4);
            assertThat(support.price()).isCloseTo(100.25, within(1e-9));
        }

        @Test
        @DisplayName("levels with fewer touches than required are dropped")
        void minTouchesFilters() {
            List<SupportResistanceLevel> levels = detector.detect(PriceBarFixtures.sawtooth(40), 0.02, 5);

            assertThat(levels).extracting(SupportResistanceLevel::type).containsExactly(LevelType.RESISTANCE);
        }

        @Test
        @DisplayName("short series yield no levels")
        void shortSeriesIsEmpty() {
            assertThat(detector.detect(PriceBarFixtures.sawtooth(9))).isEmpty();
            assertThat(detector.detect(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Nearest support")
    class Nearest {

        @Test
        @DisplayName("returns the highest support below price with its fractional distance")
        void findsNearestBelow() {
            NearestSupport nearest = detector.findNearestSupport(103, PriceBarFixtures.sawtooth(40));

            assertThat(nearest).isNotNull();
            assertThat(nearest.level()).isEqualTo(100);
            assertThat(nearest.distance()).isCloseTo(3.0 / 103, within(1e-9));
        }

        @Test
        @DisplayName("returns null when price is below every support")
        void noneBelow() {
            assertThat(detector.findNearestSupport(95, PriceBarFixtures.sawtooth(40))).isNull();
        }

        @Test
        @DisplayName("near-support check honours the threshold")
        void nearSupportThreshold() {
            List<PriceBar> bars = PriceBarFixtures.sawtooth(40);

            assertThat(detector.isNearSupport(103, bars, 0.03)).isTrue();
            assertThat(detector.isNearSupport(110, bars, 0.03)).isFalse();
        }

        @Test
        @DisplayName("near-support check on a found level treats no support as not near")
        void nearSupportFromResult() {
            assertThat(SupportResistanceDetector.isNearSupport(new NearestSupport(100, 0.02), 0.03)).isTrue();
            assertThat(SupportResistanceDetector.isNearSupport(new NearestSupport(100, 0.05), 0.03)).isFalse();
            assertThat(SupportResistanceDetector.isNearSupport(null, 0.03)).isFalse();
        }
    }

    private static void setLow(List<PriceBar> bars, int index, double low) {
        PriceBar bar = bars.get(index);
        bars.set(index, new PriceBar(bar.date(), bar.open(), bar.high(), low, bar.close(), bar.volume()));
    }
}
