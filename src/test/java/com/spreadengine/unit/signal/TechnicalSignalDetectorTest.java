package com.spreadengine.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;

import com.spreadengine.domain.enums.SignalCategory;
import com.spreadengine.domain.enums.SignalGroup;
import com.spreadengine.domain.model.TechnicalAnalysis;
import com.spreadengine.domain.model.TechnicalSignal;
import com.spreadengine.signal.SignalGroupCaps;
import com.spreadengine.signal.SignalProperties;
import com.spreadengine.signal.SupportResistanceDetector;
import com.spreadengine.signal.TechnicalSignalDetector;
import com.spreadengine.unit.PriceBarFixtures;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TechnicalSignalDetectorTest {

    /** Two swing lows at bars 5 and 14; the second is 2% lower. */
    private static final double[] DIVERGENT_CLOSES = {
        110, 108, 106, 104, 102, 100, 102, 104, 106, 108, 107, 105, 103, 101, 98, 100, 102, 104, 106, 108
    };

    private SignalProperties signalProperties;
    private TechnicalSignalDetector detector;

    @BeforeEach
    void setUp() {
        signalProperties = new SignalProperties();
        detector = new TechnicalSignalDetector(new SupportResistanceDetector(), signalProperties);
    }

    @Nested
    @DisplayName("Full detection")
    class Detect {

        @Test
        @DisplayName("fewer than 20 bars yields an empty analysis")
        void shortSeriesIsEmpty() {
            TechnicalAnalysis analysis = detector.detect(PriceBarFixtures.linear(19, 100, 0.5));

            assertThat(analysis.getScore()).isZero();
            assertThat(analysis.getSignals()).isEmpty();
        }

        @Test
        @DisplayName("null input yields an empty analysis")
        void nullIsEmpty() {
            assertThat(detector.detect(null)).isEqualTo(TechnicalAnalysis.empty());
        }

        @Test
        @DisplayName("sub-signals needing long history are absent on a short series")
        void longHistorySignalsAbsent() {
            TechnicalAnalysis analysis = detector.detect(PriceBarFixtures.linear(30, 100, 0.3));

            assertThat(analysis.getSignals())
                    .extracting(TechnicalSignal::getName)
                    .doesNotContain(
                            "Above MA200",
                            "Near MA200 Reclaim",
                            "Golden Cross",
                            "Golden Cross Active",
                            "Pullback to MA50",
                            "Near 52-Week Low",
                            "Lower 52-Week Range",
                            "Bullish MACD Divergence");
        }

        @Test
        @DisplayName("a long uptrend reports MA200 signals")
        void longUptrend() {
            TechnicalAnalysis analysis = detector.detect(PriceBarFixtures.linear(260, 50, 0.2));

            assertThat(analysis.getSignals())
                    .extracting(TechnicalSignal::getName)
                    .contains("Above MA200", "Golden Cross Active", "Strong MA Position");
            assertThat(analysis.getSignals()).allMatch(s -> s.getCategory() == SignalCategory.TECHNICAL);
        }

        @Test
        @DisplayName("score is the group-capped total limited by the ceiling")
        void scoreIsCappedTotal() {
            TechnicalAnalysis analysis = detector.detect(PriceBarFixtures.linear(260, 50, 0.2));

            int expected = Math.min(SignalGroupCaps.defaults().cappedTotal(analysis.getSignals()), 50);
            assertThat(analysis.getScore()).isEqualTo(expected);
            assertThat(analysis.getScore()).isBetween(0, 50);
        }

        @Test
        @DisplayName("a lower configured ceiling bounds the score")
        void configuredCeiling() {
            signalProperties.setScoreCeiling(5);
            TechnicalSignalDetector capped = new TechnicalSignalDetector(new SupportResistanceDetector(), signalProperties);

            assertThat(capped.detect(PriceBarFixtures.linear(260, 50, 0.2)).getScore()).isLessThanOrEqualTo(5);
        }

        @Test
        @DisplayName("price within 3% above a detected support fires Near Support")
        void nearSupport() {
            TechnicalAnalysis analysis = detector.detect(PriceBarFixtures.sawtooth(41));

            assertThat(analysis.getSignals())
                    .filteredOn(s -> s.getName().equals("Near Support"))
                    .singleElement()
                    .satisfies(s -> {
                        assertThat(s.getGroup()).isEqualTo(SignalGroup.PRICE_POSITION);
                        assertThat(s.getValue()).isEqualTo(100.0);
                    });
        }

        @Test
        @DisplayName("price further than 3% from support does not fire Near Support")
        void farFromSupport() {
            TechnicalAnalysis analysis = detector.detect(PriceBarFixtures.sawtooth(40));

            assertThat(analysis.getSignals()).extracting(TechnicalSignal::getName).doesNotContain("Near Support");
        }

        @Test
        @DisplayName("each signal name appears at most once")
        void namesAreUnique() {
            TechnicalAnalysis analysis = detector.detect(PriceBarFixtures.linear(260, 50, 0.2));

            assertThat(analysis.getSignals()).extracting(TechnicalSignal::getName).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("RSI zone")
    class RsiZone {

        @Test
        @DisplayName("35 to 50 is the entry zone")
        void entryZone() {
            assertThat(detector.checkRsiZone(35).getName()).isEqualTo("RSI Entry Zone");
            assertThat(detector.checkRsiZone(42).getPoints()).isEqualTo(10);
            assertThat(detector.checkRsiZone(50).getName()).isEqualTo("RSI Entry Zone");
        }

        @Test
        @DisplayName("lower readings score less")
        void lowerZones() {
            assertThat(detector.checkRsiZone(30).getName()).isEqualTo("RSI Approaching Oversold");
            assertThat(detector.checkRsiZone(32).getPoints()).isEqualTo(7);
            assertThat(detector.checkRsiZone(25).getName()).isEqualTo("RSI Oversold");
            assertThat(detector.checkRsiZone(25).getPoints()).isEqualTo(5);
        }

        @Test
        @DisplayName("higher readings score less and 70+ scores nothing")
        void upperZones() {
            assertThat(detector.checkRsiZone(53).getPoints()).isEqualTo(4);
            assertThat(detector.checkRsiZone(60).getPoints()).isEqualTo(1);
            assertThat(detector.checkRsiZone(70)).isNull();
            assertThat(detector.checkRsiZone(Double.NaN)).isNull();
        }

        @Test
        @DisplayName("RSI signals belong to the momentum group")
        void momentumGroup() {
            assertThat(detector.checkRsiZone(42).getGroup()).isEqualTo(SignalGroup.MOMENTUM);
            assertThat(detector.checkRsiZone(42).getValue()).isEqualTo(42.0);
        }
    }

    @Nested
    @DisplayName("Divergence")
    class DivergenceChecks {

        @Test
        @DisplayName("lower price low with a higher RSI low is bullish divergence")
        void rsiDivergence() {
            double[] rsi = constant(50);
            rsi[5] = 30;
            rsi[14] = 35;

            TechnicalSignal signal = detector.checkRsiDivergence(DIVERGENT_CLOSES, rsi);

            assertThat(signal).isNotNull();
            assertThat(signal.getName()).isEqualTo("Bullish RSI Divergence");
            assertThat(signal.getPoints()).isEqualTo(8);
        }

        @Test
        @DisplayName("RSI rising by three points or less is not divergence")
        void rsiRiseTooSmall() {
            double[] rsi = constant(50);
            rsi[5] = 30;
            rsi[14] = 33;

            assertThat(detector.checkRsiDivergence(DIVERGENT_CLOSES, rsi)).isNull();
        }

        @Test
        @DisplayName("RSI making a lower low is not divergence")
        void rsiConfirmsLow() {
            double[] rsi = constant(50);
            rsi[5] = 30;
            rsi[14] = 28;

            assertThat(detector.checkRsiDivergence(DIVERGENT_CLOSES, rsi)).isNull();
        }

        @Test
        @DisplayName("MACD histogram higher low at the price lows is divergence")
        void macdDivergence() {
            double[] histogram = constant(0);
            histogram[5] = -1.0;
            histogram[14] = -0.5;

            TechnicalSignal signal = detector.checkMacdDivergence(DIVERGENT_CLOSES, histogram);

            assertThat(signal).isNotNull();
            assertThat(signal.getName()).isEqualTo("Bullish MACD Divergence");
            assertThat(signal.getPoints()).isEqualTo(6);
        }

        @Test
        @DisplayName("too little data or misaligned arrays produce no signal")
        void insufficientData() {
            assertThat(detector.checkRsiDivergence(new double[10], new double[10])).isNull();
            assertThat(detector.checkMacdDivergence(DIVERGENT_CLOSES, new double[19])).isNull();
        }
    }

    @Nested
    @DisplayName("MA200 reclaim")
    class Ma200Reclaim {

        @Test
        @DisplayName("slightly below MA200 with two recovery signs scores 5")
        void twoRecoverySigns() {
            double[] closes = reclaimSeries();

            TechnicalSignal signal = detector.checkNearMa200Reclaim(closes[closes.length - 1], closes);

            assertThat(signal).isNotNull();
            assertThat(signal.getName()).isEqualTo("Near MA200 Reclaim");
            assertThat(signal.getGroup()).isEqualTo(SignalGroup.RECOVERY);
            assertThat(signal.getPoints()).isEqualTo(5);
        }

        @Test
        @DisplayName("price above MA200 is not a reclaim")
        void aboveMa200() {
            double[] closes = reclaimSeries();

            assertThat(detector.checkNearMa200Reclaim(105, closes)).isNull();
        }

        @Test
        @DisplayName("needs 200 closes")
        void needsFullHistory() {
            assertThat(detector.checkNearMa200Reclaim(99, Arrays.copyOf(reclaimSeries(), 199))).isNull();
        }

        /** 150 closes at 102 followed by 50 rising from 90 to 98.82. */
        private double[] reclaimSeries() {
            double[] closes = new double[200];
            for (int i = 0; i < 150; i++) {
                closes[i] = 102;
            }
            for (int i = 0; i < 50; i++) {
                closes[150 + i] = 90 + i * 0.18;
            }
            return closes;
        }
    }

    private static double[] constant(double value) {
        double[] values = new double[DIVERGENT_CLOSES.length];
        Arrays.fill(values, value);
        return values;
    }
}
