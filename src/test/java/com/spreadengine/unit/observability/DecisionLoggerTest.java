package com.spreadengine.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.spreadengine.domain.enums.ConfidenceLevel;
import com.spreadengine.domain.enums.EntryAction;
import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.PositionSize;
import com.spreadengine.domain.enums.StrategyType;
import com.spreadengine.domain.model.ConfidenceScore;
import com.spreadengine.domain.model.EntryDecision;
import com.spreadengine.domain.model.PositionSizing;
import com.spreadengine.domain.model.SpreadQualityScore;
import com.spreadengine.domain.enums.SpreadRating;
import com.spreadengine.observability.DecisionLogger;
import com.spreadengine.observability.DecisionRecord;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DecisionLoggerTest {

    private DecisionLogger decisionLogger;

    @BeforeEach
    void setUp() {
        decisionLogger = new DecisionLogger();
    }

    private static EntryDecision decision(String ticker) {
        return EntryDecision.builder()
                .ticker(ticker)
                .strategyType(StrategyType.CREDIT_SPREAD)
                .action(EntryAction.ENTER_NOW)
                .confidence(ConfidenceScore.builder()
                        .total(87)
                        .level(ConfidenceLevel.VERY_HIGH)
                        .breakdown(Map.of())
                        .build())
                .positionSizing(PositionSizing.builder()
                        .size(PositionSize.FULL)
                        .percentage(100)
                        .maxContracts(5)
                        .maxRiskDollars(new BigDecimal("2000.00"))
                        .reasoning(List.of())
                        .build())
                .regime(MarketRegime.BULL)
                .reasoning(List.of("Entry conditions met"))
                .warnings(List.of("Earnings in 5 days: gap risk through the report"))
                .build();
    }

    @Nested
    @DisplayName("Log")
    class Log {

        @Test
        @DisplayName("summarizes the decision")
        void summarizes() {
            DecisionRecord decisionRecord = decisionLogger.log(decision("AAPL"));

            assertThat(decisionRecord.getTicker()).isEqualTo("AAPL");
            assertThat(decisionRecord.getAction()).isEqualTo(EntryAction.ENTER_NOW);
            assertThat(decisionRecord.getConfidenceLevel()).isEqualTo(ConfidenceLevel.VERY_HIGH);
            assertThat(decisionRecord.getConfidenceTotal()).isEqualTo(87);
            assertThat(decisionRecord.getPositionSize()).isEqualTo(PositionSize.FULL);
            assertThat(decisionRecord.getMaxContracts()).isEqualTo(5);
            assertThat(decisionRecord.getSpreadScore()).isNull();
            assertThat(decisionRecord.getWarnings()).hasSize(1);
            assertThat(decisionRecord.getTimestamp()).isNotNull();
        }

        @Test
        @DisplayName("carries the spread score when a spread was recommended")
        void spreadScore() {
            EntryDecision base = decision("AAPL");
            EntryDecision withSpread = EntryDecision.builder()
                    .ticker(base.getTicker())
                    .strategyType(base.getStrategyType())
                    .action(base.getAction())
                    .confidence(base.getConfidence())
                    .positionSizing(base.getPositionSizing())
                    .spreadScore(SpreadQualityScore.builder()
                            .total(95)
                            .rating(SpreadRating.EXCELLENT)
                            .breakdown(Map.of())
                            .build())
                    .reasoning(base.getReasoning())
                    .warnings(base.getWarnings())
                    .build();

            assertThat(decisionLogger.log(withSpread).getSpreadScore()).isEqualTo(95);
        }
    }

    @Nested
    @DisplayName("Recent decisions")
    class Recent {

        @Test
        @DisplayName("newest first, limited")
        void newestFirst() {
            decisionLogger.log(decision("AAPL"));
            decisionLogger.log(decision("MSFT"));
            decisionLogger.log(decision("NVDA"));

            assertThat(decisionLogger.getRecentDecisions(2))
                    .extracting(DecisionRecord::getTicker)
                    .containsExactly("NVDA", "MSFT");
        }

        @Test
        @DisplayName("non-positive limit returns nothing")
        void zeroLimit() {
            decisionLogger.log(decision("AAPL"));

            assertThat(decisionLogger.getRecentDecisions(0)).isEmpty();
            assertThat(decisionLogger.getRecentDecisions(-3)).isEmpty();
        }

        @Test
        @DisplayName("evicts the oldest beyond 500 entries")
        void evictsOldest() {
            for (int i = 0; i < 505; i++) {
                decisionLogger.log(decision("T" + i));
            }

            assertThat(decisionLogger.getBufferSize()).isEqualTo(500);
            List<DecisionRecord> all = decisionLogger.getRecentDecisions(1000);
            assertThat(all).hasSize(500);
            assertThat(all.get(0).getTicker()).isEqualTo("T504");
            assertThat(all.get(499).getTicker()).isEqualTo("T5");
        }
    }
}
