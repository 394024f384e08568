package com.spreadengine.unit.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spreadengine.domain.enums.SpreadRating;
import com.spreadengine.domain.enums.StrategyType;
import com.spreadengine.domain.model.SpreadCandidate;
import com.spreadengine.domain.model.SpreadQualityScore;
import com.spreadengine.scoring.SpreadQualityScorer;
import com.spreadengine.scoring.SpreadScoringProfile;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SpreadQualityScorerTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 3, 3);
    private static final SpreadScoringProfile CREDIT = SpreadScoringProfile.creditSpread();
    private static final SpreadScoringProfile DEBIT = SpreadScoringProfile.debitSpread();

    private final SpreadQualityScorer scorer = new SpreadQualityScorer();

    private static SpreadCandidate.SpreadCandidateBuilder creditSpread() {
        return SpreadCandidate.builder()
                .shortStrike(92.0)
                .longStrike(87.0)
                .netCredit(1.65)
                .shortDelta(-0.27)
                .ivRank(40.0)
                .expiration(AS_OF.plusDays(30));
    }

    private static SpreadCandidate.SpreadCandidateBuilder debitSpread() {
        return SpreadCandidate.builder()
                .longStrike(90.0)
                .shortStrike(95.0)
                .netDebit(3.5)
                .longDelta(0.80)
                .shortDelta(0.55)
                .ivRank(25.0)
                .expiration(AS_OF.plusDays(30));
    }

    @Nested
    @DisplayName("Credit spreads")
    class Credit {

        @Test
        @DisplayName("well-placed put spread scores excellent")
        void excellentSpread() {
            SpreadQualityScore score = scorer.score(creditSpread().build(), 97.0, null, 100, AS_OF, CREDIT);

            assertThat(score.getTotal()).isEqualTo(95);
            assertThat(score.getRating()).isEqualTo(SpreadRating.EXCELLENT);
            assertThat(score.getBreakdown())
                    .containsEntry("creditRatio", 20)
                    .containsEntry("distanceOtm", 20)
                    .containsEntry("ivRank", 10)
                    .containsEntry("supportBuffer", 15)
                    .containsEntry("daysToExpiration", 10)
                    .containsEntry("delta", 10)
                    .containsEntry("earningsRisk", 10);
        }

        @Test
        @DisplayName("support below the short strike and missing support score low")
        void supportPlacement() {
            assertThat(scorer.score(creditSpread().build(), 90.0, null, 100, AS_OF, CREDIT).getBreakdown())
                    .containsEntry("supportBuffer", 2);
            assertThat(scorer.score(creditSpread().build(), null, null, 100, AS_OF, CREDIT).getBreakdown())
                    .containsEntry("supportBuffer", 0);
        }

        @Test
        @DisplayName("earnings points depend on where the report falls relative to expiration")
        void earningsTiming() {
            SpreadCandidate spread = creditSpread().build();

            assertThat(earnings(spread, 40)).isEqualTo(10);
            assertThat(earnings(spread, 35)).isEqualTo(7);
            assertThat(earnings(spread, 27)).isEqualTo(3);
            assertThat(earnings(spread, 10)).isZero();
            assertThat(earnings(spread, -3)).isEqualTo(10);
        }

        @Test
        @DisplayName("days to expiration count from the as-of date")
        void daysFromAsOfDate() {
            SpreadCandidate spread = creditSpread().build();

            SpreadQualityScore later = scorer.score(spread, 97.0, null, 100, AS_OF.plusDays(20), CREDIT);

            assertThat(later.getBreakdown()).containsEntry("daysToExpiration", 2);
        }

        private int earnings(SpreadCandidate spread, int daysToEarnings) {
            return scorer.score(spread, 97.0, daysToEarnings, 100, AS_OF, CREDIT)
                    .getBreakdown()
                    .get("earningsRisk");
        }
    }

    @Nested
    @DisplayName("Debit spreads")
    class Debit {

        @Test
        @DisplayName("deep ITM spread is measured against breakeven")
        void scoresAgainstBreakeven() {
            SpreadQualityScore score = scorer.score(debitSpread().build(), 96.0, null, 100, AS_OF, DEBIT);

            assertThat(score.getBreakdown())
                    .containsEntry("debitRatio", 20)
                    .containsEntry("breakevenCushion", 16)
                    .containsEntry("ivRank", 15)
                    .containsEntry("supportBuffer", 6)
                    .containsEntry("daysToExpiration", 10)
                    .containsEntry("delta", 10)
                    .containsEntry("earningsRisk", 10);
            assertThat(score.getTotal()).isEqualTo(87);
        }

        @Test
        @DisplayName("support at or below breakeven scores the floor")
        void supportBelowBreakeven() {
            assertThat(scorer.score(debitSpread().build(), 92.0, null, 100, AS_OF, DEBIT).getBreakdown())
                    .containsEntry("supportBuffer", 2);
        }

        @Test
        @DisplayName("short delta is used when the long delta is missing")
        void fallsBackToShortDelta() {
            SpreadCandidate spread = debitSpread().longDelta(null).build();

            assertThat(scorer.score(spread, 96.0, null, 100, AS_OF, DEBIT).getBreakdown())
                    .containsEntry("delta", 2);
        }
    }

    @Nested
    @DisplayName("Validation and bounds")
    class Bounds {

        @Test
        @DisplayName("candidates missing required fields are rejected")
        void malformedCandidates() {
            assertThat(scorer.isWellFormed(creditSpread().netCredit(null).build(), StrategyType.CREDIT_SPREAD)).isFalse();
            assertThat(scorer.isWellFormed(creditSpread().longStrike(null).build(), StrategyType.CREDIT_SPREAD)).isFalse();
            assertThat(scorer.isWellFormed(creditSpread().netCredit(Double.NaN).build(), StrategyType.CREDIT_SPREAD)).isFalse();
            assertThat(scorer.isWellFormed(creditSpread().expiration(null).build(), StrategyType.CREDIT_SPREAD)).isFalse();
            assertThat(scorer.isWellFormed(creditSpread().build(), StrategyType.DEBIT_SPREAD)).isFalse();
            assertThat(scorer.isWellFormed(null, StrategyType.CREDIT_SPREAD)).isFalse();

            SpreadCandidate noCredit = creditSpread().netCredit(null).build();
            assertThatThrownBy(() -> scorer.score(noCredit, 97.0, null, 100, AS_OF, CREDIT))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("zero-width zero-credit spread scores within 0..100 without the premium points")
        void zeroWidthScores() {
            SpreadCandidate zeroWidth = creditSpread().longStrike(92.0).netCredit(0.0).build();

            SpreadQualityScore score = scorer.score(zeroWidth, 97.0, null, 100, AS_OF, CREDIT);

            assertThat(score.getTotal()).isBetween(0, 100);
            assertThat(score.getBreakdown()).containsEntry("creditRatio", 0);
            assertThat(scorer.isWellFormed(zeroWidth, StrategyType.CREDIT_SPREAD)).isTrue();
            assertThat(scorer.isTradable(zeroWidth, StrategyType.CREDIT_SPREAD)).isFalse();
        }

        @Test
        @DisplayName("tradable candidates have distinct strikes and a non-negative premium")
        void tradableCandidates() {
            assertThat(scorer.isTradable(creditSpread().build(), StrategyType.CREDIT_SPREAD)).isTrue();
            assertThat(scorer.isTradable(creditSpread().netCredit(-0.5).build(), StrategyType.CREDIT_SPREAD)).isFalse();
            assertThat(scorer.isTradable(creditSpread().netCredit(null).build(), StrategyType.CREDIT_SPREAD)).isFalse();
        }

        @Test
        @DisplayName("pathological but well-formed candidates stay within 0..100")
        void totalStaysInRange() {
            SpreadCandidate absurd = creditSpread()
                    .netCredit(10.0)
                    .shortStrike(150.0)
                    .longStrike(145.0)
                    .shortDelta(5.0)
                    .ivRank(null)
                    .expiration(AS_OF.minusDays(10))
                    .build();

            SpreadQualityScore score = scorer.score(absurd, 1_000.0, 0, 100, AS_OF, CREDIT);

            assertThat(score.getTotal()).isBetween(0, 100);
            assertThat(score.getRating()).isEqualTo(SpreadRating.POOR);
        }

        @Test
        @DisplayName("rating thresholds")
        void ratingThresholds() {
            assertThat(SpreadQualityScorer.rate(80)).isEqualTo(SpreadRating.EXCELLENT);
            assertThat(SpreadQualityScorer.rate(79)).isEqualTo(SpreadRating.GOOD);
            assertThat(SpreadQualityScorer.rate(60)).isEqualTo(SpreadRating.GOOD);
            assertThat(SpreadQualityScorer.rate(59)).isEqualTo(SpreadRating.FAIR);
            assertThat(SpreadQualityScorer.rate(40)).isEqualTo(SpreadRating.FAIR);
            assertThat(SpreadQualityScorer.rate(39)).isEqualTo(SpreadRating.POOR);
        }
    }
}
