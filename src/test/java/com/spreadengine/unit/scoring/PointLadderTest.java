package com.spreadengine.unit.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.spreadengine.scoring.PointLadder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PointLadderTest {

    private final PointLadder ladder = PointLadder.builder()
            .between(28, 38, 20)
            .between(22, 42, 15)
            .atLeast(12, 5)
            .otherwise(0);

    @Test
    @DisplayName("first matching rung wins")
    void firstMatchWins() {
        assertThat(ladder.score(30)).isEqualTo(20);
        assertThat(ladder.score(25)).isEqualTo(15);
        assertThat(ladder.score(60)).isEqualTo(5);
    }

    @Test
    @DisplayName("range bounds are inclusive")
    void inclusiveBounds() {
        assertThat(ladder.score(28)).isEqualTo(20);
        assertThat(ladder.score(38)).isEqualTo(20);
        assertThat(ladder.score(42)).isEqualTo(15);
    }

    @Test
    @DisplayName("no match and NaN fall back")
    void fallback() {
        assertThat(ladder.score(5)).isZero();
        assertThat(ladder.score(Double.NaN)).isZero();
    }

    @Test
    @DisplayName("maxPoints reports the best achievable score")
    void maxPoints() {
        assertThat(ladder.maxPoints()).isEqualTo(20);
        assertThat(PointLadder.builder().otherwise(3).maxPoints()).isEqualTo(3);
    }

    @Test
    @DisplayName("atMost and above compare in the expected direction")
    void directionalRungs() {
        PointLadder cheapIv = PointLadder.builder().atMost(30, 15).above(70, 1).otherwise(6);

        assertThat(cheapIv.score(30)).isEqualTo(15);
        assertThat(cheapIv.score(50)).isEqualTo(6);
        assertThat(cheapIv.score(70)).isEqualTo(6);
        assertThat(cheapIv.score(71)).isEqualTo(1);
    }
}
