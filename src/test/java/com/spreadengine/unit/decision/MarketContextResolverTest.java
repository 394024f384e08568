package com.spreadengine.unit.decision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.spreadengine.decision.MarketContext;
import com.spreadengine.decision.MarketContextResolver;
import com.spreadengine.domain.model.DecisionEngineInput;
import com.spreadengine.signal.SupportResistanceDetector;
import com.spreadengine.unit.PriceBarFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarketContextResolverTest {

    private MarketContextResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new MarketContextResolver(new SupportResistanceDetector());
    }

    @Test
    @DisplayName("explicit values win over derived ones")
    void explicitValuesWin() {
        DecisionEngineInput input = DecisionEngineInput.builder()
                .ticker("MSFT")
                .currentPrice(101.0)
                .rsiValue(48.0)
                .ma50(97.0)
                .ma200(92.0)
                .support1(95.0)
                .priceHistory(PriceBarFixtures.linear(250, 50, 0.2))
                .build();

        MarketContext context = resolver.resolve(input);

        assertThat(context).isEqualTo(new MarketContext(101.0, 48.0, 97.0, 92.0, 95.0));
    }

    @Test
    @DisplayName("missing values are derived from a long history")
    void derivesFromHistory() {
        DecisionEngineInput input = DecisionEngineInput.builder()
                .ticker("MSFT")
                .priceHistory(PriceBarFixtures.linear(250, 50, 0.2))
                .build();

        MarketContext context = resolver.resolve(input);

        assertThat(context.currentPrice()).isCloseTo(99.8, within(1e-9));
        assertThat(context.ma50()).isCloseTo(94.9, within(1e-6));
        assertThat(context.ma200()).isCloseTo(79.9, within(1e-6));
        assertThat(context.rsi()).isNotNull();
        assertThat(context.support1()).isNull();
    }

    @Test
    @DisplayName("short history leaves indicators unknown")
    void shortHistory() {
        DecisionEngineInput input = DecisionEngineInput.builder()
                .ticker("MSFT")
                .priceHistory(PriceBarFixtures.linear(10, 50, 0.2))
                .build();

        MarketContext context = resolver.resolve(input);

        assertThat(context.rsi()).isNull();
        assertThat(context.ma50()).isNull();
        assertThat(context.ma200()).isNull();
    }

    @Test
    @DisplayName("support comes from the nearest detected swing low")
    void derivesSupport() {
        DecisionEngineInput input = DecisionEngineInput.builder()
                .ticker("MSFT")
                .currentPrice(103.0)
                .priceHistory(PriceBarFixtures.sawtooth(40))
                .build();

        assertThat(resolver.resolve(input).support1()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("neither price nor history is rejected")
    void requiresPrice() {
        DecisionEngineInput input = DecisionEngineInput.builder().ticker("MSFT").build();

        assertThatThrownBy(() -> resolver.resolve(input))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("currentPrice");
    }
}
