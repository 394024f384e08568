package com.spreadengine.decision;

import com.spreadengine.domain.model.DecisionEngineInput;
import com.spreadengine.domain.model.NearestSupport;
import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.indicator.IndicatorCalculator;
import com.spreadengine.indicator.PriceSeries;
import com.spreadengine.signal.SupportResistanceDetector;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Fills in price, RSI, moving averages and support for a decision.
 *
 * <p>Values given explicitly on the input always win. Missing ones are derived from the
 * ticker's price history when it is long enough: RSI(14) from 15 bars, MA50 from 50, MA200
 * from 200, support from the nearest detected support level.
 */
@Component
public class MarketContextResolver {

    private final SupportResistanceDetector supportResistanceDetector;

    public MarketContextResolver(SupportResistanceDetector supportResistanceDetector) {
        this.supportResistanceDetector = supportResistanceDetector;
    }

    /**
     * @throws IllegalArgumentException when neither a current price nor any price history is given
     */
    public MarketContext resolve(DecisionEngineInput input) {
        List<PriceBar> history = input.getPriceHistory() != null ? input.getPriceHistory() : List.of();
        if (input.getCurrentPrice() == null && history.isEmpty()) {
            throw new IllegalArgumentException("Either currentPrice or priceHistory is required");
        }

        PriceSeries series = history.isEmpty() ? null : PriceSeries.of(input.getTicker(), history);
        double price = input.getCurrentPrice() != null ? input.getCurrentPrice() : series.lastClose();

        Double rsi = input.getRsiValue();
        if (rsi == null && series != null && series.size() >= 15) {
            rsi = finiteOrNull(last(IndicatorCalculator.rsi(series.barSeries(), 14)));
        }
        Double ma50 = input.getMa50();
        if (ma50 == null && series != null && series.size() >= 50) {
            ma50 = last(IndicatorCalculator.sma(series.barSeries(), 50));
        }
        Double ma200 = input.getMa200();
        if (ma200 == null && series != null && series.size() >= 200) {
            ma200 = last(IndicatorCalculator.sma(series.barSeries(), 200));
        }
        Double support = input.getSupport1();
        if (support == null && !history.isEmpty()) {
            NearestSupport nearest = supportResistanceDetector.findNearestSupport(price, history);
            support = nearest != null ? nearest.level() : null;
        }
        return new MarketContext(price, rsi, ma50, ma200, support);
    }

    private static double last(double[] values) {
        return values[values.length - 1];
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
