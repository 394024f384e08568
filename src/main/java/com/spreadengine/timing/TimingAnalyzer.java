package com.spreadengine.timing;

import com.spreadengine.domain.enums.PriceVsMa;
import com.spreadengine.domain.enums.RsiZone;
import com.spreadengine.domain.enums.StrategyType;
import com.spreadengine.domain.enums.TimingAction;
import com.spreadengine.domain.model.TimingAnalysis;
import com.spreadengine.domain.model.TimingInput;
import org.springframework.stereotype.Component;

/**
 * Decides whether to enter now or wait, by counting entry and wait conditions.
 *
 * <p>Entry conditions: RSI neutral or ideal, price at or above the 50-day MA, favorable IV,
 * more than 3% above support. Wait conditions: RSI oversold, price below the 50-day MA,
 * unfavorable IV. Three or more entry conditions mean ENTER; otherwise two or more wait
 * conditions mean WAIT with a target; otherwise ENTER.
 */
@Component
public class TimingAnalyzer {

    static final double DEFAULT_RSI = 50;
    static final double DEFAULT_SUPPORT_DISTANCE = 10;
    static final double MA_DEAD_BAND = 0.01;

    public TimingAnalysis analyze(TimingInput input, TimingProfile profile) {
        double price = input.getCurrentPrice();
        double rsi = input.getRsi() != null ? input.getRsi() : DEFAULT_RSI;
        RsiZone rsiZone = profile.zoneOf(rsi);
        PriceVsMa priceVsMa = priceVsMa(price, input.getMa50());
        double distanceToSupport = input.getSupport1() != null && price > 0
                ? (price - input.getSupport1()) / price * 100
                : DEFAULT_SUPPORT_DISTANCE;
        boolean ivFavorable = profile.isIvFavorable(input.getIvRank());

        int enterSignals = 0;
        if (rsiZone == RsiZone.NEUTRAL || rsiZone == RsiZone.IDEAL) {
            enterSignals++;
        }
        if (priceVsMa != PriceVsMa.BELOW) {
            enterSignals++;
        }
        if (ivFavorable) {
            enterSignals++;
        }
        if (distanceToSupport > 3) {
            enterSignals++;
        }

        int waitSignals = 0;
        if (rsiZone == RsiZone.OVERSOLD) {
            waitSignals++;
        }
        if (priceVsMa == PriceVsMa.BELOW) {
            waitSignals++;
        }
        if (!ivFavorable) {
            waitSignals++;
        }

        TimingAnalysis.TimingAnalysisBuilder result = TimingAnalysis.builder()
                .rsiZone(rsiZone)
                .priceVsMa(priceVsMa)
                .distanceToSupport(Math.round(distanceToSupport * 100) / 100.0)
                .ivRankFavorable(ivFavorable);

        if (enterSignals >= 3) {
            return result.action(TimingAction.ENTER)
                    .reason(ivFavorable ? ivEntryReason(profile) : "Price stable above support")
                    .build();
        }
        if (waitSignals >= 2) {
            Double ma50 = input.getMa50();
            if (rsiZone == RsiZone.OVERSOLD) {
                return result.action(TimingAction.WAIT)
                        .waitTarget(ma50 != null ? ma50 : price * 1.03)
                        .reason("Wait for RSI to recover from oversold")
                        .build();
            }
            if (priceVsMa == PriceVsMa.BELOW) {
                return result.action(TimingAction.WAIT)
                        .waitTarget(ma50)
                        .reason("Wait for price to reclaim the 50-day MA")
                        .build();
            }
            return result.action(TimingAction.WAIT)
                    .reason(profile.strategyType() == StrategyType.CREDIT_SPREAD
                            ? "IV rank too low for premium selling"
                            : "IV rank too high, spreads are expensive")
                    .build();
        }
        return result.action(TimingAction.ENTER)
                .reason("Conditions acceptable for entry")
                .build();
    }

    public static PriceVsMa priceVsMa(double price, Double ma50) {
        if (ma50 == null || ma50 <= 0) {
            return PriceVsMa.AT;
        }
        double diff = (price - ma50) / ma50;
        if (diff > MA_DEAD_BAND) {
            return PriceVsMa.ABOVE;
        }
        if (diff < -MA_DEAD_BAND) {
            return PriceVsMa.BELOW;
        }
        return PriceVsMa.AT;
    }

    private static String ivEntryReason(TimingProfile profile) {
        return profile.strategyType() == StrategyType.CREDIT_SPREAD
                ? "IV elevated + stable price action"
                : "IV reasonable + stable price action";
    }
}
