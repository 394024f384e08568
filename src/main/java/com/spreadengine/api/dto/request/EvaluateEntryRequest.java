package com.spreadengine.api.dto.request;

import com.spreadengine.domain.enums.MarketRegime;
import com.spreadengine.domain.enums.MomentumTrend;
import com.spreadengine.domain.enums.RelativeStrengthTrend;
import com.spreadengine.domain.enums.StrategyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for evaluating one ticker.
 *
 * <p>Market context fields (currentPrice, rsiValue, ma50, ma200, support1) are optional when
 * priceHistory is supplied; anything missing is derived from the bars. strategyType defaults
 * to CREDIT_SPREAD and asOfDate to today.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateEntryRequest {

    @NotBlank
    private String ticker;

    private StrategyType strategyType;

    private LocalDate asOfDate;

    @Positive
    private Double currentPrice;

    @Valid
    private List<PriceBarRequest> priceHistory;

    @DecimalMin("0")
    @DecimalMax("100")
    private Double rsiValue;

    @Positive
    private Double ma50;

    @Positive
    private Double ma200;

    @Positive
    private Double support1;

    /** Fundamental/quality score of the stock, 0-100. */
    @NotNull
    @DecimalMin("0")
    @DecimalMax("100")
    private Double stockScore;

    @NotNull
    @PositiveOrZero
    private Integer checklistPassed;

    @NotNull
    @PositiveOrZero
    private Integer checklistTotal;

    private List<String> checklistFailReasons;

    private MomentumTrend momentumOverall;
    private List<MomentumTrend> momentumSignals;
    private RelativeStrengthTrend relativeStrengthTrend;

    /** Detected from benchmarkHistory when omitted. */
    private MarketRegime marketRegime;

    @Valid
    private List<PriceBarRequest> benchmarkHistory;

    @DecimalMin("0")
    @DecimalMax("100")
    private Double ivRank;

    private Integer daysToEarnings;

    @Valid
    private List<SpreadCandidateRequest> spreadCandidates;

    @Positive
    private Double accountSize;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("100")
    private Double maxRiskPercent;
}
