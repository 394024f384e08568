package com.spreadengine.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Price history for the standalone analysis endpoints.
 *
 * <p>{@code currentPrice}, {@code tolerance} and {@code minTouches} are only read by the
 * support-level endpoint; the current price defaults to the last close.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceSeriesRequest {

    @NotEmpty
    @Valid
    private List<PriceBarRequest> bars;

    @Positive
    private Double currentPrice;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("0.2")
    private Double tolerance;

    @Min(1)
    private Integer minTouches;
}
