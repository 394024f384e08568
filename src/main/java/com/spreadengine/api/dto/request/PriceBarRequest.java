package com.spreadengine.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One daily OHLCV bar. Bars are sent oldest first; the date is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBarRequest {

    private LocalDate date;

    @NotNull
    @Positive
    private Double open;

    @NotNull
    @Positive
    private Double high;

    @NotNull
    @Positive
    private Double low;

    @NotNull
    @Positive
    private Double close;

    @NotNull
    @PositiveOrZero
    private Long volume;
}
