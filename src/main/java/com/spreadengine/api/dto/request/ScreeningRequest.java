package com.spreadengine.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A batch of tickers to evaluate in parallel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreeningRequest {

    @NotEmpty
    @Valid
    private List<EvaluateEntryRequest> entries;
}
