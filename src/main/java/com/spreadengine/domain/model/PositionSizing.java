package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.PositionSize;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionSizing {

    PositionSize size;
    int percentage;

    /** Contracts affordable within the risk budget; zero when the tier is SKIP. */
    int maxContracts;

    BigDecimal maxRiskDollars;
    List<String> reasoning;
}
