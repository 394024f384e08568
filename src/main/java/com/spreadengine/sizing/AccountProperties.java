package com.spreadengine.sizing;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Account defaults for position sizing, prefix {@code spread-engine.account.*}.
 *
 * <p>Per-request values on the decision input override {@code accountSize} and
 * {@code maxRiskPercent}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "spread-engine.account")
public class AccountProperties {

    private BigDecimal accountSize = new BigDecimal("1500");

    /** Share of the account that a full-size position may risk. */
    private BigDecimal maxRiskPercent = new BigDecimal("20");

    /** Shares per option contract. */
    private int contractMultiplier = 100;
}
