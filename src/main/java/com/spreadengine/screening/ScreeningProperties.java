package com.spreadengine.screening;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Batch screening limits, prefix {@code spread-engine.screening.*}. Thread pool sizing lives
 * with the executor in {@link com.spreadengine.config.AsyncConfig}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "spread-engine.screening")
public class ScreeningProperties {

    private int maxBatchSize = 50;
    private long timeoutSeconds = 30;
}
