package com.spreadengine.signal;

import com.spreadengine.domain.enums.SignalGroup;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for technical signal scoring, prefix {@code spread-engine.signals.*}.
 *
 * <p>{@code groupCaps} overrides the per-group caps declared on {@link SignalGroup}; groups
 * not listed keep their default.
 */
@Data
@Component
@ConfigurationProperties(prefix = "spread-engine.signals")
public class SignalProperties {

    private int scoreCeiling = 50;
    private Map<SignalGroup, Integer> groupCaps = new EnumMap<>(SignalGroup.class);
}
