package com.spreadengine.decision;

import com.spreadengine.domain.enums.StrategyType;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link StrategyProfile} by {@link StrategyType}.
 *
 * <p>Spring discovers every StrategyProfile bean and this factory indexes them by type at
 * construction time.
 */
@Component
public class StrategyProfileFactory {

    private final Map<StrategyType, StrategyProfile> profilesByType;

    public StrategyProfileFactory(List<StrategyProfile> strategyProfiles) {
        this.profilesByType =
                strategyProfiles.stream().collect(Collectors.toMap(StrategyProfile::getType, Function.identity()));
    }

    /**
     * @throws IllegalArgumentException if no profile is registered for the type
     */
    public StrategyProfile getProfile(StrategyType strategyType) {
        StrategyProfile strategyProfile = profilesByType.get(strategyType);
        if (strategyProfile == null) {
            throw new IllegalArgumentException("No strategy profile found for type: " + strategyType);
        }
        return strategyProfile;
    }
}
