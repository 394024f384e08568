package com.spreadengine.signal;

import com.spreadengine.domain.enums.SignalGroup;
import com.spreadengine.domain.model.TechnicalSignal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies per-group point caps to a list of signals.
 *
 * <p>Signals are processed in list order. Each one contributes
 * {@code min(points, cap - groupSoFar)}, so once a group reaches its cap later signals in
 * that group add nothing. Uncapped groups contribute in full. Capping an already capped
 * list returns the same points.
 */
public final class SignalGroupCaps {

    private final Map<SignalGroup, Integer> caps;

    public SignalGroupCaps(Map<SignalGroup, Integer> overrides) {
        Map<SignalGroup, Integer> resolved = new EnumMap<>(SignalGroup.class);
        for (SignalGroup group : SignalGroup.values()) {
            resolved.put(group, group.getDefaultCap());
        }
        if (overrides != null) {
            resolved.putAll(overrides);
        }
        this.caps = Collections.unmodifiableMap(resolved);
    }

    public static SignalGroupCaps defaults() {
        return new SignalGroupCaps(Map.of());
    }

    public int capFor(SignalGroup group) {
        return caps.getOrDefault(group, -1);
    }

    /**
     * Returns a copy of {@code signals} with each signal's points reduced to what it
     * contributes after group caps.
     */
    public List<TechnicalSignal> cap(List<TechnicalSignal> signals) {
        Map<SignalGroup, Integer> groupTotals = new EnumMap<>(SignalGroup.class);
        List<TechnicalSignal> capped = new ArrayList<>(signals.size());

        for (TechnicalSignal signal : signals) {
            int cap = signal.getGroup() != null ? capFor(signal.getGroup()) : -1;
            if (cap < 0) {
                capped.add(signal);
                continue;
            }
            int soFar = groupTotals.getOrDefault(signal.getGroup(), 0);
            int counted = Math.max(0, Math.min(signal.getPoints(), cap - soFar));
            groupTotals.put(signal.getGroup(), soFar + counted);
            capped.add(counted == signal.getPoints()
                    ? signal
                    : signal.toBuilder().points(counted).build());
        }
        return capped;
    }

    public int cappedTotal(List<TechnicalSignal> signals) {
        return cap(signals).stream().mapToInt(TechnicalSignal::getPoints).sum();
    }
}
