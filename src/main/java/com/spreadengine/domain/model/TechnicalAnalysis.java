package com.spreadengine.domain.model;

import java.util.List;
import lombok.Value;

/**
 * Result of technical signal detection: the capped score and every signal that fired,
 * with its uncapped points.
 */
@Value
public class TechnicalAnalysis {

    int score;
    List<TechnicalSignal> signals;

    public static TechnicalAnalysis empty() {
        return new TechnicalAnalysis(0, List.of());
    }
}
