package com.spreadengine.observability;

import com.spreadengine.domain.enums.EntryAction;
import com.spreadengine.domain.enums.StrategyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the decision engine:
 * <ul>
 *   <li><b>decisions.evaluated</b> (counter, tags action and strategy)</li>
 *   <li><b>decisions.failed</b> (counter): evaluations that threw, e.g. inside a screening batch</li>
 *   <li><b>decisions.evaluation.latency</b> (timer)</li>
 * </ul>
 */
@Service
public class DecisionMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter failedCounter;
    private final Timer evaluationTimer;

    public DecisionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.failedCounter = Counter.builder("decisions.failed")
                .description("Entry evaluations that failed with an error")
                .register(meterRegistry);
        this.evaluationTimer = Timer.builder("decisions.evaluation.latency")
                .description("Time to evaluate one ticker")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);
    }

    public void recordDecision(StrategyType strategyType, EntryAction action, long elapsedNanos) {
        Counter.builder("decisions.evaluated")
                .description("Entry decisions produced, by action")
                .tag("action", action.name())
                .tag("strategy", strategyType.name())
                .register(meterRegistry)
                .increment();
        evaluationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordFailure() {
        failedCounter.increment();
    }
}
