package com.spreadengine.decision;

import com.spreadengine.domain.model.DecisionEngineInput;
import com.spreadengine.domain.model.EntryDecision;
import com.spreadengine.exception.InvalidRequestException;
import com.spreadengine.observability.DecisionLogger;
import com.spreadengine.observability.DecisionMetrics;
import com.spreadengine.observability.DecisionRecord;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Service-level entry point around {@link DecisionEngine}: fills in today's date when the
 * caller gives none, records metrics, and logs each decision.
 */
@Service
public class DecisionService {

    private final DecisionEngine decisionEngine;
    private final DecisionLogger decisionLogger;
    private final DecisionMetrics decisionMetrics;

    public DecisionService(
            DecisionEngine decisionEngine, DecisionLogger decisionLogger, DecisionMetrics decisionMetrics) {
        this.decisionEngine = decisionEngine;
        this.decisionLogger = decisionLogger;
        this.decisionMetrics = decisionMetrics;
    }

    /**
     * Every failure is counted; other runtime exceptions are rethrown unchanged.
     *
     * @throws InvalidRequestException when the input cannot be evaluated
     */
    public EntryDecision evaluate(DecisionEngineInput input) {
        DecisionEngineInput dated = input.getAsOfDate() != null
                ? input
                : input.toBuilder().asOfDate(LocalDate.now()).build();

        long start = System.nanoTime();
        EntryDecision decision;
        try {
            decision = decisionEngine.evaluateEntry(dated);
        } catch (IllegalArgumentException e) {
            decisionMetrics.recordFailure();
            throw new InvalidRequestException(
                    "Cannot evaluate " + (input.getTicker() != null ? input.getTicker() : "input") + ": " + e.getMessage(),
                    e);
        } catch (RuntimeException e) {
            decisionMetrics.recordFailure();
            throw e;
        }
        decisionMetrics.recordDecision(decision.getStrategyType(), decision.getAction(), System.nanoTime() - start);
        decisionLogger.log(decision);
        return decision;
    }

    public List<DecisionRecord> getRecentDecisions(int limit) {
        return decisionLogger.getRecentDecisions(limit);
    }
}
