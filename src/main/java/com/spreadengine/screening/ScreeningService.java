package com.spreadengine.screening;

import com.spreadengine.decision.DecisionService;
import com.spreadengine.domain.enums.EntryAction;
import com.spreadengine.domain.model.DecisionEngineInput;
import com.spreadengine.domain.model.EntryDecision;
import com.spreadengine.exception.InvalidRequestException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Evaluates many tickers in parallel on the screening executor.
 *
 * <p>Each ticker runs as its own task. A failing or timed-out ticker is reported in
 * {@link ScreeningReport#getFailures()} and never aborts the rest of the batch.
 */
@Service
public class ScreeningService {

    private static final Logger log = LoggerFactory.getLogger(ScreeningService.class);

    private final DecisionService decisionService;
    private final Executor screeningExecutor;
    private final ScreeningProperties screeningProperties;

    public ScreeningService(
            DecisionService decisionService,
            @Qualifier("screeningExecutor") Executor screeningExecutor,
            ScreeningProperties screeningProperties) {
        this.decisionService = decisionService;
        this.screeningExecutor = screeningExecutor;
        this.screeningProperties = screeningProperties;
    }

    /**
     * @throws InvalidRequestException when the batch exceeds the configured maximum size
     */
    public ScreeningReport screen(List<DecisionEngineInput> inputs) {
        if (inputs.size() > screeningProperties.getMaxBatchSize()) {
            throw new InvalidRequestException(
                    "Batch of " + inputs.size() + " exceeds the maximum of " + screeningProperties.getMaxBatchSize(),
                    Map.of("maxBatchSize", screeningProperties.getMaxBatchSize()));
        }

        List<CompletableFuture<EntryDecision>> futures = new ArrayList<>(inputs.size());
        for (DecisionEngineInput input : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> decisionService.evaluate(input), screeningExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(screeningProperties.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Screening interrupted, reporting partial results");
        } catch (ExecutionException e) {
            // individual failures are collected per ticker below
            log.debug("Screening batch completed with failures: {}", e.getMessage());
        } catch (TimeoutException e) {
            log.warn("Screening timed out after {}s, reporting partial results", screeningProperties.getTimeoutSeconds());
        }

        List<EntryDecision> decisions = new ArrayList<>();
        List<ScreeningFailure> failures = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            String ticker = inputs.get(i).getTicker();
            CompletableFuture<EntryDecision> future = futures.get(i);
            if (!future.isDone()) {
                future.cancel(true);
                failures.add(new ScreeningFailure(ticker, "Timed out"));
                continue;
            }
            try {
                decisions.add(future.join());
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Screening failed for {}: {}", ticker, cause.getMessage());
                failures.add(new ScreeningFailure(ticker, cause.getMessage()));
            }
        }

        Map<EntryAction, Long> actionCounts = new EnumMap<>(EntryAction.class);
        decisions.forEach(decision -> actionCounts.merge(decision.getAction(), 1L, Long::sum));

        log.info(
                "Screened {} tickers: {} decisions, {} failures, {}",
                inputs.size(),
                decisions.size(),
                failures.size(),
                actionCounts);
        return ScreeningReport.builder()
                .requested(inputs.size())
                .decisions(List.copyOf(decisions))
                .failures(List.copyOf(failures))
                .actionCounts(actionCounts)
                .build();
    }
}
