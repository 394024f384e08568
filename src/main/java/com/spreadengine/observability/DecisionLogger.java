package com.spreadengine.observability;

import com.spreadengine.domain.model.EntryDecision;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records every entry decision as a structured log line and keeps the most recent ones in
 * memory for the recent-decisions endpoint.
 *
 * <p>The ring buffer is a {@link ConcurrentLinkedDeque} capped at {@value #RING_BUFFER_SIZE}
 * entries. New entries go to the front (newest first) and the oldest are evicted once the
 * buffer is full. Nothing is persisted.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 500;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    /**
     * Summarizes the decision, adds it to the ring buffer and logs it.
     */
    public DecisionRecord log(EntryDecision decision) {
        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(Instant.now())
                .ticker(decision.getTicker())
                .strategyType(decision.getStrategyType())
                .action(decision.getAction())
                .confidenceLevel(decision.getConfidence().getLevel())
                .confidenceTotal(decision.getConfidence().getTotal())
                .regime(decision.getRegime())
                .positionSize(decision.getPositionSizing().getSize())
                .maxContracts(decision.getPositionSizing().getMaxContracts())
                .spreadScore(decision.getSpreadScore() != null ? decision.getSpreadScore().getTotal() : null)
                .reasoning(decision.getReasoning())
                .warnings(decision.getWarnings())
                .build();

        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.pollLast();
        }

        logger.info(
                "[DECISION] {} {} -> {} | confidence={}({}) regime={} size={} contracts={} warnings={}",
                decisionRecord.getTicker(),
                decisionRecord.getStrategyType(),
                decisionRecord.getAction(),
                decisionRecord.getConfidenceLevel(),
                decisionRecord.getConfidenceTotal(),
                decisionRecord.getRegime(),
                decisionRecord.getPositionSize(),
                decisionRecord.getMaxContracts(),
                decisionRecord.getWarnings().size());
        return decisionRecord;
    }

    /**
     * Returns up to {@code limit} decisions, newest first.
     */
    public List<DecisionRecord> getRecentDecisions(int limit) {
        return ringBuffer.stream().limit(Math.max(0, limit)).toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }
}
