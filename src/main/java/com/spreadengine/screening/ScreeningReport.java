package com.spreadengine.screening;

import com.spreadengine.domain.enums.EntryAction;
import com.spreadengine.domain.model.EntryDecision;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of screening a batch of tickers. Decisions keep request order; failed tickers are
 * listed separately and do not affect the others.
 */
@Value
@Builder
public class ScreeningReport {

    int requested;
    List<EntryDecision> decisions;
    List<ScreeningFailure> failures;
    Map<EntryAction, Long> actionCounts;
}
