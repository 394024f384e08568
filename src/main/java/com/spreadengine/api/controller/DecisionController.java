package com.spreadengine.api.controller;

import com.spreadengine.api.dto.request.EvaluateEntryRequest;
import com.spreadengine.api.dto.request.ScreeningRequest;
import com.spreadengine.decision.DecisionService;
import com.spreadengine.domain.model.EntryDecision;
import com.spreadengine.mapper.DecisionRequestMapper;
import com.spreadengine.observability.DecisionRecord;
import com.spreadengine.screening.ScreeningReport;
import com.spreadengine.screening.ScreeningService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for entry decisions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/decisions/evaluate} -- evaluate one ticker</li>
 *   <li>{@code POST /api/decisions/screen} -- evaluate a batch of tickers in parallel</li>
 *   <li>{@code GET /api/decisions/recent} -- most recent decisions, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/decisions")
public class DecisionController {

    private final DecisionService decisionService;
    private final ScreeningService screeningService;
    private final DecisionRequestMapper decisionRequestMapper = Mappers.getMapper(DecisionRequestMapper.class);

    public DecisionController(DecisionService decisionService, ScreeningService screeningService) {
        this.decisionService = decisionService;
        this.screeningService = screeningService;
    }

    @PostMapping("/evaluate")
    public EntryDecision evaluate(@Valid @RequestBody EvaluateEntryRequest request) {
        return decisionService.evaluate(decisionRequestMapper.toInput(request));
    }

    @PostMapping("/screen")
    public ScreeningReport screen(@Valid @RequestBody ScreeningRequest request) {
        return screeningService.screen(decisionRequestMapper.toInputs(request.getEntries()));
    }

    @GetMapping("/recent")
    public List<DecisionRecord> getRecent(@RequestParam(defaultValue = "20") int limit) {
        return decisionService.getRecentDecisions(limit);
    }
}
