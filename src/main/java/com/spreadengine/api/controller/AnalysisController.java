package com.spreadengine.api.controller;

import com.spreadengine.api.dto.request.PriceSeriesRequest;
import com.spreadengine.api.dto.response.SupportLevelsResponse;
import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.domain.model.RegimeResult;
import com.spreadengine.domain.model.SupportResistanceLevel;
import com.spreadengine.domain.model.TechnicalAnalysis;
import com.spreadengine.mapper.DecisionRequestMapper;
import com.spreadengine.regime.RegimeDetector;
import com.spreadengine.signal.SupportResistanceDetector;
import com.spreadengine.signal.TechnicalSignalDetector;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Standalone analysis over a posted price series, without a full entry evaluation.
 * Short series never fail: they return the conservative or empty result.
 */
@RestController
@RequestMapping("/api/analysis")
public class AnalysisController {

    private final RegimeDetector regimeDetector;
    private final TechnicalSignalDetector technicalSignalDetector;
    private final SupportResistanceDetector supportResistanceDetector;
    private final DecisionRequestMapper decisionRequestMapper = Mappers.getMapper(DecisionRequestMapper.class);

    public AnalysisController(
            RegimeDetector regimeDetector,
            TechnicalSignalDetector technicalSignalDetector,
            SupportResistanceDetector supportResistanceDetector) {
        this.regimeDetector = regimeDetector;
        this.technicalSignalDetector = technicalSignalDetector;
        this.supportResistanceDetector = supportResistanceDetector;
    }

    @PostMapping("/regime")
    public RegimeResult detectRegime(@Valid @RequestBody PriceSeriesRequest request) {
        return regimeDetector.detect(decisionRequestMapper.toBars(request.getBars()));
    }

    @PostMapping("/signals")
    public TechnicalAnalysis detectSignals(@Valid @RequestBody PriceSeriesRequest request) {
        return technicalSignalDetector.detect(decisionRequestMapper.toBars(request.getBars()));
    }

    @PostMapping("/support-levels")
    public SupportLevelsResponse detectSupportLevels(@Valid @RequestBody PriceSeriesRequest request) {
        List<PriceBar> bars = decisionRequestMapper.toBars(request.getBars());
        double currentPrice = request.getCurrentPrice() != null
                ? request.getCurrentPrice()
                : bars.get(bars.size() - 1).close();

        List<SupportResistanceLevel> levels = supportResistanceDetector.detect(
                bars,
                request.getTolerance() != null ? request.getTolerance() : SupportResistanceDetector.DEFAULT_TOLERANCE,
                request.getMinTouches() != null ? request.getMinTouches() : SupportResistanceDetector.DEFAULT_MIN_TOUCHES);

        return SupportLevelsResponse.builder()
                .currentPrice(currentPrice)
                .levels(levels)
                .nearestSupport(supportResistanceDetector.findNearestSupport(currentPrice, bars))
                .build();
    }
}
