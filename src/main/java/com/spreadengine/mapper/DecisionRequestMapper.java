package com.spreadengine.mapper;

import com.spreadengine.api.dto.request.EvaluateEntryRequest;
import com.spreadengine.api.dto.request.PriceBarRequest;
import com.spreadengine.api.dto.request.SpreadCandidateRequest;
import com.spreadengine.domain.model.DecisionEngineInput;
import com.spreadengine.domain.model.PriceBar;
import com.spreadengine.domain.model.SpreadCandidate;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from the REST request DTOs to the engine's input model.
 *
 * <p>A missing strategy type maps to CREDIT_SPREAD; every other absent field stays null so
 * the engine can derive it from price history.
 */
@Mapper
public interface DecisionRequestMapper {

    @Mapping(target = "strategyType", defaultValue = "CREDIT_SPREAD")
    DecisionEngineInput toInput(EvaluateEntryRequest request);

    List<DecisionEngineInput> toInputs(List<EvaluateEntryRequest> requests);

    SpreadCandidate toCandidate(SpreadCandidateRequest request);

    PriceBar toBar(PriceBarRequest request);

    List<PriceBar> toBars(List<PriceBarRequest> requests);
}
