package com.spreadengine.domain.model;

/**
 * Screening adjustments implied by a regime.
 *
 * @param minScore minimum stock score worth considering
 * @param positionSize multiplier applied to normal position size
 * @param onlyGradeA whether only top-grade setups should be taken
 */
public record RegimeAdjustments(int minScore, double positionSize, boolean onlyGradeA) {}
