package com.spreadengine.domain.model;

/**
 * A candidate paired with its quality score, used while ranking.
 */
public record ScoredSpread(SpreadCandidate candidate, SpreadQualityScore score) {}
