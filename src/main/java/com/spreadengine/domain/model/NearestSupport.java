package com.spreadengine.domain.model;

/**
 * @param level support price below the current price
 * @param distance fractional distance from price down to the level, e.g. 0.03 for 3%
 */
public record NearestSupport(double level, double distance) {}
