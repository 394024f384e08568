package com.spreadengine.domain.model;

import com.spreadengine.domain.enums.LevelType;

/**
 * A price level touched repeatedly by swing points.
 *
 * @param strength number of swing points grouped into this level
 */
public record SupportResistanceLevel(double price, LevelType type, int strength) {}
