package com.spreadengine.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoublePredicate;

/**
 * Ordered list of (predicate, points) rules over a single measurement. The first rule whose
 * predicate matches decides the points; when none matches the fallback applies.
 *
 * <p>Instances are immutable and safe to share.
 */
public final class PointLadder {

    private final List<Rung> rungs;
    private final int fallback;

    private PointLadder(List<Rung> rungs, int fallback) {
        this.rungs = List.copyOf(rungs);
        this.fallback = fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int score(double value) {
        if (Double.isNaN(value)) {
            return fallback;
        }
        for (Rung rung : rungs) {
            if (rung.predicate().test(value)) {
                return rung.points();
            }
        }
        return fallback;
    }

    /** Highest points any rung (or the fallback) can award. */
    public int maxPoints() {
        int max = fallback;
        for (Rung rung : rungs) {
            max = Math.max(max, rung.points());
        }
        return max;
    }

    private record Rung(DoublePredicate predicate, int points) {}

    public static final class Builder {

        private final List<Rung> rungs = new ArrayList<>();

        private Builder() {}

        public Builder when(DoublePredicate predicate, int points) {
            rungs.add(new Rung(predicate, points));
            return this;
        }

        /** Inclusive range rule. */
        public Builder between(double low, double high, int points) {
            return when(v -> v >= low && v <= high, points);
        }

        public Builder atLeast(double threshold, int points) {
            return when(v -> v >= threshold, points);
        }

        public Builder atMost(double threshold, int points) {
            return when(v -> v <= threshold, points);
        }

        public Builder above(double threshold, int points) {
            return when(v -> v > threshold, points);
        }

        public PointLadder otherwise(int fallback) {
            return new PointLadder(rungs, fallback);
        }
    }
}
