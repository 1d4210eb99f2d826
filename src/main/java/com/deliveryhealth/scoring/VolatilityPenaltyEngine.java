package com.deliveryhealth.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Directional coefficient-of-variation penalty over the recent history of a drifting quantity.
 * Erratic movement raises the base penalty; the direction of the mean delta amplifies or dampens
 * it, and a steadily worsening series always keeps a minimum penalty.
 */
public final class VolatilityPenaltyEngine {
    public static final int DEFAULT_WINDOW = 4;

    static final double MAX_DELTA_COV = 2.0;
    static final double FULL_PENALTY_COV = 0.5;
    static final double BASE_PENALTY_POINTS = 30.0;
    static final double DIRECTION_WEIGHT = 0.4;
    static final double FLOOR_POINTS = 8.0;
    static final double MAX_PENALTY = 40.0;

    private final int window;

    public VolatilityPenaltyEngine() {
        this(DEFAULT_WINDOW);
    }

    public VolatilityPenaltyEngine(int window) {
        if (window < 2) {
            throw new IllegalArgumentException("volatility window must be >= 2, got " + window);
        }
        this.window = window;
    }

    /**
     * @param history observations in chronological order, the last one being the current week;
     *                only the trailing {@code window} values are used
     */
    public VolatilityBreakdown evaluate(List<Double> history, VolatilityProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("profile is required");
        }
        List<Double> points = tail(history, window);
        if (points.size() < 2) {
            return VolatilityBreakdown.insufficient(profile, points);
        }

        List<Double> deltas = new ArrayList<>(points.size() - 1);
        for (int i = 1; i < points.size(); i++) {
            deltas.add(points.get(i) - points.get(i - 1));
        }
        double mean = mean(deltas);
        double std = sampleStd(deltas, mean);
        double reference = Math.max(Math.abs(mean), profile.referenceFloor);
        double deltaCov = MetricNormalizer.clamp(std / reference, 0.0, MAX_DELTA_COV);
        double base = MetricNormalizer.clamp(deltaCov / FULL_PENALTY_COV, 0.0, 1.0) * BASE_PENALTY_POINTS;

        double dirFactor = Math.tanh(mean / profile.directionScale);
        double multiplier;
        double floor;
        if (profile.increasingIsBad) {
            multiplier = 1.0 + DIRECTION_WEIGHT * dirFactor;
            floor = MetricNormalizer.clamp(dirFactor, 0.0, 1.0) * FLOOR_POINTS;
        } else {
            multiplier = 1.0 - DIRECTION_WEIGHT * dirFactor;
            floor = MetricNormalizer.clamp(-dirFactor, 0.0, 1.0) * FLOOR_POINTS;
        }
        double penalty = MetricNormalizer.clamp(Math.max(base * multiplier, floor), 0.0, MAX_PENALTY);

        return VolatilityBreakdown.builder()
                .profile(profile)
                .points(List.copyOf(points))
                .deltas(List.copyOf(deltas))
                .meanDelta(mean)
                .stdDelta(std)
                .reference(reference)
                .deltaCov(deltaCov)
                .basePenalty(base)
                .dirFactor(dirFactor)
                .multiplier(multiplier)
                .directionalFloor(floor)
                .penalty(penalty)
                .sufficient(true)
                .build();
    }

    static List<Double> tail(List<Double> values, int size) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<Double> out = new ArrayList<>(Math.min(size, values.size()));
        for (int i = Math.max(0, values.size() - size); i < values.size(); i++) {
            Double v = values.get(i);
            if (v != null && Double.isFinite(v)) {
                out.add(v);
            }
        }
        return out;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    // sample standard deviation; needs at least two deltas
    private static double sampleStd(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 0.0;
        }
        double m2 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / (values.size() - 1));
    }
}
