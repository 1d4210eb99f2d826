package com.deliveryhealth.scoring;

import com.deliveryhealth.model.DeliveryFramework;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects the weight scheme for a delivery framework and renormalizes the active weights of a
 * project-week so they sum to 1.
 */
public final class WeightAllocator {
    static final double PROXIMITY_START = 0.30;
    static final double PROXIMITY_SPAN = 0.70;

    private final Map<DeliveryFramework, WeightScheme> schemes = new EnumMap<>(DeliveryFramework.class);

    public WeightAllocator() {
        this(List.of(new PlannedWeightScheme(), new KanbanWeightScheme()));
    }

    public WeightAllocator(List<WeightScheme> schemes) {
        for (WeightScheme scheme : schemes) {
            this.schemes.put(scheme.framework(), scheme);
        }
        for (DeliveryFramework framework : DeliveryFramework.values()) {
            if (!this.schemes.containsKey(framework)) {
                throw new IllegalArgumentException("no weight scheme for " + framework);
            }
        }
    }

    public WeightScheme schemeFor(DeliveryFramework framework) {
        return schemes.get(DeliveryFramework.orDefault(framework));
    }

    /**
     * 0 below 30% complete, rising linearly to 1 at 100%.
     */
    public static double proximity(double actualPercentComplete) {
        return MetricNormalizer.clamp((actualPercentComplete - PROXIMITY_START) / PROXIMITY_SPAN, 0.0, 1.0);
    }

    public List<WeightedContribution> allocate(List<MetricTerm> terms) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        double total = 0.0;
        Set<String> seen = new HashSet<>();
        for (MetricTerm term : terms) {
            if (!seen.add(term.label())) {
                throw new IllegalArgumentException("duplicate metric label: " + term.label());
            }
            total += term.weight();
        }
        double denominator = Math.max(MetricNormalizer.MIN_DENOMINATOR, total);

        List<WeightedContribution> out = new ArrayList<>(terms.size());
        for (MetricTerm term : terms) {
            double weight = term.weight() / denominator;
            out.add(new WeightedContribution(
                    term.label(),
                    weight,
                    term.normalized(),
                    weight * term.normalized() * 100.0,
                    weight * 100.0
            ));
        }
        return List.copyOf(out);
    }

    public static double nominalTotal(List<MetricTerm> terms) {
        double total = 0.0;
        for (MetricTerm term : terms) {
            total += term.weight();
        }
        return total;
    }
}
