package com.deliveryhealth.scoring;

/**
 * One active metric for a project-week before renormalization.
 */
public record MetricTerm(String label, double weight, double normalized) {
    public MetricTerm {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label is required");
        }
        weight = Math.max(0.0, weight);
        normalized = MetricNormalizer.clamp(normalized, 0.0, 1.0);
    }
}
