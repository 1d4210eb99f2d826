package com.deliveryhealth.scoring;

public record WeightedContribution(
        String label,
        double weight,
        double normalized,
        double points,
        double maxPoints
) {
}
