package com.deliveryhealth.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Scores for one project-week. {@code contributions} and {@code maxContributions} share the same
 * ordered label set; {@code raw} may hold {@code null} values for quantities that were absent.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScoreRecord {
    public final String projectId;
    public final String projectName;
    public final LocalDate weekEnding;
    public final DeliveryFramework deliveryFramework;
    public final double healthScore;
    public final double confidenceScore;
    public final double trendDelta;
    public final Map<String, Double> contributions;
    public final Map<String, Double> maxContributions;
    public final List<String> confidenceDrivers;
    public final Map<String, Object> raw;
}
