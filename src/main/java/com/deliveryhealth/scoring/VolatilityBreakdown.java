package com.deliveryhealth.scoring;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class VolatilityBreakdown {
    public final VolatilityProfile profile;
    public final List<Double> points;
    public final List<Double> deltas;
    public final double meanDelta;
    public final double stdDelta;
    public final double reference;
    public final double deltaCov;
    public final double basePenalty;
    public final double dirFactor;
    public final double multiplier;
    public final double directionalFloor;
    public final double penalty;
    public final boolean sufficient;

    static VolatilityBreakdown insufficient(VolatilityProfile profile, List<Double> points) {
        return VolatilityBreakdown.builder()
                .profile(profile)
                .points(List.copyOf(points))
                .deltas(List.of())
                .reference(profile.referenceFloor)
                .multiplier(1.0)
                .penalty(0.0)
                .sufficient(false)
                .build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("quantity", profile.name().toLowerCase(Locale.ROOT));
        out.put("points", points);
        out.put("deltas", deltas);
        out.put("mean_delta", round4(meanDelta));
        out.put("std_delta", round4(stdDelta));
        out.put("reference", round4(reference));
        out.put("delta_cov", round4(deltaCov));
        out.put("base_penalty", round4(basePenalty));
        out.put("dir_factor", round4(dirFactor));
        out.put("multiplier", round4(multiplier));
        out.put("directional_floor", round4(directionalFloor));
        out.put("penalty", round4(penalty));
        out.put("sufficient", sufficient);
        return out;
    }

    private static double round4(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
