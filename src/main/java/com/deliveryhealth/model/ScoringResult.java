package com.deliveryhealth.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ScoringResult {
    public final Map<String, List<ScoreRecord>> series;
    public final Map<String, String> failures;

    public ScoringResult(Map<String, List<ScoreRecord>> series, Map<String, String> failures) {
        this.series = series == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(series));
        this.failures = failures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public ScoreRecord latest(String projectId) {
        List<ScoreRecord> records = series.get(projectId);
        if (records == null || records.isEmpty()) {
            return null;
        }
        return records.get(records.size() - 1);
    }
}
