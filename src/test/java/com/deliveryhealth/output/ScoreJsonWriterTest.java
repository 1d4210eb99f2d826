package com.deliveryhealth.output;

import com.deliveryhealth.SnapshotFixtures;
import com.deliveryhealth.config.ThresholdConfig;
import com.deliveryhealth.model.ScoreRecord;
import com.deliveryhealth.model.ScoringResult;
import com.deliveryhealth.scoring.HealthScoringEngine;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreJsonWriterTest {

    private final ScoreJsonWriter writer = new ScoreJsonWriter();

    @Test
    void buildDocument_shouldExposeSummariesSeriesAndFailures() {
        List<ScoreRecord> records = new HealthScoringEngine().scoreProject("P1", List.of(
                SnapshotFixtures.planned("P1", 0).build(),
                SnapshotFixtures.planned("P1", 1).blockedDays(5).build()), ThresholdConfig.defaultConfig());
        ScoringResult result = new ScoringResult(Map.of("P1", records), Map.of("P2", "IllegalStateException: bad row"));

        JSONObject doc = writer.buildDocument(result);

        JSONArray summaries = doc.getJSONArray("summaries");
        assertEquals(1, summaries.length());
        JSONObject summary = summaries.getJSONObject(0);
        assertEquals("P1", summary.getString("project_id"));
        assertEquals("2024-03-08", summary.getString("week_ending"));
        assertEquals("planned", summary.getString("delivery_framework"));
        assertEquals(records.get(1).healthScore, summary.getDouble("health_score"), 1e-9);
        assertEquals(records.get(1).trendDelta, summary.getDouble("trend_delta"), 1e-9);
        assertTrue(summary.getJSONObject("raw").has("cpi"));
        assertTrue(summary.getJSONObject("raw").isNull("cpi"));
        assertTrue(summary.getJSONObject("raw").getJSONObject("volatility").has("penalty"));
        assertEquals("Blocked Days", summary.getJSONObject("narrative").getString("top_detractor"));
        assertTrue(summary.getJSONObject("narrative").getString("text").startsWith("P1 project is in"));

        JSONObject series = doc.getJSONArray("series").getJSONObject(0);
        assertEquals(2, series.getJSONArray("weeks").length());
        assertEquals(2, series.getJSONArray("health").length());
        assertEquals(0.0, series.getJSONArray("trend").getDouble(0), 1e-12);
        assertEquals(2, series.getJSONArray("raw_by_week").length());
        assertTrue(series.getJSONArray("contributions_by_week").getJSONObject(0).has("Blocked Days"));

        assertEquals("IllegalStateException: bad row", doc.getJSONObject("failures").getString("P2"));
    }

    @Test
    void buildDocument_shouldListMetricsInLabelOrder() {
        List<ScoreRecord> records = new HealthScoringEngine().scoreProject("K1", List.of(
                SnapshotFixtures.kanban("K1", 0).build(),
                SnapshotFixtures.kanban("K1", 1).blockedDays(3).build()), ThresholdConfig.defaultConfig());
        ScoreRecord latest = records.get(1);

        JSONObject doc = writer.buildDocument(new ScoringResult(Map.of("K1", records), Map.of()));

        JSONArray metrics = doc.getJSONArray("summaries").getJSONObject(0).getJSONArray("metrics");
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < metrics.length(); i++) {
            labels.add(metrics.getJSONObject(i).getString("label"));
        }
        assertEquals(new ArrayList<>(latest.contributions.keySet()), labels);
        JSONObject first = metrics.getJSONObject(0);
        String label = first.getString("label");
        assertEquals(Math.round(latest.contributions.get(label) * 100.0) / 100.0, first.getDouble("points"), 1e-9);
        assertEquals(Math.round(latest.maxContributions.get(label) * 100.0) / 100.0, first.getDouble("max_points"), 1e-9);

        JSONArray byWeek = doc.getJSONArray("series").getJSONObject(0).getJSONArray("metrics_by_week");
        assertEquals(2, byWeek.length());
        assertEquals(records.get(0).contributions.size(), byWeek.getJSONArray(0).length());
    }

    @Test
    void buildDocument_shouldHandleEmptyResult() {
        JSONObject doc = writer.buildDocument(new ScoringResult(Map.of(), Map.of()));

        assertEquals(0, doc.getJSONArray("summaries").length());
        assertEquals(0, doc.getJSONArray("series").length());
        assertTrue(doc.getJSONObject("failures").isEmpty());
    }

    @Test
    void buildDefaults_shouldWrapThresholds() {
        JSONObject doc = writer.buildDefaults(ThresholdConfig.defaults());

        JSONObject defaults = doc.getJSONObject("defaults");
        assertEquals(ThresholdConfig.defaults().size(), defaults.length());
        assertEquals(140.0, defaults.getDouble(ThresholdConfig.SLIP_DAYS_MAX), 1e-12);
    }
}
