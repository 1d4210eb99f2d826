package com.deliveryhealth.output;

import com.deliveryhealth.model.Narrative;
import com.deliveryhealth.model.ScoreRecord;
import com.deliveryhealth.model.ScoringResult;
import com.deliveryhealth.narrative.NarrativeGenerator;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：ScoreJsonWriter（class）。
 * 主要职责：把评分结果整理为 JSON 文档，summaries 为每个项目最新一周，series 为完整历史。
 * 使用建议：缺失的可选诊断值输出为 null，而不是省略或填充默认值。
 */
public final class ScoreJsonWriter {
    private final NarrativeGenerator narrativeGenerator;

    public ScoreJsonWriter() {
        this(new NarrativeGenerator());
    }

    public ScoreJsonWriter(NarrativeGenerator narrativeGenerator) {
        this.narrativeGenerator = narrativeGenerator;
    }

    public JSONObject buildDocument(ScoringResult result) {
        JSONArray summaries = new JSONArray();
        JSONArray series = new JSONArray();
        for (Map.Entry<String, List<ScoreRecord>> entry : result.series.entrySet()) {
            List<ScoreRecord> records = entry.getValue();
            if (records.isEmpty()) {
                continue;
            }
            summaries.put(buildSummary(records.get(records.size() - 1)));
            series.put(buildSeries(entry.getKey(), records));
        }

        JSONObject root = new JSONObject();
        root.put("summaries", summaries);
        root.put("series", series);
        root.put("failures", new JSONObject(result.failures));
        return root;
    }

    public JSONObject buildDefaults(Map<String, Double> defaults) {
        JSONObject root = new JSONObject();
        root.put("defaults", new JSONObject(defaults));
        return root;
    }

    JSONObject buildSummary(ScoreRecord latest) {
        Narrative narrative = narrativeGenerator.describe(latest);
        JSONObject summary = new JSONObject();
        summary.put("project_id", safe(latest.projectId));
        summary.put("project_name", safe(latest.projectName));
        summary.put("week_ending", latest.weekEnding == null ? JSONObject.NULL : latest.weekEnding.toString());
        summary.put("delivery_framework", latest.deliveryFramework.tag());
        summary.put("health_score", latest.healthScore);
        summary.put("confidence_score", latest.confidenceScore);
        summary.put("trend_delta", latest.trendDelta);
        summary.put("contributions", roundedMap(latest.contributions));
        summary.put("max_contributions", roundedMap(latest.maxContributions));
        summary.put("metrics", metricArray(latest));
        summary.put("confidence_drivers", new JSONArray(latest.confidenceDrivers));
        summary.put("raw", toJson(latest.raw));
        summary.put("narrative", new JSONObject()
                .put("headline", narrative.headline)
                .put("text", narrative.text)
                .put("top_detractor", narrative.topDetractor == null ? JSONObject.NULL : narrative.topDetractor)
                .put("top_performer", narrative.topPerformer == null ? JSONObject.NULL : narrative.topPerformer));
        return summary;
    }

    JSONObject buildSeries(String projectId, List<ScoreRecord> records) {
        JSONArray weeks = new JSONArray();
        JSONArray health = new JSONArray();
        JSONArray confidence = new JSONArray();
        JSONArray trend = new JSONArray();
        JSONArray contributions = new JSONArray();
        JSONArray metrics = new JSONArray();
        JSONArray raw = new JSONArray();
        for (ScoreRecord r : records) {
            weeks.put(r.weekEnding == null ? JSONObject.NULL : r.weekEnding.toString());
            health.put(r.healthScore);
            confidence.put(r.confidenceScore);
            trend.put(r.trendDelta);
            contributions.put(roundedMap(r.contributions));
            metrics.put(metricArray(r));
            raw.put(toJson(r.raw));
        }
        JSONObject out = new JSONObject();
        out.put("project_id", safe(projectId));
        out.put("project_name", safe(records.get(0).projectName));
        out.put("weeks", weeks);
        out.put("health", health);
        out.put("confidence", confidence);
        out.put("trend", trend);
        out.put("contributions_by_week", contributions);
        out.put("metrics_by_week", metrics);
        out.put("raw_by_week", raw);
        return out;
    }

    // JSONObject keys are unordered; this array keeps the scheme's label order
    private JSONArray metricArray(ScoreRecord record) {
        JSONArray out = new JSONArray();
        if (record.contributions == null) {
            return out;
        }
        for (Map.Entry<String, Double> entry : record.contributions.entrySet()) {
            Double max = record.maxContributions == null ? null : record.maxContributions.get(entry.getKey());
            out.put(new JSONObject()
                    .put("label", entry.getKey())
                    .put("points", entry.getValue() == null ? JSONObject.NULL : round2(entry.getValue()))
                    .put("max_points", max == null ? JSONObject.NULL : round2(max)));
        }
        return out;
    }

    private JSONObject roundedMap(Map<String, Double> values) {
        JSONObject out = new JSONObject();
        if (values == null) {
            return out;
        }
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            out.put(entry.getKey(), entry.getValue() == null ? JSONObject.NULL : round2(entry.getValue()));
        }
        return out;
    }

    // org.json drops null map values, so nested maps are copied key by key
    private JSONObject toJson(Map<String, Object> values) {
        JSONObject out = new JSONObject();
        if (values == null) {
            return out;
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            out.put(entry.getKey(), toJsonValue(entry.getValue()));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private Object toJsonValue(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Map<?, ?> map) {
            return toJson((Map<String, Object>) map);
        }
        if (value instanceof Collection<?> list) {
            JSONArray array = new JSONArray();
            for (Object item : list) {
                array.put(toJsonValue(item));
            }
            return array;
        }
        return value;
    }

    private String safe(String value) {
        return value == null ? "" : value.trim();
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
