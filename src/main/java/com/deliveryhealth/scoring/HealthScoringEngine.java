package com.deliveryhealth.scoring;

import com.deliveryhealth.config.ThresholdConfig;
import com.deliveryhealth.model.DeliveryFramework;
import com.deliveryhealth.model.ScoreRecord;
import com.deliveryhealth.model.ScoringResult;
import com.deliveryhealth.model.WeeklySnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Turns each project's chronologically ordered snapshots into per-week health and confidence
 * scores. Stateless; safe to share across threads.
 */
public final class HealthScoringEngine {
    private static final Logger LOG = LogManager.getLogger(HealthScoringEngine.class);

    static final double CHURN_PENALTY_PER_CHANGE = 1.0;
    static final double BACKLOG_PENALTY_PER_ITEM = 0.5;

    static final String DRIVER_CHURN = "requirements churn";
    static final String DRIVER_BACKLOG = "backlog growth";
    static final String DRIVER_SLIP = "schedule slip";

    private static final Comparator<WeeklySnapshot> BY_WEEK = Comparator.comparing(
            (WeeklySnapshot s) -> s.weekEnding,
            Comparator.nullsLast(Comparator.naturalOrder())
    );

    private final WeightAllocator allocator;
    private final VolatilityPenaltyEngine volatilityEngine;

    public HealthScoringEngine() {
        this(new WeightAllocator(), new VolatilityPenaltyEngine());
    }

    public HealthScoringEngine(WeightAllocator allocator, VolatilityPenaltyEngine volatilityEngine) {
        this.allocator = allocator;
        this.volatilityEngine = volatilityEngine;
    }

    /**
     * Scores every project in {@code snapshots}. A project that fails is logged and reported in
     * {@link ScoringResult#failures}; the remaining projects are still scored.
     */
    public ScoringResult score(List<WeeklySnapshot> snapshots, ThresholdConfig thresholds) {
        Map<String, List<WeeklySnapshot>> groups = groupByProject(snapshots);
        Map<String, List<ScoreRecord>> series = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<String, List<WeeklySnapshot>> entry : groups.entrySet()) {
            try {
                series.put(entry.getKey(), scoreProject(entry.getKey(), entry.getValue(), thresholds));
            } catch (RuntimeException e) {
                LOG.error("project scoring failed project_id={} rows={} err={}",
                        entry.getKey(), entry.getValue().size(), e.toString(), e);
                failures.put(entry.getKey(), describe(e));
            }
        }
        LOG.debug("scored projects={} failed={}", series.size(), failures.size());
        return new ScoringResult(series, failures);
    }

    /**
     * Scores one project's series. Rows are re-ordered by week; rolling windows only ever look at
     * weeks at or before the current one.
     *
     * @throws IllegalArgumentException when {@code rows} is empty
     */
    public List<ScoreRecord> scoreProject(String projectId, List<WeeklySnapshot> rows, ThresholdConfig thresholds) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("project group has no rows: " + projectId);
        }
        MetricNormalizer normalizer = new MetricNormalizer(thresholds);
        List<WeeklySnapshot> ordered = new ArrayList<>(rows);
        ordered.sort(BY_WEEK);

        List<Double> slipHistory = new ArrayList<>();
        List<Double> throughputHistory = new ArrayList<>();
        List<ScoreRecord> records = new ArrayList<>(ordered.size());
        Double previousHealth = null;

        for (WeeklySnapshot row : ordered) {
            List<Double> throughputWindow = List.of();
            if (row.throughput != null && Double.isFinite(row.throughput)) {
                throughputHistory.add(row.throughput);
                throughputWindow = VolatilityPenaltyEngine.tail(throughputHistory, MetricNormalizer.THROUGHPUT_WINDOW);
            }
            WeekSignals signals = WeekSignals.derive(row, throughputWindow);
            signals.slipDays.ifPresent(slipHistory::add);

            WeightScheme scheme = allocator.schemeFor(signals.framework);
            double proximity = WeightAllocator.proximity(signals.actualPct);
            List<MetricTerm> terms = scheme.terms(signals, normalizer, proximity);
            List<WeightedContribution> weighted = allocator.allocate(terms);

            double health = 0.0;
            Map<String, Double> contributions = new LinkedHashMap<>();
            Map<String, Double> maxContributions = new LinkedHashMap<>();
            for (WeightedContribution c : weighted) {
                contributions.put(c.label(), c.points());
                maxContributions.put(c.label(), c.maxPoints());
                health += c.points();
            }
            health = round1(MetricNormalizer.clamp(health, 0.0, 100.0));

            VolatilityProfile profile = scheme.volatilityProfile();
            VolatilityBreakdown volatility = volatilityEngine.evaluate(
                    profile == VolatilityProfile.SLIP ? slipHistory : throughputHistory,
                    profile
            );
            ConfidencePenalties penalties = confidencePenalties(signals, scheme, volatility);
            double confidence = round1(MetricNormalizer.clamp(100.0 - penalties.total(), 0.0, 100.0));

            double trend = trendDelta(previousHealth, health);
            previousHealth = health;

            records.add(ScoreRecord.builder()
                    .projectId(projectId)
                    .projectName(row.projectName)
                    .weekEnding(row.weekEnding)
                    .deliveryFramework(signals.framework)
                    .healthScore(health)
                    .confidenceScore(confidence)
                    .trendDelta(trend)
                    .contributions(Collections.unmodifiableMap(contributions))
                    .maxContributions(Collections.unmodifiableMap(maxContributions))
                    .confidenceDrivers(penalties.drivers(profile))
                    .raw(buildRaw(signals, proximity, terms, weighted, volatility, penalties))
                    .build());
        }
        return List.copyOf(records);
    }

    /**
     * Health change against the previous week of the same project; 0 for the first week.
     */
    public static double trendDelta(Double previousHealth, double currentHealth) {
        if (previousHealth == null) {
            return 0.0;
        }
        return round1(currentHealth - previousHealth);
    }

    /**
     * Groups rows by project id, keeping the order in which projects first appear.
     */
    public static Map<String, List<WeeklySnapshot>> groupByProject(List<WeeklySnapshot> snapshots) {
        Map<String, List<WeeklySnapshot>> groups = new LinkedHashMap<>();
        if (snapshots == null) {
            return groups;
        }
        for (WeeklySnapshot s : snapshots) {
            if (s == null) {
                continue;
            }
            String key = s.projectId == null ? "" : s.projectId.trim();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(s);
        }
        return groups;
    }

    private ConfidencePenalties confidencePenalties(WeekSignals signals, WeightScheme scheme, VolatilityBreakdown volatility) {
        double churn = Math.max(0.0, signals.requirementsChanged) * CHURN_PENALTY_PER_CHANGE;
        double backlog = Math.max(0.0, signals.netBacklog) * BACKLOG_PENALTY_PER_ITEM;
        double slip = 0.0;
        if (signals.slipDays.isPresent()) {
            slip = Math.max(0.0, signals.slipDays.getAsDouble()) * scheme.slipPenaltyRate();
        }
        return new ConfidencePenalties(volatility.penalty, churn, backlog, slip);
    }

    private Map<String, Object> buildRaw(
            WeekSignals s,
            double proximity,
            List<MetricTerm> terms,
            List<WeightedContribution> weighted,
            VolatilityBreakdown volatility,
            ConfidencePenalties penalties
    ) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("framework", s.framework.tag());
        raw.put("pct_complete", round1(s.actualPct * 100.0));
        raw.put("planned_pct", round1(s.plannedPct * 100.0));
        raw.put("sched_var_pct", round1(s.schedVar * 100.0));
        raw.put("proximity_pct", round1(proximity * 100.0));
        raw.put("slip_days", boxed(s.slipDays));
        raw.put("net_backlog", s.netBacklog);
        raw.put("req_churn", s.requirementsChanged);
        raw.put("defect_escape_pct", round1(s.defectEscapeRate * 100.0));
        raw.put("critical_defects", s.criticalDefects);
        raw.put("team_churn", s.teamChurn);
        raw.put("blocked_days", s.blockedDays);
        raw.put("unplanned_pct", round1(s.unplannedRatio * 100.0));
        raw.put("dependencies", s.dependencyCount);
        raw.put("cpi", round3(s.cpi));
        raw.put("spi", round3(s.spi));
        raw.put("milestone_rate", round3(s.milestoneRate));
        raw.put("risks_open", boxed(s.risksOpen));
        raw.put("risks_high", boxed(s.risksHigh));
        raw.put("throughput", boxed(s.throughput));
        raw.put("throughput_ratio", round3(s.throughputRatio));
        raw.put("cycle_time_days", boxed(s.cycleTimeDays));
        raw.put("wip_current", boxed(s.wipCurrent));
        raw.put("wip_limit", boxed(s.wipLimit));
        raw.put("wip_overage", round3(s.wipOverage));
        raw.put("aging_wip", boxed(s.agingWip));

        Map<String, Double> normalized = new LinkedHashMap<>();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (WeightedContribution c : weighted) {
            normalized.put(c.label(), c.normalized());
            weights.put(c.label(), c.weight());
        }
        raw.put("normalized", Collections.unmodifiableMap(normalized));
        raw.put("weights", Collections.unmodifiableMap(weights));
        raw.put("nominal_weight_total", WeightAllocator.nominalTotal(terms));
        raw.put("volatility", Collections.unmodifiableMap(volatility.toMap()));
        raw.put("penalties", Collections.unmodifiableMap(penalties.toMap()));
        return Collections.unmodifiableMap(raw);
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static Double round3(OptionalDouble value) {
        return value.isPresent() ? Math.round(value.getAsDouble() * 1000.0) / 1000.0 : null;
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    static final class ConfidencePenalties {
        final double volatility;
        final double churn;
        final double backlog;
        final double slip;

        ConfidencePenalties(double volatility, double churn, double backlog, double slip) {
            this.volatility = volatility;
            this.churn = churn;
            this.backlog = backlog;
            this.slip = slip;
        }

        double total() {
            return volatility + churn + backlog + slip;
        }

        /** Labels of the non-zero penalties, largest first; ties keep declaration order. */
        List<String> drivers(VolatilityProfile profile) {
            List<Map.Entry<String, Double>> entries = new ArrayList<>();
            entries.add(Map.entry(profile.driverLabel, volatility));
            entries.add(Map.entry(DRIVER_CHURN, churn));
            entries.add(Map.entry(DRIVER_BACKLOG, backlog));
            entries.add(Map.entry(DRIVER_SLIP, slip));
            entries.removeIf(e -> !(e.getValue() > 0.0));
            entries.sort(Map.Entry.<String, Double>comparingByValue().reversed());
            List<String> out = new ArrayList<>(entries.size());
            for (Map.Entry<String, Double> e : entries) {
                out.add(e.getKey());
            }
            return List.copyOf(out);
        }

        Map<String, Object> toMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("volatility", round2(volatility));
            out.put("churn", round2(churn));
            out.put("backlog", round2(backlog));
            out.put("slip", round2(slip));
            out.put("total", round2(total()));
            return out;
        }

        private static double round2(double value) {
            return Math.round(value * 100.0) / 100.0;
        }
    }
}
