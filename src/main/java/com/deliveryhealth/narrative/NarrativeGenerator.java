package com.deliveryhealth.narrative;

import com.deliveryhealth.model.DeliveryFramework;
import com.deliveryhealth.model.Narrative;
import com.deliveryhealth.model.ScoreRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a templated explanation for one scored week. Presentation only: every number shown is
 * read from the record.
 */
public final class NarrativeGenerator {
    static final double GOOD_BAND = 75.0;
    static final double MODERATE_BAND = 50.0;
    static final double TREND_THRESHOLD = 1.0;
    static final double MIN_GAP = 0.05;

    public Narrative describe(ScoreRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record is required");
        }
        Map<String, Object> raw = record.raw == null ? Map.of() : record.raw;
        List<String> clauses = new ArrayList<>();

        String headline = opener(record);
        clauses.add(headline);
        trendClause(record.trendDelta).ifPresent(clauses::add);
        if (record.deliveryFramework == DeliveryFramework.KANBAN) {
            kanbanClauses(raw, clauses);
        } else {
            plannedClauses(raw, clauses);
        }
        clauses.add(confidenceClause(record));

        Optional<String> detractor = topDetractor(record.contributions, record.maxContributions);
        double gap = detractor.map(label -> gapOf(record, label)).orElse(0.0);
        if (detractor.isPresent()) {
            clauses.add(String.format(Locale.US, "The largest drag is %s, costing %.1f points.", detractor.get(), gap));
        } else {
            clauses.add("No single metric is holding the score back.");
        }

        return Narrative.builder()
                .headline(headline)
                .text(String.join(" ", clauses))
                .clauses(List.copyOf(clauses))
                .topDetractor(detractor.orElse(null))
                .topDetractorGap(gap)
                .topPerformer(topPerformer(record.contributions).orElse(null))
                .build();
    }

    /**
     * The label losing the most points against its maximum. The earliest label wins a tie; gaps
     * below {@value #MIN_GAP} points do not count.
     */
    public static Optional<String> topDetractor(Map<String, Double> contributions, Map<String, Double> maxContributions) {
        if (contributions == null || maxContributions == null) {
            return Optional.empty();
        }
        String best = null;
        double bestGap = MIN_GAP;
        for (Map.Entry<String, Double> entry : maxContributions.entrySet()) {
            double max = entry.getValue() == null ? 0.0 : entry.getValue();
            Double points = contributions.get(entry.getKey());
            double gap = max - (points == null ? 0.0 : points);
            if (best == null ? gap >= bestGap : gap > bestGap) {
                best = entry.getKey();
                bestGap = gap;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * The label contributing the most points. The earliest label wins a tie.
     */
    public static Optional<String> topPerformer(Map<String, Double> contributions) {
        if (contributions == null) {
            return Optional.empty();
        }
        String best = null;
        double bestPoints = 0.0;
        for (Map.Entry<String, Double> entry : contributions.entrySet()) {
            double points = entry.getValue() == null ? 0.0 : entry.getValue();
            if (best == null || points > bestPoints) {
                best = entry.getKey();
                bestPoints = points;
            }
        }
        return Optional.ofNullable(best);
    }

    private String opener(ScoreRecord record) {
        String name = record.projectName == null || record.projectName.isBlank()
                ? record.projectId
                : record.projectName;
        String band;
        if (record.healthScore >= GOOD_BAND) {
            band = "good";
        } else if (record.healthScore >= MODERATE_BAND) {
            band = "moderate";
        } else {
            band = "critical";
        }
        return String.format(Locale.US, "%s is in %s health (%.1f/100).", name, band, record.healthScore);
    }

    private Optional<String> trendClause(double delta) {
        if (delta >= TREND_THRESHOLD) {
            return Optional.of(String.format(Locale.US, "Health improved by %.1f points since last week.", delta));
        }
        if (delta <= -TREND_THRESHOLD) {
            return Optional.of(String.format(Locale.US, "Health declined by %.1f points since last week.", -delta));
        }
        return Optional.empty();
    }

    private void plannedClauses(Map<String, Object> raw, List<String> clauses) {
        Double schedVar = number(raw, "sched_var_pct");
        Double slip = number(raw, "slip_days");
        StringBuilder schedule = new StringBuilder();
        if (schedVar != null) {
            if (Math.abs(schedVar) < 0.5) {
                schedule.append("Progress is on plan");
            } else {
                schedule.append(String.format(Locale.US, "Progress is %.1f%% %s plan",
                        Math.abs(schedVar), schedVar > 0 ? "ahead of" : "behind"));
            }
        }
        if (slip != null) {
            schedule.append(schedule.length() == 0 ? "The forecast end date" : " and the forecast end date");
            if (slip > 0) {
                schedule.append(String.format(Locale.US, " has slipped %.0f days", slip));
            } else if (slip < 0) {
                schedule.append(String.format(Locale.US, " is %.0f days early", -slip));
            } else {
                schedule.append(" is holding");
            }
        }
        if (schedule.length() > 0) {
            clauses.add(schedule.append('.').toString());
        }

        Double cpi = number(raw, "cpi");
        Double spi = number(raw, "spi");
        if (cpi != null && spi != null) {
            clauses.add(String.format(Locale.US, "EVM shows CPI %.2f and SPI %.2f.", cpi, spi));
        }
        Double risksHigh = number(raw, "risks_high");
        if (risksHigh != null) {
            Double risksOpen = number(raw, "risks_open");
            if (risksOpen != null) {
                clauses.add(String.format(Locale.US, "%.0f high risks are open out of %.0f.", risksHigh, risksOpen));
            } else {
                clauses.add(String.format(Locale.US, "%.0f high risks are open.", risksHigh));
            }
        }
        Double milestones = number(raw, "milestone_rate");
        if (milestones != null) {
            clauses.add(String.format(Locale.US, "Milestone hit rate is %.0f%%.", milestones * 100.0));
        }
    }

    private void kanbanClauses(Map<String, Object> raw, List<String> clauses) {
        Double throughput = number(raw, "throughput");
        Double ratio = number(raw, "throughput_ratio");
        if (throughput != null && ratio != null) {
            clauses.add(String.format(Locale.US, "Throughput was %.0f items, %.0f%% of its recent average.",
                    throughput, ratio * 100.0));
        }
        Double cycle = number(raw, "cycle_time_days");
        if (cycle != null) {
            clauses.add(String.format(Locale.US, "Cycle time is %.1f days.", cycle));
        }
        Double wip = number(raw, "wip_current");
        Double limit = number(raw, "wip_limit");
        if (wip != null && limit != null) {
            Double aging = number(raw, "aging_wip");
            String agingText = aging == null ? "" : String.format(Locale.US, " with %.0f items aging", aging);
            clauses.add(String.format(Locale.US, "WIP is %.0f against a limit of %.0f%s.", wip, limit, agingText));
        }
        Double cpi = number(raw, "cpi");
        if (cpi != null) {
            clauses.add(String.format(Locale.US, "Cost performance index is %.2f.", cpi));
        }
    }

    private String confidenceClause(ScoreRecord record) {
        String level;
        if (record.confidenceScore >= GOOD_BAND) {
            level = "high";
        } else if (record.confidenceScore >= MODERATE_BAND) {
            level = "moderate";
        } else {
            level = "low";
        }
        List<String> drivers = record.confidenceDrivers == null ? List.of() : record.confidenceDrivers;
        if (drivers.isEmpty()) {
            return String.format(Locale.US, "Forecast confidence is %s (%.1f/100).", level, record.confidenceScore);
        }
        return String.format(Locale.US, "Forecast confidence is %s (%.1f/100), held back by %s.",
                level, record.confidenceScore, String.join(", ", drivers));
    }

    private static double gapOf(ScoreRecord record, String label) {
        Double max = record.maxContributions.get(label);
        Double points = record.contributions.get(label);
        return (max == null ? 0.0 : max) - (points == null ? 0.0 : points);
    }

    private static Double number(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }
}
