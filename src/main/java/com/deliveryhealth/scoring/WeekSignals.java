package com.deliveryhealth.scoring;

import com.deliveryhealth.model.DeliveryFramework;
import com.deliveryhealth.model.WeeklySnapshot;

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Quantities derived from one snapshot. Optional quantities stay empty when their inputs are
 * missing or unusable (zero cost, zero planned milestones, missing dates).
 */
public final class WeekSignals {
    public final DeliveryFramework framework;
    public final double actualPct;
    public final double plannedPct;
    public final double schedVar;
    public final OptionalDouble slipDays;
    public final double netBacklog;
    public final double requirementsChanged;
    public final double defectEscapeRate;
    public final double criticalDefects;
    public final double criticalRatio;
    public final double teamChurn;
    public final double churnRatio;
    public final double blockedDays;
    public final double unplannedRatio;
    public final double dependencyCount;

    public final OptionalDouble cpi;
    public final OptionalDouble spi;
    public final OptionalDouble milestoneRate;
    public final OptionalDouble risksOpen;
    public final OptionalDouble risksHigh;
    public final OptionalDouble throughput;
    public final OptionalDouble throughputRatio;
    public final OptionalDouble cycleTimeDays;
    public final OptionalDouble wipCurrent;
    public final OptionalDouble wipLimit;
    public final OptionalDouble wipOverage;
    public final OptionalDouble agingWip;

    private WeekSignals(WeeklySnapshot s, List<Double> throughputWindow) {
        this.framework = DeliveryFramework.orDefault(s.deliveryFramework);
        this.actualPct = s.actualPercentComplete;
        this.plannedPct = s.plannedPercentComplete;
        this.schedVar = s.actualPercentComplete - s.plannedPercentComplete;
        this.slipDays = s.plannedEndDate != null && s.forecastEndDate != null
                ? OptionalDouble.of(ChronoUnit.DAYS.between(s.plannedEndDate, s.forecastEndDate))
                : OptionalDouble.empty();
        this.netBacklog = s.backlogItemsAdded - s.backlogItemsClosed;
        this.requirementsChanged = s.requirementsChanged;
        this.defectEscapeRate = s.defectEscapeRate;
        this.criticalDefects = s.defectsOpenCritical;
        double team = Math.max(1.0, s.teamSize);
        this.criticalRatio = s.defectsOpenCritical / team;
        this.teamChurn = s.teamChurn;
        this.churnRatio = s.teamChurn / team;
        this.blockedDays = s.blockedDays;
        this.unplannedRatio = s.unplannedWorkRatio;
        this.dependencyCount = s.dependencyCount;

        boolean hasEvm = positive(s.plannedCostToDate) && positive(s.actualCostToDate);
        if (hasEvm) {
            double spiValue = s.actualPercentComplete / Math.max(MetricNormalizer.MIN_DENOMINATOR, s.plannedPercentComplete);
            double earnedValue = spiValue * s.plannedCostToDate;
            this.spi = OptionalDouble.of(spiValue);
            this.cpi = OptionalDouble.of(earnedValue / s.actualCostToDate);
        } else {
            this.spi = OptionalDouble.empty();
            this.cpi = OptionalDouble.empty();
        }

        this.milestoneRate = positive(s.milestonesPlanned) && s.milestonesHit != null
                ? OptionalDouble.of(s.milestonesHit / s.milestonesPlanned)
                : OptionalDouble.empty();
        this.risksOpen = optional(s.risksOpen);
        this.risksHigh = optional(s.risksHigh);

        this.throughput = optional(s.throughput);
        this.throughputRatio = this.throughput.isPresent() && throughputWindow != null && !throughputWindow.isEmpty()
                ? OptionalDouble.of(MetricNormalizer.rollingRatio(throughputWindow))
                : OptionalDouble.empty();
        this.cycleTimeDays = optional(s.cycleTimeDays);
        this.wipCurrent = optional(s.wipCurrent);
        this.wipLimit = optional(s.wipLimit);
        this.wipOverage = this.wipCurrent.isPresent() && this.wipLimit.isPresent()
                ? OptionalDouble.of(Math.max(0.0, s.wipCurrent - s.wipLimit) / Math.max(1.0, s.wipLimit))
                : OptionalDouble.empty();
        this.agingWip = optional(s.agingWipItems);
    }

    /**
     * @param throughputWindow present throughput observations ending with this week's value, or
     *                         empty when this week has none
     */
    public static WeekSignals derive(WeeklySnapshot snapshot, List<Double> throughputWindow) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot is required");
        }
        return new WeekSignals(snapshot, throughputWindow);
    }

    public boolean hasEvm() {
        return cpi.isPresent();
    }

    public boolean hasMilestones() {
        return milestoneRate.isPresent();
    }

    private static boolean positive(Double value) {
        return value != null && Double.isFinite(value) && value > 0.0;
    }

    private static OptionalDouble optional(Double value) {
        return value == null || !Double.isFinite(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
