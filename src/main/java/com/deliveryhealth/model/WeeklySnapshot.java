package com.deliveryhealth.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One project's status row for one week. Optional signals are {@code null} when the source did not
 * report them; they are never defaulted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class WeeklySnapshot {
    public final String projectId;
    public final String projectName;
    public final LocalDate weekEnding;
    public final LocalDate plannedEndDate;
    public final LocalDate forecastEndDate;
    public final DeliveryFramework deliveryFramework;

    public final double actualPercentComplete;
    public final double plannedPercentComplete;
    public final double backlogItemsAdded;
    public final double backlogItemsClosed;
    public final double requirementsChanged;
    public final double defectEscapeRate;
    public final double defectsOpenCritical;
    public final double teamSize;
    public final double teamChurn;
    public final double blockedDays;
    public final double unplannedWorkRatio;
    public final double dependencyCount;

    public final Double plannedCostToDate;
    public final Double actualCostToDate;
    public final Double milestonesPlanned;
    public final Double milestonesHit;
    public final Double risksOpen;
    public final Double risksHigh;
    public final Double throughput;
    public final Double cycleTimeDays;
    public final Double wipCurrent;
    public final Double wipLimit;
    public final Double agingWipItems;
}
