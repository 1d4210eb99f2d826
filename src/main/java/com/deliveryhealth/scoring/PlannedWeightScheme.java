package com.deliveryhealth.scoring;

import com.deliveryhealth.model.DeliveryFramework;

import java.util.ArrayList;
import java.util.List;

/**
 * Schedule-driven projects. Schedule and quality weights grow with completion proximity while
 * unplanned work and dependency weights shrink.
 */
public final class PlannedWeightScheme implements WeightScheme {
    static final double W_CPI = 0.08;
    static final double W_SPI = 0.08;
    static final double W_MILESTONES = 0.06;

    @Override
    public DeliveryFramework framework() {
        return DeliveryFramework.PLANNED;
    }

    @Override
    public List<MetricTerm> terms(WeekSignals s, MetricNormalizer n, double p) {
        List<MetricTerm> terms = new ArrayList<>();
        terms.add(new MetricTerm(MetricLabels.SCHEDULE_VARIANCE, 0.12 + 0.08 * p, n.scheduleVariance(s.schedVar)));
        if (s.slipDays.isPresent()) {
            terms.add(new MetricTerm(MetricLabels.FORECAST_SLIP, 0.10 + 0.08 * p, n.forecastSlip(s.slipDays.getAsDouble())));
        }
        terms.add(new MetricTerm(MetricLabels.BACKLOG_GROWTH, 0.10, n.netBacklog(s.netBacklog)));
        terms.add(new MetricTerm(MetricLabels.REQ_CHURN, 0.08, n.requirementsChurn(s.requirementsChanged)));
        terms.add(new MetricTerm(MetricLabels.DEFECT_ESCAPE, 0.10 + 0.05 * p, n.defectEscape(s.defectEscapeRate)));
        terms.add(new MetricTerm(MetricLabels.CRITICAL_DEFECTS, 0.10 + 0.03 * p, n.criticalRatio(s.criticalRatio)));
        terms.add(new MetricTerm(MetricLabels.TEAM_CHURN, 0.08, n.teamChurnRatio(s.churnRatio)));
        terms.add(new MetricTerm(MetricLabels.BLOCKED_DAYS, 0.08, n.blockedDays(s.blockedDays)));
        terms.add(new MetricTerm(MetricLabels.UNPLANNED_WORK, 0.10 - 0.04 * p, n.unplannedRatio(s.unplannedRatio)));
        terms.add(new MetricTerm(MetricLabels.DEPENDENCIES, 0.06 - 0.03 * p, n.dependencies(s.dependencyCount)));

        if (s.hasEvm()) {
            terms.add(new MetricTerm(MetricLabels.CPI, W_CPI, n.cpi(s.cpi.getAsDouble())));
            terms.add(new MetricTerm(MetricLabels.SPI, W_SPI, n.spi(s.spi.getAsDouble())));
        }
        if (s.hasMilestones()) {
            terms.add(new MetricTerm(MetricLabels.MILESTONES, W_MILESTONES, n.milestoneRate(s.milestoneRate.getAsDouble())));
        }
        return List.copyOf(terms);
    }

    @Override
    public VolatilityProfile volatilityProfile() {
        return VolatilityProfile.SLIP;
    }

    @Override
    public double slipPenaltyRate() {
        return 0.25;
    }
}
