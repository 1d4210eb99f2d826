package com.deliveryhealth.scoring;

import com.deliveryhealth.model.DeliveryFramework;

import java.util.ArrayList;
import java.util.List;

/**
 * Flow-driven projects. Fixed weights; proximity is ignored.
 */
public final class KanbanWeightScheme implements WeightScheme {

    @Override
    public DeliveryFramework framework() {
        return DeliveryFramework.KANBAN;
    }

    @Override
    public List<MetricTerm> terms(WeekSignals s, MetricNormalizer n, double proximity) {
        List<MetricTerm> terms = new ArrayList<>();
        if (s.throughputRatio.isPresent()) {
            terms.add(new MetricTerm(MetricLabels.THROUGHPUT, 0.18, n.throughputRatio(s.throughputRatio.getAsDouble())));
        }
        if (s.cycleTimeDays.isPresent()) {
            terms.add(new MetricTerm(MetricLabels.CYCLE_TIME, 0.14, n.cycleTime(s.cycleTimeDays.getAsDouble())));
        }
        if (s.wipOverage.isPresent()) {
            terms.add(new MetricTerm(MetricLabels.WIP_ADHERENCE, 0.10, n.wipOverage(s.wipOverage.getAsDouble())));
        }
        if (s.agingWip.isPresent()) {
            terms.add(new MetricTerm(MetricLabels.AGING_WIP, 0.10, n.agingWip(s.agingWip.getAsDouble())));
        }
        terms.add(new MetricTerm(MetricLabels.BACKLOG_GROWTH, 0.08, n.netBacklog(s.netBacklog)));
        terms.add(new MetricTerm(MetricLabels.REQ_CHURN, 0.06, n.requirementsChurn(s.requirementsChanged)));
        terms.add(new MetricTerm(MetricLabels.DEFECT_ESCAPE, 0.10, n.defectEscape(s.defectEscapeRate)));
        terms.add(new MetricTerm(MetricLabels.CRITICAL_DEFECTS, 0.08, n.criticalRatio(s.criticalRatio)));
        terms.add(new MetricTerm(MetricLabels.TEAM_CHURN, 0.06, n.teamChurnRatio(s.churnRatio)));
        terms.add(new MetricTerm(MetricLabels.BLOCKED_DAYS, 0.06, n.blockedDays(s.blockedDays)));

        if (s.hasEvm()) {
            terms.add(new MetricTerm(MetricLabels.CPI, 0.06, n.cpi(s.cpi.getAsDouble())));
        }
        if (s.hasMilestones()) {
            terms.add(new MetricTerm(MetricLabels.MILESTONES, 0.04, n.milestoneRate(s.milestoneRate.getAsDouble())));
        }
        if (s.slipDays.isPresent()) {
            terms.add(new MetricTerm(MetricLabels.FORECAST_SLIP, 0.06, n.forecastSlip(s.slipDays.getAsDouble())));
        }
        return List.copyOf(terms);
    }

    @Override
    public VolatilityProfile volatilityProfile() {
        return VolatilityProfile.THROUGHPUT;
    }

    @Override
    public double slipPenaltyRate() {
        return 0.15;
    }
}
