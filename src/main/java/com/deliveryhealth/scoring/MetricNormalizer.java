package com.deliveryhealth.scoring;

import com.deliveryhealth.config.ThresholdConfig;

import java.util.List;

/**
 * Maps raw signals to a [0,1] healthiness value, 1 being healthy. All mappings are linear and
 * saturate at both ends.
 */
public final class MetricNormalizer {
    public static final int THROUGHPUT_WINDOW = 4;
    static final double MIN_DENOMINATOR = 0.01;

    private final double schedVarFloor;
    private final double slipDaysMax;
    private final double netBacklogMax;
    private final double reqChurnMax;
    private final double defectEscapeMax;
    private final double criticalRatioMax;
    private final double teamChurnRatioMax;
    private final double blockedDaysMax;
    private final double unplannedRatioMax;
    private final double dependencyMax;
    private final double cpiFloor;
    private final double spiFloor;
    private final double milestoneFloor;
    private final double throughputFloor;
    private final double cycleTimeMax;
    private final double wipOverageMax;
    private final double agingWipMax;

    public MetricNormalizer(ThresholdConfig thresholds) {
        ThresholdConfig t = thresholds == null ? ThresholdConfig.defaultConfig() : thresholds;
        this.schedVarFloor = t.get(ThresholdConfig.SCHED_VAR_FLOOR);
        this.slipDaysMax = t.get(ThresholdConfig.SLIP_DAYS_MAX);
        this.netBacklogMax = t.get(ThresholdConfig.NET_BACKLOG_MAX);
        this.reqChurnMax = t.get(ThresholdConfig.REQ_CHURN_MAX);
        this.defectEscapeMax = t.get(ThresholdConfig.DEFECT_ESCAPE_MAX);
        this.criticalRatioMax = t.get(ThresholdConfig.CRITICAL_RATIO_MAX);
        this.teamChurnRatioMax = t.get(ThresholdConfig.TEAM_CHURN_RATIO_MAX);
        this.blockedDaysMax = t.get(ThresholdConfig.BLOCKED_DAYS_MAX);
        this.unplannedRatioMax = t.get(ThresholdConfig.UNPLANNED_RATIO_MAX);
        this.dependencyMax = t.get(ThresholdConfig.DEPENDENCY_MAX);
        this.cpiFloor = t.get(ThresholdConfig.CPI_FLOOR);
        this.spiFloor = t.get(ThresholdConfig.SPI_FLOOR);
        this.milestoneFloor = t.get(ThresholdConfig.MILESTONE_FLOOR);
        this.throughputFloor = t.get(ThresholdConfig.THROUGHPUT_FLOOR);
        this.cycleTimeMax = t.get(ThresholdConfig.CYCLE_TIME_MAX);
        this.wipOverageMax = t.get(ThresholdConfig.WIP_OVERAGE_MAX);
        this.agingWipMax = t.get(ThresholdConfig.AGING_WIP_MAX);
    }

    public double scheduleVariance(double schedVar) {
        return ratio(schedVar, schedVarFloor, 0.0);
    }

    public double forecastSlip(double slipDays) {
        return penalty(slipDays, slipDaysMax);
    }

    public double netBacklog(double netBacklog) {
        return penalty(netBacklog, netBacklogMax);
    }

    public double requirementsChurn(double changed) {
        return penalty(changed, reqChurnMax);
    }

    public double defectEscape(double rate) {
        return penalty(rate, defectEscapeMax);
    }

    public double criticalRatio(double ratio) {
        return penalty(ratio, criticalRatioMax);
    }

    public double teamChurnRatio(double ratio) {
        return penalty(ratio, teamChurnRatioMax);
    }

    public double blockedDays(double days) {
        return penalty(days, blockedDaysMax);
    }

    public double unplannedRatio(double ratio) {
        return penalty(ratio, unplannedRatioMax);
    }

    public double dependencies(double count) {
        return penalty(count, dependencyMax);
    }

    public double cpi(double cpi) {
        return ratio(cpi, cpiFloor, 1.0);
    }

    public double spi(double spi) {
        return ratio(spi, spiFloor, 1.0);
    }

    public double milestoneRate(double rate) {
        return ratio(rate, milestoneFloor, 1.0);
    }

    public double throughputRatio(double ratio) {
        return ratio(ratio, throughputFloor, 1.0);
    }

    public double cycleTime(double days) {
        return penalty(days, cycleTimeMax);
    }

    public double wipOverage(double overage) {
        return penalty(overage, wipOverageMax);
    }

    public double agingWip(double items) {
        return penalty(items, agingWipMax);
    }

    /**
     * 0 at {@code floor}, 1 at {@code parity} or better.
     */
    public static double ratio(double value, double floor, double parity) {
        double span = parity - floor;
        if (span <= 0.0) {
            return value >= parity ? 1.0 : 0.0;
        }
        return clamp((value - floor) / span, 0.0, 1.0);
    }

    /**
     * 1 at zero badness, 0 at {@code max} or beyond. Negative values count as zero badness.
     */
    public static double penalty(double value, double max) {
        if (!(max > 0.0)) {
            return value > 0.0 ? 0.0 : 1.0;
        }
        return clamp(1.0 - Math.max(0.0, value) / max, 0.0, 1.0);
    }

    /**
     * Last value of {@code window} divided by the window mean. The window is expected to end with
     * the current observation.
     */
    public static double rollingRatio(List<Double> window) {
        if (window == null || window.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        for (Double v : window) {
            sum += v == null ? 0.0 : v;
        }
        double mean = sum / window.size();
        Double current = window.get(window.size() - 1);
        double value = current == null ? 0.0 : current;
        return value / Math.max(MIN_DENOMINATOR, mean);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value) || value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
