package com.deliveryhealth.scoring;

import com.deliveryhealth.config.ThresholdConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricNormalizerTest {

    private final MetricNormalizer normalizer = new MetricNormalizer(ThresholdConfig.defaultConfig());

    @Test
    void ratio_shouldBeLinearBetweenFloorAndParity() {
        assertEquals(0.0, MetricNormalizer.ratio(0.7, 0.8, 1.0), 1e-12);
        assertEquals(0.5, MetricNormalizer.ratio(0.9, 0.8, 1.0), 1e-12);
        assertEquals(1.0, MetricNormalizer.ratio(1.3, 0.8, 1.0), 1e-12);
    }

    @Test
    void penalty_shouldTreatNegativeAsHealthy() {
        assertEquals(1.0, MetricNormalizer.penalty(-12.0, 50.0), 1e-12);
        assertEquals(0.5, MetricNormalizer.penalty(25.0, 50.0), 1e-12);
        assertEquals(0.0, MetricNormalizer.penalty(80.0, 50.0), 1e-12);
    }

    @Test
    void scheduleVariance_shouldUseParityZero() {
        assertEquals(1.0, normalizer.scheduleVariance(0.0), 1e-12);
        assertEquals(1.0, normalizer.scheduleVariance(0.05), 1e-12);
        assertEquals(0.75, normalizer.scheduleVariance(-0.05), 1e-12);
        assertEquals(0.0, normalizer.scheduleVariance(-0.25), 1e-12);
    }

    @Test
    void forecastSlip_shouldFollowConfiguredMaximum() {
        assertEquals(0.5, normalizer.forecastSlip(70.0), 1e-12);

        MetricNormalizer strict = new MetricNormalizer(ThresholdConfig.defaultConfig()
                .withOverrides(Map.of(ThresholdConfig.SLIP_DAYS_MAX, "70")));
        assertEquals(0.0, strict.forecastSlip(70.0), 1e-12);
    }

    @Test
    void evmAndFlowMappings_shouldSaturate() {
        assertEquals(1.0, normalizer.cpi(1.1), 1e-12);
        assertEquals(0.5, normalizer.spi(0.9), 1e-12);
        assertEquals(0.0, normalizer.milestoneRate(0.4), 1e-12);
        assertEquals(0.0, normalizer.throughputRatio(0.5), 1e-12);
        assertEquals(0.75, normalizer.cycleTime(5.0), 1e-12);
        assertEquals(1.0, normalizer.wipOverage(0.0), 1e-12);
        assertEquals(0.4, normalizer.agingWip(3.0), 1e-12);
    }

    @Test
    void rollingRatio_shouldDivideCurrentByWindowMean() {
        assertEquals(1.0, MetricNormalizer.rollingRatio(List.of(10.0, 10.0, 10.0, 10.0)), 1e-12);
        assertEquals(0.5, MetricNormalizer.rollingRatio(List.of(15.0, 5.0)), 1e-12);
        assertEquals(0.0, MetricNormalizer.rollingRatio(List.of(0.0, 0.0)), 1e-12);
        assertEquals(1.0, MetricNormalizer.rollingRatio(List.of()), 1e-12);
    }

    @Test
    void clamp_shouldMapNaNToMinimum() {
        assertEquals(0.0, MetricNormalizer.clamp(Double.NaN, 0.0, 1.0), 1e-12);
        assertEquals(1.0, MetricNormalizer.clamp(Double.POSITIVE_INFINITY, 0.0, 1.0), 1e-12);
        assertEquals(0.3, MetricNormalizer.clamp(0.3, 0.0, 1.0), 1e-12);
    }

    @Test
    void everyMapping_shouldStayWithinUnitInterval() {
        List<Double> inputs = Arrays.asList(-1e9, -5.0, -0.3, 0.0, 0.2, 0.99, 1.0, 3.0, 500.0, 1e9);
        for (double v : inputs) {
            for (double n : new double[]{
                    normalizer.scheduleVariance(v), normalizer.forecastSlip(v), normalizer.netBacklog(v),
                    normalizer.requirementsChurn(v), normalizer.defectEscape(v), normalizer.criticalRatio(v),
                    normalizer.teamChurnRatio(v), normalizer.blockedDays(v), normalizer.unplannedRatio(v),
                    normalizer.dependencies(v), normalizer.cpi(v), normalizer.spi(v), normalizer.milestoneRate(v),
                    normalizer.throughputRatio(v), normalizer.cycleTime(v),
                    normalizer.wipOverage(v), normalizer.agingWip(v)}) {
                assertTrue(n >= 0.0 && n <= 1.0, "value " + v + " mapped to " + n);
            }
        }
    }
}
