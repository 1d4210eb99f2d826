package com.deliveryhealth.scoring;

import com.deliveryhealth.model.DeliveryFramework;

import java.util.List;

/**
 * Metric set and nominal weights for one delivery framework.
 */
public interface WeightScheme {

    DeliveryFramework framework();

    /**
     * Active terms for one week in a stable order. Gated metrics are left out entirely when their
     * data is absent.
     */
    List<MetricTerm> terms(WeekSignals signals, MetricNormalizer normalizer, double proximity);

    VolatilityProfile volatilityProfile();

    /** Confidence points per day of forecast slip. */
    double slipPenaltyRate();
}
