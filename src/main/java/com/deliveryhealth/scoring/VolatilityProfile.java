package com.deliveryhealth.scoring;

/**
 * Per-quantity constants for the directional volatility penalty.
 */
public enum VolatilityProfile {
    /** Forecast slip in days. Increasing is bad. */
    SLIP(10.0, 7.0, true, "forecast volatility"),
    /** Items finished per week. Increasing is good. */
    THROUGHPUT(1.0, 3.0, false, "throughput volatility");

    public final double referenceFloor;
    public final double directionScale;
    public final boolean increasingIsBad;
    public final String driverLabel;

    VolatilityProfile(double referenceFloor, double directionScale, boolean increasingIsBad, String driverLabel) {
        this.referenceFloor = referenceFloor;
        this.directionScale = directionScale;
        this.increasingIsBad = increasingIsBad;
        this.driverLabel = driverLabel;
    }
}
