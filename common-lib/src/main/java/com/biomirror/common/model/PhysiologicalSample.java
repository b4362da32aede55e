package com.biomirror.common.model;

import java.time.Instant;

/**
 * One physiological reading delivered by the biometric collaborator. HRV and
 * arousal are computed upstream; this type only carries the results.
 */
public record PhysiologicalSample(
    Instant timestamp,
    HeartRateMetrics heartRate,
    ElectrodermalMetrics electrodermal,
    MotionMetrics motion,
    RespirationMetrics respiration,
    double arousalLevel,
    double qualityIndex
) {

    /** SDNN at or above this value (ms) normalizes to 1.0. */
    public static final double HRV_NORMALIZATION_CEILING = 100.0;

    /** Heart rate variability (SDNN) mapped onto [0,1]. */
    public double normalizedHrv() {
        return Math.min(HRV_NORMALIZATION_CEILING, heartRate.sdnn()) / HRV_NORMALIZATION_CEILING;
    }

    public record HeartRateMetrics(double heartRate, double sdnn, double rmssd, double pnn50, double quality) {}

    public record ElectrodermalMetrics(double skinConductanceLevel, int responseCount,
                                       double peakAmplitude, double quality) {}

    public record MotionMetrics(Vector3 acceleration, Vector3 rotationRate,
                                double tremor, double freezeIndex, double quality) {}

    public record RespirationMetrics(double rate, double irregularity, double depth, double quality) {}

    public record Vector3(double x, double y, double z) {
        public static final Vector3 ZERO = new Vector3(0, 0, 0);
    }
}
