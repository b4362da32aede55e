package com.biomirror.common.fusion;

/**
 * Numeric helpers for unit-interval scores.
 */
public final class Scores {

    private Scores() {}

    /** Clamps {@code value} into [0,1]; NaN collapses to 0. */
    public static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
