package com.biomirror.common.model;

/**
 * Combined quality of a fused state, derived from face detection quality and the
 * physiological quality index.
 */
public enum DataQuality {
    INVALID,
    POOR,
    FAIR,
    GOOD,
    EXCELLENT;

    /** Safety decisions are never made on states at or below this quality. */
    public boolean isUnreliable() {
        return this == INVALID || this == POOR;
    }
}
