package com.biomirror.common.safety;

/**
 * Totally ordered alert level. Within an escalation episode the level only rises.
 */
public enum AlertLevel {

    NONE,

    /** Flag for therapist review only. */
    LOW,

    /** Calming intervention; guardian notified once the session is past the grace period. */
    MEDIUM,

    /** Session termination and immediate guardian notification. */
    HIGH;

    public boolean isHigherThan(AlertLevel other) {
        return compareTo(other) > 0;
    }
}
