package com.biomirror.common.safety;

/**
 * Side effect requested by the safety layer. Executed by the orchestration layer,
 * never by {@link SafetyMonitor} itself.
 */
public enum SafetyAction {
    THERAPIST_REVIEW,
    CALMING_INTERVENTION,
    SESSION_TERMINATION,
    GUARDIAN_NOTIFICATION,
    MANDATORY_INTERVENTION,
    THERAPIST_ALERT
}
