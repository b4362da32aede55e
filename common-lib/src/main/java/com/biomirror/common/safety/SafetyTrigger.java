package com.biomirror.common.safety;

/** Condition that produced a {@link SafetyEvent}. */
public enum SafetyTrigger {
    SEVERE_DISTRESS,
    SEVERE_DISSOCIATION,
    EXTREME_AROUSAL,
    PROLONGED_NEGATIVE_STATE,
    SUSTAINED_DISTRESS,
    PERSISTENT_DISSOCIATION,
    LEVEL_RESET
}
