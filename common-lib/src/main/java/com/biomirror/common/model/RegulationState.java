package com.biomirror.common.model;

/**
 * Categorical assessment of whether the subject's response is self-modulated.
 */
public enum RegulationState {

    /** Adequate HRV and coherent expression, or no dysregulation pattern detected. */
    REGULATED,

    /** Arousal above 0.5 with normalized HRV below 0.5. */
    MILD_DYSREGULATION,

    /** Arousal above 0.6 with normalized HRV below 0.4. */
    MODERATE_DYSREGULATION,

    /** Arousal above 0.8 with normalized HRV below 0.3. */
    SEVERE_DYSREGULATION;

    public boolean isRegulated() {
        return this == REGULATED;
    }
}
