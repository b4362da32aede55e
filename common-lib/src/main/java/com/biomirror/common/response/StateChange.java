package com.biomirror.common.response;

import com.biomirror.common.model.IntegratedState;

/**
 * Difference between two consecutive fused states, as seen by the response scheduler.
 */
public record StateChange(
    IntegratedState previous,
    IntegratedState current,
    boolean emotionChanged,
    boolean intensityChanged,
    boolean arousalChanged,
    boolean coherenceChanged,
    boolean dissociationChanged,
    boolean regulationChanged
) {

    public static final double INTENSITY_DELTA    = 0.25;
    public static final double AROUSAL_DELTA      = 0.2;
    public static final double COHERENCE_DELTA    = 0.2;
    public static final double DISSOCIATION_DELTA = 0.2;

    public static StateChange between(IntegratedState previous, IntegratedState current) {
        return new StateChange(
            previous,
            current,
            previous.dominantEmotion() != current.dominantEmotion(),
            Math.abs(current.emotionalIntensity() - previous.emotionalIntensity()) > INTENSITY_DELTA,
            Math.abs(current.arousalLevel() - previous.arousalLevel()) > AROUSAL_DELTA,
            Math.abs(current.coherenceIndex() - previous.coherenceIndex()) > COHERENCE_DELTA,
            Math.abs(current.dissociationIndex() - previous.dissociationIndex()) > DISSOCIATION_DELTA,
            previous.emotionalRegulation() != current.emotionalRegulation()
        );
    }

    public boolean isSignificant() {
        return emotionChanged
            || intensityChanged
            || regulationChanged
            || (dissociationChanged && current.dissociationIndex() > 0.5)
            || (arousalChanged && current.arousalLevel() > 0.7);
    }

    public double arousalSwing() {
        return Math.abs(current.arousalLevel() - previous.arousalLevel());
    }
}
