package com.biomirror.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Fixed emotion taxonomy shared by the facial-analysis collaborator, the fusion
 * layer and the response generator.
 */
public enum EmotionType {

    NEUTRAL,
    HAPPINESS,
    SADNESS,
    ANGER,
    FEAR,
    SURPRISE,
    DISGUST,
    CONTEMPT,
    /** Numbed or disconnected presentation, only ever assigned by fusion. */
    DISSOCIATION,
    HYPERVIGILANCE,
    FREEZE,
    CONFUSION,
    INTEREST,
    SHAME,
    PRIDE;

    private static final Set<EmotionType> DISTRESS =
        EnumSet.of(SADNESS, ANGER, FEAR, DISGUST);

    private static final Set<EmotionType> NEGATIVE =
        EnumSet.of(SADNESS, ANGER, FEAR, DISGUST, CONTEMPT, SHAME);

    /** Emotions that count toward the severe-distress safety trigger. */
    public boolean isDistress() {
        return DISTRESS.contains(this);
    }

    public boolean isNegative() {
        return NEGATIVE.contains(this);
    }

    /** Number of emotions in the taxonomy; denominator of the emotional range index. */
    public static int taxonomySize() {
        return values().length;
    }
}
