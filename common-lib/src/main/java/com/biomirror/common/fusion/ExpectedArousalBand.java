package com.biomirror.common.fusion;

import com.biomirror.common.model.EmotionType;

/**
 * Physiological arousal range expected for a facial emotion.
 *
 * <p>Emotions with no band (everything outside the six basic emotions) are scored
 * against a fixed baseline instead.
 */
public record ExpectedArousalBand(double low, double high) {

    public static final ExpectedArousalBand HIGH_AROUSAL = new ExpectedArousalBand(0.4, 0.8);
    public static final ExpectedArousalBand MID_AROUSAL  = new ExpectedArousalBand(0.3, 0.7);
    public static final ExpectedArousalBand FEAR_AROUSAL = new ExpectedArousalBand(0.6, 1.0);
    public static final ExpectedArousalBand LOW_AROUSAL  = new ExpectedArousalBand(0.0, 0.4);

    /** Returns the band for {@code emotion}, or {@code null} when none is defined. */
    public static ExpectedArousalBand forEmotion(EmotionType emotion) {
        return switch (emotion) {
            case HAPPINESS, ANGER, SURPRISE -> HIGH_AROUSAL;
            case SADNESS, DISGUST           -> MID_AROUSAL;
            case FEAR                       -> FEAR_AROUSAL;
            case NEUTRAL                    -> LOW_AROUSAL;
            default                         -> null;
        };
    }

    public double center() {
        return (low + high) / 2.0;
    }

    public double halfWidth() {
        return (high - low) / 2.0;
    }

    public boolean contains(double arousal) {
        return arousal >= low && arousal <= high;
    }

    /** Distance to the nearest edge; zero inside the band. */
    public double distanceOutside(double arousal) {
        if (arousal < low) return low - arousal;
        if (arousal > high) return arousal - high;
        return 0.0;
    }
}
