package com.biomirror.common.response;

import java.time.Duration;
import java.util.Random;

/**
 * Decides whether a significant state change earns a response.
 *
 * <p>Dissociation and regulation changes always respond. Emotion changes and large
 * arousal swings respond with probability {@code sensitivity}, coherence changes with
 * {@code 0.7 × sensitivity}. The random source is injected so tests can seed it.
 */
public class ResponseTriggerPolicy {

    public static final double LARGE_AROUSAL_SWING = 0.3;
    public static final double COHERENCE_WEIGHT    = 0.7;

    private final double sensitivity;
    private final Random random;

    public ResponseTriggerPolicy(double sensitivity, Random random) {
        this.sensitivity = Math.max(0.0, Math.min(1.0, sensitivity));
        this.random      = random;
    }

    public boolean shouldRespond(StateChange change) {
        if (!change.isSignificant()) return false;
        if (change.dissociationChanged() || change.regulationChanged()) return true;
        if (change.emotionChanged() && random.nextDouble() < sensitivity) return true;
        if (change.arousalChanged() && change.arousalSwing() > LARGE_AROUSAL_SWING
            && random.nextDouble() < sensitivity) return true;
        return change.coherenceChanged() && random.nextDouble() < COHERENCE_WEIGHT * sensitivity;
    }

    public double sensitivity() {
        return sensitivity;
    }

    /** Minimum spacing between deliveries: {@code 3.0 − 2.5 × sensitivity} seconds. */
    public Duration responseDelay() {
        return responseDelay(sensitivity);
    }

    public static Duration responseDelay(double sensitivity) {
        double s = Math.max(0.0, Math.min(1.0, sensitivity));
        return Duration.ofMillis(Math.round((3.0 - s * 2.5) * 1000));
    }
}
