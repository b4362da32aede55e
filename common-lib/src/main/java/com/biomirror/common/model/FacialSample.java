package com.biomirror.common.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One facial-expression reading delivered by the facial-analysis collaborator.
 * Immutable; superseded by the next sample.
 *
 * @param timestamp              capture time
 * @param primaryEmotion         strongest detected emotion
 * @param primaryIntensity       intensity of the primary emotion [0,1]
 * @param confidence             classifier confidence [0,1]
 * @param secondaryEmotions      intensity per secondary emotion
 * @param faceDetectionQuality   quality of the underlying face detection
 * @param microExpressions       micro-expressions active in this frame
 */
public record FacialSample(
    Instant timestamp,
    EmotionType primaryEmotion,
    double primaryIntensity,
    double confidence,
    Map<EmotionType, Double> secondaryEmotions,
    FaceDetectionQuality faceDetectionQuality,
    Set<String> microExpressions
) {
    public FacialSample {
        secondaryEmotions = secondaryEmotions == null ? Map.of() : Map.copyOf(secondaryEmotions);
        microExpressions  = microExpressions == null ? Set.of() : Set.copyOf(microExpressions);
    }

    public boolean hasMicroExpressions() {
        return !microExpressions.isEmpty();
    }
}
