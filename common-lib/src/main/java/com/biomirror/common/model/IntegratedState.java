package com.biomirror.common.model;

import com.biomirror.common.fusion.Scores;

import java.time.Instant;

/**
 * Fused snapshot produced once per fusion tick. All indices are clamped to [0,1]
 * on construction.
 *
 * @param timestamp             tick time at which the pair was fused
 * @param facial                facial sample used for this state
 * @param physiological         physiological sample used for this state
 * @param coherenceIndex        agreement between expression and physiology
 * @param emotionalMaskingIndex degree to which expression hides activation
 * @param dissociationIndex     weighted dissociation indicator score
 * @param dominantEmotion       resolved emotion for downstream consumers
 * @param emotionalIntensity    confidence/quality weighted intensity
 * @param emotionalRegulation   regulation category
 * @param arousalLevel          copied from the physiological sample
 * @param dataQuality           combined data quality
 */
public record IntegratedState(
    Instant timestamp,
    FacialSample facial,
    PhysiologicalSample physiological,
    double coherenceIndex,
    double emotionalMaskingIndex,
    double dissociationIndex,
    EmotionType dominantEmotion,
    double emotionalIntensity,
    RegulationState emotionalRegulation,
    double arousalLevel,
    DataQuality dataQuality
) {

    /** Masking above this value is treated as an active masking instance. */
    public static final double MASKING_THRESHOLD = 0.6;

    /** Dissociation index above this value opens a dissociation episode. */
    public static final double DISSOCIATION_THRESHOLD = 0.6;

    public IntegratedState {
        coherenceIndex        = Scores.clamp01(coherenceIndex);
        emotionalMaskingIndex = Scores.clamp01(emotionalMaskingIndex);
        dissociationIndex     = Scores.clamp01(dissociationIndex);
        emotionalIntensity    = Scores.clamp01(emotionalIntensity);
        arousalLevel          = Scores.clamp01(arousalLevel);
    }

    public boolean isEmotionMasked() {
        return emotionalMaskingIndex > MASKING_THRESHOLD;
    }

    public boolean isDissociated() {
        return dissociationIndex > DISSOCIATION_THRESHOLD;
    }

    public double heartRate() {
        return physiological.heartRate().heartRate();
    }
}
