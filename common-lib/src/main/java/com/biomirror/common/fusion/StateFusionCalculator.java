package com.biomirror.common.fusion;

import com.biomirror.common.model.DataQuality;
import com.biomirror.common.model.EmotionType;
import com.biomirror.common.model.FaceDetectionQuality;
import com.biomirror.common.model.FacialSample;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.model.PhysiologicalSample;
import com.biomirror.common.model.RegulationState;

import java.time.Instant;

/**
 * Pure scoring functions that combine one facial and one physiological sample into
 * an {@link IntegratedState}.
 *
 * <p>Every score is clamped to [0,1] before it leaves this class. Missing input is
 * handled one layer up; both samples are required here.
 */
public final class StateFusionCalculator {

    // ── coherence ─────────────────────────────────────────────────────────────

    /** Score for emotions without an expected arousal band. */
    public static final double BASELINE_COHERENCE = 0.5;

    /** Maximum penalty applied at the edge of the band (score 0.7 at the edge). */
    private static final double IN_BAND_PENALTY = 0.3;

    /** Distance outside the band at which coherence reaches zero. */
    private static final double OUT_OF_BAND_FALLOFF = 0.4;

    /** Freeze index above which fear counts as physiologically expressed. */
    private static final double FEAR_FREEZE_THRESHOLD = 0.6;

    // ── dissociation ──────────────────────────────────────────────────────────

    private static final double FLAT_AFFECT_WEIGHT      = 0.4;
    private static final double FREEZE_WEIGHT           = 0.4;
    private static final double HRV_PATTERN_WEIGHT      = 0.3;
    private static final double NO_MICRO_EXPR_WEIGHT    = 0.2;
    private static final double LOW_COHERENCE_WEIGHT    = 0.3;

    /** Dissociation above this value overrides the dominant emotion. */
    public static final double DISSOCIATION_OVERRIDE = 0.7;

    private StateFusionCalculator() {}

    /**
     * Fuses the latest sample pair at {@code timestamp}.
     */
    public static IntegratedState fuse(FacialSample facial, PhysiologicalSample physio, Instant timestamp) {
        double coherence    = coherence(facial, physio);
        double masking      = masking(facial, physio, coherence);
        double dissociation = dissociation(facial, physio, coherence);

        return new IntegratedState(
            timestamp,
            facial,
            physio,
            coherence,
            masking,
            dissociation,
            dominantEmotion(facial, physio, dissociation),
            intensity(facial, physio),
            regulation(physio, coherence),
            physio.arousalLevel(),
            dataQuality(facial.faceDetectionQuality(), physio.qualityIndex())
        );
    }

    // ── coherence ─────────────────────────────────────────────────────────────

    /**
     * Agreement between the facial emotion and the arousal band expected for it.
     *
     * <p>Inside the band the score falls linearly from 1.0 at the center to 0.7 at
     * the edges; outside it falls from 0.7 to 0.0 over {@value #OUT_OF_BAND_FALLOFF}
     * of arousal. Emotion-specific corroboration is added, then the result is scaled
     * by facial confidence and physiological quality.
     */
    public static double coherence(FacialSample facial, PhysiologicalSample physio) {
        EmotionType emotion = facial.primaryEmotion();
        double arousal = Scores.clamp01(physio.arousalLevel());
        ExpectedArousalBand band = ExpectedArousalBand.forEmotion(emotion);

        double base;
        if (band == null) {
            base = BASELINE_COHERENCE;
        } else if (emotion == EmotionType.FEAR && physio.motion().freezeIndex() > FEAR_FREEZE_THRESHOLD) {
            base = 1.0;
        } else if (band.contains(arousal)) {
            double normalized = band.halfWidth() > 0
                ? Math.abs(arousal - band.center()) / band.halfWidth()
                : 0.0;
            base = 1.0 - IN_BAND_PENALTY * normalized;
        } else {
            double falloff = Math.min(1.0, band.distanceOutside(arousal) / OUT_OF_BAND_FALLOFF);
            base = (1.0 - IN_BAND_PENALTY) * (1.0 - falloff);
        }

        double adjusted = Scores.clamp01(base + corroborationBonus(emotion, physio));
        return Scores.clamp01(adjusted
            * Scores.clamp01(facial.confidence())
            * Scores.clamp01(physio.qualityIndex()));
    }

    static double corroborationBonus(EmotionType emotion, PhysiologicalSample physio) {
        double hr   = physio.heartRate().heartRate();
        double sdnn = physio.heartRate().sdnn();
        return switch (emotion) {
            case ANGER     -> hr > 100 && sdnn < 30 ? 0.2 : 0.0;
            case FEAR      -> physio.motion().freezeIndex() > FEAR_FREEZE_THRESHOLD ? 0.2 : 0.0;
            case HAPPINESS -> sdnn > 50 ? 0.1 : 0.0;
            case SADNESS   -> hr < 70 ? 0.1 : 0.0;
            default        -> 0.0;
        };
    }

    // ── masking ───────────────────────────────────────────────────────────────

    public static double masking(FacialSample facial, PhysiologicalSample physio, double coherence) {
        double arousal = Scores.clamp01(physio.arousalLevel());
        double masking = 0.0;

        if (facial.primaryEmotion() == EmotionType.NEUTRAL && arousal > 0.6) {
            masking = Math.min(1.0, arousal * 1.5);
        } else if (facial.primaryEmotion() == EmotionType.HAPPINESS
                   && physio.normalizedHrv() < 0.3 && arousal > 0.7) {
            masking = 0.8;
        }
        return Scores.clamp01(Math.max(masking, 1.0 - coherence));
    }

    // ── dissociation ──────────────────────────────────────────────────────────

    public static double dissociation(FacialSample facial, PhysiologicalSample physio, double coherence) {
        double score = 0.0;

        if (facial.primaryEmotion() == EmotionType.NEUTRAL && facial.primaryIntensity() < 0.3) {
            score += FLAT_AFFECT_WEIGHT;
        }
        if (physio.motion().freezeIndex() > 0.7) {
            score += FREEZE_WEIGHT;
        }
        if (physio.heartRate().sdnn() < 20 && physio.heartRate().heartRate() < 70) {
            score += HRV_PATTERN_WEIGHT;
        }
        if (!facial.hasMicroExpressions() && facial.confidence() > 0.8) {
            score += NO_MICRO_EXPR_WEIGHT;
        }
        if (coherence < 0.3) {
            score += LOW_COHERENCE_WEIGHT * (1.0 - coherence);
        }
        return Scores.clamp01(score);
    }

    // ── dominant emotion ──────────────────────────────────────────────────────

    public static EmotionType dominantEmotion(FacialSample facial, PhysiologicalSample physio,
                                              double dissociation) {
        if (facial.confidence() > 0.7 && facial.primaryIntensity() > 0.5) {
            return facial.primaryEmotion();
        }
        if (facial.confidence() < 0.4 && physio.qualityIndex() > 0.7) {
            double arousal = physio.arousalLevel();
            if (arousal > 0.8) {
                return physio.motion().freezeIndex() > 0.7 ? EmotionType.FEAR : EmotionType.ANGER;
            }
            if (arousal < 0.3) {
                return EmotionType.SADNESS;
            }
        }
        if (dissociation > DISSOCIATION_OVERRIDE) {
            return EmotionType.DISSOCIATION;
        }
        return facial.primaryEmotion();
    }

    // ── intensity ─────────────────────────────────────────────────────────────

    public static double intensity(FacialSample facial, PhysiologicalSample physio) {
        double facialIntensity = Scores.clamp01(facial.primaryIntensity());
        double arousal         = Scores.clamp01(physio.arousalLevel());
        double facialWeight    = Scores.clamp01(facial.confidence());
        double physioWeight    = Scores.clamp01(physio.qualityIndex());

        double total = facialWeight + physioWeight;
        if (total > 0) {
            return Scores.clamp01((facialIntensity * facialWeight + arousal * physioWeight) / total);
        }
        return Scores.clamp01((facialIntensity + arousal) / 2.0);
    }

    // ── regulation ────────────────────────────────────────────────────────────

    public static RegulationState regulation(PhysiologicalSample physio, double coherence) {
        double hrv     = physio.normalizedHrv();
        double arousal = physio.arousalLevel();

        if (hrv > 0.6 && coherence > 0.6) return RegulationState.REGULATED;
        if (arousal > 0.8 && hrv < 0.3)   return RegulationState.SEVERE_DYSREGULATION;
        if (arousal > 0.6 && hrv < 0.4)   return RegulationState.MODERATE_DYSREGULATION;
        if (arousal > 0.5 && hrv < 0.5)   return RegulationState.MILD_DYSREGULATION;
        return RegulationState.REGULATED;
    }

    // ── data quality ──────────────────────────────────────────────────────────

    public static DataQuality dataQuality(FaceDetectionQuality face, double bioQuality) {
        if (face == FaceDetectionQuality.NO_FACE || bioQuality < 0.2) {
            return DataQuality.INVALID;
        }
        if ((face == FaceDetectionQuality.EXCELLENT && bioQuality > 0.8)
            || (face == FaceDetectionQuality.GOOD && bioQuality > 0.9)) {
            return DataQuality.EXCELLENT;
        }
        if ((face == FaceDetectionQuality.EXCELLENT && bioQuality > 0.6)
            || (face == FaceDetectionQuality.GOOD && bioQuality > 0.7)
            || (face == FaceDetectionQuality.FAIR && bioQuality > 0.8)) {
            return DataQuality.GOOD;
        }
        if ((face == FaceDetectionQuality.POOR && bioQuality < 0.5)
            || (face == FaceDetectionQuality.FAIR && bioQuality < 0.4)) {
            return DataQuality.POOR;
        }
        return DataQuality.FAIR;
    }
}
