package com.biomirror.common.fixtures;

import com.biomirror.common.model.DataQuality;
import com.biomirror.common.model.EmotionType;
import com.biomirror.common.model.FaceDetectionQuality;
import com.biomirror.common.model.FacialSample;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.model.PhysiologicalSample;
import com.biomirror.common.model.PhysiologicalSample.ElectrodermalMetrics;
import com.biomirror.common.model.PhysiologicalSample.HeartRateMetrics;
import com.biomirror.common.model.PhysiologicalSample.MotionMetrics;
import com.biomirror.common.model.PhysiologicalSample.RespirationMetrics;
import com.biomirror.common.model.PhysiologicalSample.Vector3;
import com.biomirror.common.model.RegulationState;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/** Builders for samples and fused states used across the test suite. */
public final class Samples {

    public static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private Samples() {}

    public static Instant at(double seconds) {
        return T0.plus(Duration.ofMillis(Math.round(seconds * 1000)));
    }

    // ── raw samples ───────────────────────────────────────────────────────────

    public static FacialSample facial(EmotionType emotion, double intensity, double confidence) {
        return facial(emotion, intensity, confidence, FaceDetectionQuality.GOOD, Set.of("lip_corner_pull"));
    }

    public static FacialSample facial(EmotionType emotion, double intensity, double confidence,
                                      FaceDetectionQuality quality, Set<String> microExpressions) {
        return new FacialSample(T0, emotion, intensity, confidence, Map.of(), quality, microExpressions);
    }

    public static PhysiologicalSample physio(double arousal, double heartRate, double sdnn,
                                             double freezeIndex, double quality) {
        return new PhysiologicalSample(
            T0,
            new HeartRateMetrics(heartRate, sdnn, sdnn * 0.8, 0.2, quality),
            new ElectrodermalMetrics(4.0, 2, 0.3, quality),
            new MotionMetrics(Vector3.ZERO, Vector3.ZERO, 0.05, freezeIndex, quality),
            new RespirationMetrics(14, 0.1, 0.6, quality),
            arousal,
            quality
        );
    }

    // ── fused states ──────────────────────────────────────────────────────────

    public static IntegratedState state(Instant at, double dissociation) {
        return state(at, EmotionType.NEUTRAL, 0.5, 0.4, 0.7, dissociation, 80, DataQuality.GOOD);
    }

    public static IntegratedState state(Instant at, EmotionType dominant, double intensity, double arousal,
                                        double coherence, double dissociation, double heartRate,
                                        DataQuality quality) {
        return state(at, dominant, intensity, arousal, coherence, dissociation, heartRate, quality,
                     RegulationState.REGULATED, 0.1);
    }

    public static IntegratedState state(Instant at, EmotionType dominant, double intensity, double arousal,
                                        double coherence, double dissociation, double heartRate,
                                        DataQuality quality, RegulationState regulation, double masking) {
        FacialSample face = facial(dominant, intensity, 0.9);
        PhysiologicalSample body = physio(arousal, heartRate, 45, 0.1, 0.9);
        return new IntegratedState(at, face, body, coherence, masking, dissociation, dominant,
                                   intensity, regulation, arousal, quality);
    }
}
