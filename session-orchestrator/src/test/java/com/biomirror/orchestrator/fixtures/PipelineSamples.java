package com.biomirror.orchestrator.fixtures;

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

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/** Sensor samples and fused states for pipeline tests. */
public final class PipelineSamples {

    private PipelineSamples() {}

    public static FacialSample facial(EmotionType emotion, double intensity, double confidence) {
        return new FacialSample(Instant.EPOCH, emotion, intensity, confidence, Map.of(),
                                FaceDetectionQuality.GOOD, Set.of("lip_corner_pull"));
    }

    public static PhysiologicalSample physio(double arousal, double heartRate, double sdnn, double freezeIndex) {
        return new PhysiologicalSample(
            Instant.EPOCH,
            new HeartRateMetrics(heartRate, sdnn, sdnn * 0.8, 0.2, 0.9),
            new ElectrodermalMetrics(4.0, 2, 0.3, 0.9),
            new MotionMetrics(Vector3.ZERO, Vector3.ZERO, 0.05, freezeIndex, 0.9),
            new RespirationMetrics(14, 0.1, 0.6, 0.9),
            arousal,
            0.9
        );
    }

    // ── canned sample pairs ───────────────────────────────────────────────────

    /** Happy face at confidence 0.9 over mid arousal: coherent, regulated, no safety trigger. */
    public static FacialSample calmFace() {
        return facial(EmotionType.HAPPINESS, 0.6, 0.9);
    }

    public static PhysiologicalSample calmBody() {
        return physio(0.6, 80, 55, 0.1);
    }

    /** Intense fear over high arousal: severe distress on good data. */
    public static FacialSample distressedFace() {
        return facial(EmotionType.FEAR, 0.9, 0.9);
    }

    public static PhysiologicalSample distressedBody() {
        return physio(0.85, 110, 25, 0.1);
    }

    /** Flat neutral face over low HR and low HRV: dissociation index 0.7, no safety trigger. */
    public static FacialSample flatFace() {
        return facial(EmotionType.NEUTRAL, 0.2, 0.9);
    }

    public static PhysiologicalSample numbBody() {
        return physio(0.3, 62, 15, 0.1);
    }

    // ── fused states ──────────────────────────────────────────────────────────

    public static IntegratedState state(Instant at, EmotionType dominant, double intensity,
                                        double arousal, double coherence, double dissociation) {
        return new IntegratedState(at, facial(dominant, intensity, 0.9), physio(arousal, 80, 45, 0.1),
                                   coherence, 0.1, dissociation, dominant, intensity,
                                   RegulationState.REGULATED, arousal, DataQuality.GOOD);
    }

    public static IntegratedState state(Instant at, EmotionType dominant, double coherence) {
        return state(at, dominant, 0.5, 0.5, coherence, 0.1);
    }
}
