package com.biomirror.common.response;

import com.biomirror.common.dissociation.DissociationSeverity;
import com.biomirror.common.dissociation.DissociationStatus;
import com.biomirror.common.model.EmotionType;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.model.PhysiologicalSample;
import com.biomirror.common.model.RegulationState;
import com.biomirror.common.session.SessionPhase;

import java.time.Duration;
import java.time.Instant;

/**
 * Maps a fused state to the {@link TherapeuticResponse} the character should perform.
 *
 * <p>Selection order: a pending safety intervention, then a confirmed dissociation
 * episode, then the phase-specific rule. Intensity scaling per phase:
 * <pre>
 *   CONNECTION   mirroring × 0.7, negative emotions × 0.5 more
 *   AWARENESS    exploration × (1 − titration)
 *   INTEGRATION  validation × 0.8, or physiology mirroring at 0.6 when masked
 *   REGULATION   regulation at max(0.3, i − 0.3), or celebration at 0.6
 *   TRANSFER     transfer × 0.7
 * </pre>
 */
public class ResponseGenerator {

    /** Coherence below which the integration phase works on reconnecting face and body. */
    public static final double LOW_COHERENCE = 0.2;

    /** Dissociation above which the safety response becomes severe grounding. */
    public static final double SEVERE_DISSOCIATION = 0.8;

    private final ResponsePreferences preferences;

    public ResponseGenerator(ResponsePreferences preferences) {
        this.preferences = preferences;
    }

    public TherapeuticResponse generate(IntegratedState state, SessionPhase phase,
                                        DissociationStatus dissociation, boolean safetyPending,
                                        Instant now) {
        if (safetyPending) {
            return safetyResponse(state, now);
        }
        if (dissociation.isConfirmedEpisode()) {
            return groundingResponse(dissociation, now);
        }
        return switch (phase) {
            case CONNECTION  -> connection(state, now);
            case AWARENESS   -> awareness(state, now);
            case INTEGRATION -> integration(state, now);
            case REGULATION  -> regulation(state, now);
            case TRANSFER    -> transfer(state, now);
        };
    }

    // ── safety & grounding ────────────────────────────────────────────────────

    public TherapeuticResponse safetyResponse(IntegratedState state, Instant now) {
        if (state.dissociationIndex() > SEVERE_DISSOCIATION) {
            return new TherapeuticResponse(now, ResponseType.GROUNDING, EmotionType.NEUTRAL, 0.2,
                new CharacterAction.Breathing(0.2, 0.9),
                "I'm right here with you. Let's feel our feet on the floor and breathe slowly together.",
                "Very calm, slow and steady presence",
                InterventionLevel.INTENSIVE, EmotionType.NEUTRAL, Duration.ofSeconds(30));
        }
        return new TherapeuticResponse(now, ResponseType.REGULATION, EmotionType.NEUTRAL, 0.3,
            new CharacterAction.Breathing(0.3, 0.8),
            "Let's slow down together. Breathe in with me... and breathe out.",
            "Calm, soothing presence",
            InterventionLevel.INTENSIVE, EmotionType.NEUTRAL, Duration.ofSeconds(20));
    }

    public TherapeuticResponse groundingResponse(DissociationStatus status, Instant now) {
        DissociationSeverity severity = status.severity() == null ? DissociationSeverity.MILD : status.severity();
        GroundingTechnique technique =
            GroundingTechniqueSelector.select(severity, preferences.groundingTechniques());

        String verbal = switch (technique) {
            case BREATHING -> "Let's take a deep breath together. Breathe in... and out...";
            case SENSORY   -> "What is something you can see right now? What colours do you notice?";
            case MOVEMENT  -> "Let's move our hands gently. Can you wiggle your fingers with me?";
            case COGNITIVE -> "Let's count together. One, two, three...";
            case NAMING    -> "Can you find something near you that is blue?";
        };
        CharacterAction action = switch (technique) {
            case BREATHING         -> new CharacterAction.Breathing(0.3, 0.8);
            case SENSORY, NAMING   -> new CharacterAction.Attention(CharacterAction.Focus.DIRECT);
            case MOVEMENT          -> new CharacterAction.BodyMovement(CharacterAction.MovementType.GENTLE, 0.6);
            case COGNITIVE         -> new CharacterAction.FacialExpression(EmotionType.INTEREST, 0.7);
        };
        InterventionLevel level = switch (severity) {
            case POTENTIAL, MILD -> InterventionLevel.MINIMAL;
            case MODERATE        -> InterventionLevel.MODERATE;
            case SEVERE          -> InterventionLevel.INTENSIVE;
        };

        return new TherapeuticResponse(now, ResponseType.GROUNDING, EmotionType.NEUTRAL, 0.3, action,
            verbal, "Calm presence with a grounding focus", level, EmotionType.NEUTRAL, Duration.ofSeconds(15));
    }

    // ── phases ────────────────────────────────────────────────────────────────

    TherapeuticResponse connection(IntegratedState state, Instant now) {
        EmotionType emotion = state.dominantEmotion();
        double intensity = state.emotionalIntensity() * 0.7;
        if (emotion.isNegative()) {
            intensity *= 0.5;
        }
        String verbal = switch (emotion) {
            case HAPPINESS -> "I see your smile! It's nice to be happy together.";
            case SADNESS   -> "You might be feeling a bit sad. That's okay.";
            case ANGER     -> "You might be feeling frustrated. I understand.";
            case FEAR      -> "It's okay to feel worried. I'm here with you.";
            case SURPRISE  -> "Oh! That seemed surprising.";
            case NEUTRAL   -> "It's nice to be here together.";
            default        -> "I'm here with you.";
        };
        return new TherapeuticResponse(now, ResponseType.MIRRORING, emotion, intensity,
            new CharacterAction.FacialExpression(emotion, intensity), verbal,
            "Open, friendly presence", InterventionLevel.MINIMAL, null, Duration.ofSeconds(5));
    }

    TherapeuticResponse awareness(IntegratedState state, Instant now) {
        EmotionType emotion = state.dominantEmotion();
        double raw = state.emotionalIntensity();
        double intensity = raw * (1.0 - preferences.titrationLevel());
        boolean titrate = emotion.isNegative() && raw > 0.7;

        String degree = raw > 0.7 ? "very " : (raw > 0.4 ? "" : "a little ");
        String verbal = switch (emotion) {
            case HAPPINESS -> "You look " + degree + "happy. I can see it in your smile!";
            case SADNESS   -> "You might be feeling " + degree + "sad. I can see it in your face.";
            case ANGER     -> "You seem " + degree + "frustrated. I can see it in your eyebrows.";
            case FEAR      -> "You might be feeling " + degree + "scared. I can see it in your eyes.";
            case SURPRISE  -> "You look " + degree + "surprised!";
            case DISGUST   -> "Something seems " + degree + "uncomfortable for you.";
            case NEUTRAL   -> "You look calm right now. How does it feel inside?";
            default        -> "I notice your feelings. Can you tell me about them?";
        };
        return new TherapeuticResponse(now,
            titrate ? ResponseType.TITRATION : ResponseType.EXPLORATION,
            emotion, intensity, new CharacterAction.FacialExpression(emotion, intensity), verbal,
            titrate ? "Softened mirroring, steady presence" : "Curious, attentive presence",
            InterventionLevel.MODERATE, emotion, Duration.ofSeconds(10));
    }

    TherapeuticResponse integration(IntegratedState state, Instant now) {
        if (state.isEmotionMasked()) {
            EmotionType inner = inferFromPhysiology(state.physiological());
            return new TherapeuticResponse(now, ResponseType.MIRRORING, inner, 0.6,
                new CharacterAction.FacialExpression(inner, 0.6),
                "Your face and your body might be feeling different things. It's okay to show how you really feel.",
                "Gentle mirroring of the feeling underneath",
                InterventionLevel.MODERATE, inner, Duration.ofSeconds(12));
        }
        if (state.coherenceIndex() < LOW_COHERENCE) {
            return new TherapeuticResponse(now, ResponseType.INTEGRATION, EmotionType.NEUTRAL, 0.5,
                new CharacterAction.Attention(CharacterAction.Focus.SHARED),
                "Let's notice how your body feels and see if your face feels the same.",
                "Attentive presence focused on connecting face and body",
                InterventionLevel.MODERATE, state.dominantEmotion(), Duration.ofSeconds(20));
        }
        EmotionType emotion = state.dominantEmotion();
        double intensity = state.emotionalIntensity() * 0.8;
        return new TherapeuticResponse(now, ResponseType.VALIDATION, emotion, intensity,
            new CharacterAction.FacialExpression(emotion, intensity),
            "What you're feeling makes sense. All feelings are okay.",
            "Warm, accepting presence", InterventionLevel.MINIMAL, emotion, Duration.ofSeconds(8));
    }

    TherapeuticResponse regulation(IntegratedState state, Instant now) {
        EmotionType emotion = state.dominantEmotion();
        if (state.emotionalRegulation() != RegulationState.REGULATED && state.emotionalIntensity() > 0.7) {
            double intensity = Math.max(0.3, state.emotionalIntensity() - 0.3);
            String verbal;
            CharacterAction action;
            switch (emotion) {
                case ANGER -> {
                    verbal = "These are really strong feelings. Let's take a deep breath together.";
                    action = new CharacterAction.Breathing(0.3, 0.8);
                }
                case FEAR -> {
                    verbal = "It's okay to feel scared. What's one thing you can see right now?";
                    action = new CharacterAction.Attention(CharacterAction.Focus.SHARED);
                }
                case SADNESS -> {
                    verbal = "It's okay to feel sad. Would you like to take a gentle breath with me?";
                    action = new CharacterAction.FacialExpression(EmotionType.SADNESS, 0.4);
                }
                default -> {
                    verbal = "Let's notice how we feel right now and breathe together.";
                    action = new CharacterAction.Breathing(0.5, 0.6);
                }
            }
            return new TherapeuticResponse(now, ResponseType.REGULATION, emotion, intensity, action, verbal,
                "Calm, regulating presence", InterventionLevel.SIGNIFICANT, EmotionType.NEUTRAL,
                Duration.ofSeconds(15));
        }
        return new TherapeuticResponse(now, ResponseType.CELEBRATION, EmotionType.HAPPINESS, 0.6,
            new CharacterAction.Vocalization(CharacterAction.VocalizationType.AFFIRMING),
            "You're doing a great job handling your feelings!",
            "Warm, affirming presence", InterventionLevel.MINIMAL, emotion, Duration.ofSeconds(5));
    }

    TherapeuticResponse transfer(IntegratedState state, Instant now) {
        EmotionType emotion = state.dominantEmotion();
        double intensity = state.emotionalIntensity() * 0.7;
        boolean regulated = state.emotionalRegulation().isRegulated();
        String verbal = switch (emotion) {
            case HAPPINESS -> "You're feeling happy! What helps you feel this way outside our time together?";
            case SADNESS   -> regulated
                ? "You're handling sad feelings well. What could help next time you feel sad at home?"
                : "When you feel sad at home, what helps you feel a little better?";
            case ANGER     -> regulated
                ? "You're managing strong feelings well. What could you do when you feel frustrated at school?"
                : "When you feel angry somewhere else, what might help you calm down?";
            case FEAR      -> "When you feel scared at home or school, what could help you feel safer?";
            default        -> "How could you use what we practised when you're at home or school?";
        };
        return new TherapeuticResponse(now, ResponseType.TRANSFER, emotion, intensity,
            new CharacterAction.FacialExpression(emotion, intensity), verbal,
            "Encouraging stance with a real-world focus", InterventionLevel.MODERATE, emotion,
            Duration.ofSeconds(10));
    }

    // ── inference ─────────────────────────────────────────────────────────────

    /** Best guess at the felt emotion when the face is masking it. */
    public static EmotionType inferFromPhysiology(PhysiologicalSample physio) {
        double arousal = physio.arousalLevel();
        if (physio.motion().freezeIndex() > 0.7) return EmotionType.FEAR;
        if (arousal > 0.8) return physio.heartRate().heartRate() > 100 ? EmotionType.ANGER : EmotionType.FEAR;
        if (arousal > 0.6) return EmotionType.SURPRISE;
        if (arousal < 0.3) return EmotionType.SADNESS;
        return EmotionType.NEUTRAL;
    }
}
