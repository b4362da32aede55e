package com.biomirror.common.response;

import com.biomirror.common.model.EmotionType;

/**
 * Animation the companion character performs with a response. One of
 * {@link Breathing}, {@link FacialExpression}, {@link BodyMovement},
 * {@link Vocalization} or {@link Attention}.
 */
public interface CharacterAction {

    record Breathing(double speed, double depth) implements CharacterAction {}

    record FacialExpression(EmotionType emotion, double intensity) implements CharacterAction {}

    record BodyMovement(MovementType type, double intensity) implements CharacterAction {}

    record Vocalization(VocalizationType type) implements CharacterAction {}

    record Attention(Focus focus) implements CharacterAction {}

    enum MovementType { GENTLE, RHYTHMIC, STRETCH }

    enum VocalizationType { AFFIRMING, HUMMING, SOOTHING }

    enum Focus { DIRECT, SHARED, AVERTED }
}
