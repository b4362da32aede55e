package com.biomirror.common.response;

import com.biomirror.common.model.EmotionType;

import java.time.Duration;
import java.time.Instant;

/**
 * Response descriptor handed to the presentation layer.
 *
 * @param timestamp          creation time; restamped with the delivery time on dequeue
 * @param responseType       kind of response
 * @param characterEmotion   emotion the character displays
 * @param characterIntensity intensity the character displays
 * @param characterAction    animation to perform
 * @param verbal             text the character speaks
 * @param nonverbal          presence description for the animator
 * @param interventionLevel  how strongly the response steers the subject
 * @param targetEmotion      emotion the response aims at, may be {@code null}
 * @param duration           how long the response stays active
 */
public record TherapeuticResponse(
    Instant timestamp,
    ResponseType responseType,
    EmotionType characterEmotion,
    double characterIntensity,
    CharacterAction characterAction,
    String verbal,
    String nonverbal,
    InterventionLevel interventionLevel,
    EmotionType targetEmotion,
    Duration duration
) {

    public TherapeuticResponse withTimestamp(Instant deliveredAt) {
        return new TherapeuticResponse(deliveredAt, responseType, characterEmotion, characterIntensity,
            characterAction, verbal, nonverbal, interventionLevel, targetEmotion, duration);
    }

    public Instant endsAt() {
        return timestamp.plus(duration);
    }
}
