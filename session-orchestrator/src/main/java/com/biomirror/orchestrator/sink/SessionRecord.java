package com.biomirror.orchestrator.sink;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.model.IntegratedState;

import java.time.Instant;

/**
 * One stored record awaiting sync. Exactly one of {@code state} and {@code episode}
 * is set, matching {@code kind}.
 */
public record SessionRecord(
    long sequence,
    String sessionId,
    Kind kind,
    Instant timestamp,
    IntegratedState state,
    DissociationEpisode episode
) {
    public enum Kind { STATE, EPISODE }

    public static SessionRecord ofState(long sequence, String sessionId, IntegratedState state) {
        return new SessionRecord(sequence, sessionId, Kind.STATE, state.timestamp(), state, null);
    }

    public static SessionRecord ofEpisode(long sequence, String sessionId, DissociationEpisode episode) {
        return new SessionRecord(sequence, sessionId, Kind.EPISODE, episode.endTime(), null, episode);
    }
}
