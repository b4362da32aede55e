package com.biomirror.common.sink;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.model.IntegratedState;

/**
 * Accepts session records for later persistence and remote sync.
 *
 * <p>Implementations must not block the fusion tick. Storage format and sync
 * transport belong to the implementation.
 */
public interface SessionRecordSink {

    void recordState(String sessionId, IntegratedState state);

    void recordEpisode(String sessionId, DissociationEpisode episode);
}
