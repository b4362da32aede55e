package com.biomirror.orchestrator.sink;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.sink.SessionRecordSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Keeps records in memory, sequenced in arrival order, until a sync collaborator
 * marks them as synced. Synced records are evicted.
 */
public class InMemorySessionRecordSink implements SessionRecordSink {

    private final CopyOnWriteArrayList<SessionRecord> records = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public void recordState(String sessionId, IntegratedState state) {
        records.add(SessionRecord.ofState(sequence.incrementAndGet(), sessionId, state));
    }

    @Override
    public void recordEpisode(String sessionId, DissociationEpisode episode) {
        records.add(SessionRecord.ofEpisode(sequence.incrementAndGet(), sessionId, episode));
    }

    /** Records not yet synced, oldest first. */
    public List<SessionRecord> pendingSync() {
        return new ArrayList<>(records);
    }

    /**
     * Evicts every record up to and including {@code throughSequence}.
     *
     * @return number of records evicted
     */
    public int markSynced(long throughSequence) {
        int before = records.size();
        records.removeIf(r -> r.sequence() <= throughSequence);
        return before - records.size();
    }

    public int size() {
        return records.size();
    }

    public List<SessionRecord> recordsFor(String sessionId) {
        return records.stream()
            .filter(r -> r.sessionId().equals(sessionId))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    public long getLatestSequence() {
        return sequence.get();
    }
}
