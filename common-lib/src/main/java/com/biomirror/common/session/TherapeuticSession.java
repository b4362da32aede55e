package com.biomirror.common.session;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.response.TherapeuticResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single therapy session. Owned by the coordinator, mutated by appends while
 * running and finalized by {@link #end(Instant)}.
 */
public class TherapeuticSession {

    private final String id;
    private final Instant startTime;
    private final Duration plannedDuration;
    private SessionPhase phase;
    private Instant endTime;
    private SessionMetrics metrics;
    private int responsesDelivered;

    private final List<IntegratedState> states = new ArrayList<>();
    private final List<DissociationEpisode> episodes = new ArrayList<>();

    public TherapeuticSession(String id, SessionPhase phase, Instant startTime, Duration plannedDuration) {
        this.id              = id;
        this.phase           = phase;
        this.startTime       = startTime;
        this.plannedDuration = plannedDuration;
    }

    public void addState(IntegratedState state) {
        requireOpen();
        states.add(state);
    }

    public void recordEpisode(DissociationEpisode episode) {
        requireOpen();
        episodes.add(episode);
    }

    public void recordResponse(TherapeuticResponse response) {
        requireOpen();
        responsesDelivered++;
    }

    public void advancePhase(SessionPhase newPhase) {
        requireOpen();
        this.phase = newPhase;
    }

    /** Closes the session and computes its metrics. */
    public SessionMetrics end(Instant at) {
        requireOpen();
        this.endTime = at;
        this.metrics = SessionMetricsCalculator.compute(states, episodes, responsesDelivered, startTime, at);
        return metrics;
    }

    public boolean isEnded() {
        return endTime != null;
    }

    private void requireOpen() {
        if (endTime != null) {
            throw new IllegalStateException("Session " + id + " already ended at " + endTime);
        }
    }

    public String getId() { return id; }
    public SessionPhase getPhase() { return phase; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public Duration getPlannedDuration() { return plannedDuration; }
    public SessionMetrics getMetrics() { return metrics; }
    public int getResponsesDelivered() { return responsesDelivered; }
    public List<IntegratedState> getStates() { return Collections.unmodifiableList(states); }
    public List<DissociationEpisode> getEpisodes() { return Collections.unmodifiableList(episodes); }
}
