package com.biomirror.orchestrator.feed;

import com.biomirror.common.dissociation.DissociationStatus;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.response.TherapeuticResponse;
import com.biomirror.common.safety.AlertLevel;
import com.biomirror.common.safety.SafetyEvent;
import com.biomirror.common.session.SessionPhase;
import com.biomirror.orchestrator.session.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Outbound publish/subscribe feeds consumed by UI, persistence, notification and
 * character-animation collaborators.
 *
 * <p>Every feed is a direct multicast sink: emission is synchronous, in-line on
 * the emitting tick, unbuffered, and in emission order. Subscribers that are not
 * keeping up miss elements rather than delaying the pipeline.
 */
@Component
public class SessionFeeds {

    private static final Logger log = LoggerFactory.getLogger(SessionFeeds.class);

    private final Sinks.Many<IntegratedState> states          = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<DissociationStatus> dissociation = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<SafetyEvent> safetyEvents        = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<AlertLevel> alertLevels          = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<TherapeuticResponse> responses   = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<SessionStatus> sessionStatus     = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<SessionPhase> phases             = Sinks.many().multicast().directBestEffort();

    // ── subscriptions ─────────────────────────────────────────────────────────

    public Flux<IntegratedState> states()             { return states.asFlux(); }
    public Flux<DissociationStatus> dissociation()    { return dissociation.asFlux(); }
    public Flux<SafetyEvent> safetyEvents()           { return safetyEvents.asFlux(); }
    public Flux<AlertLevel> alertLevels()             { return alertLevels.asFlux(); }
    public Flux<TherapeuticResponse> responses()      { return responses.asFlux(); }
    public Flux<SessionStatus> sessionStatus()        { return sessionStatus.asFlux(); }
    public Flux<SessionPhase> phases()                { return phases.asFlux(); }

    // ── emission ──────────────────────────────────────────────────────────────

    public void publishState(IntegratedState state)              { emit("states", states, state); }
    public void publishDissociation(DissociationStatus status)   { emit("dissociation", dissociation, status); }
    public void publishSafetyEvent(SafetyEvent event)            { emit("safetyEvents", safetyEvents, event); }
    public void publishAlertLevel(AlertLevel level)              { emit("alertLevels", alertLevels, level); }
    public void publishResponse(TherapeuticResponse response)    { emit("responses", responses, response); }
    public void publishSessionStatus(SessionStatus status)       { emit("sessionStatus", sessionStatus, status); }
    public void publishPhase(SessionPhase phase)                 { emit("phases", phases, phase); }

    private <T> void emit(String feed, Sinks.Many<T> sink, T value) {
        Sinks.EmitResult result = sink.tryEmitNext(value);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("FEED_EMIT_FAILED feed={} result={}", feed, result);
        }
    }
}
