package com.biomirror.orchestrator.session;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.dissociation.DissociationStatus;
import com.biomirror.common.dissociation.DissociationTracker;
import com.biomirror.common.exception.SessionStartException;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.response.TherapeuticResponse;
import com.biomirror.common.safety.AlertLevel;
import com.biomirror.common.safety.SafetyAction;
import com.biomirror.common.safety.SafetyAssessment;
import com.biomirror.common.safety.SafetyCheck;
import com.biomirror.common.safety.SafetyMonitor;
import com.biomirror.common.session.PhaseSchedule;
import com.biomirror.common.session.SessionMetrics;
import com.biomirror.common.session.SessionPhase;
import com.biomirror.common.session.TherapeuticSession;
import com.biomirror.common.sink.SessionRecordSink;
import com.biomirror.common.trace.SessionTraceUtil;
import com.biomirror.orchestrator.feed.SessionFeeds;
import com.biomirror.orchestrator.fusion.StateFusionEngine;
import com.biomirror.orchestrator.history.StateHistory;
import com.biomirror.orchestrator.logger.SessionFlowLogger;
import com.biomirror.orchestrator.safety.SafetyProtocolDispatcher;
import com.biomirror.orchestrator.scheduler.ResponseScheduler;
import com.biomirror.orchestrator.sensor.SensorService;
import com.biomirror.orchestrator.sensor.SensorUnavailableException;
import com.biomirror.orchestrator.timer.SessionTimers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the therapy session and drives the pipeline around it.
 *
 * <p>Lifecycle: {@code PREPARING → ACTIVE ⇄ PAUSED → COMPLETED}, or {@code ERROR} when
 * startup fails. Control operations and every timer callback run under the
 * {@link SessionTimers} lock, so a control operation never interleaves with a tick and
 * no cancelled callback can run after the operation returns.
 *
 * <p>Per fused state, in order: history and session append, record sink, dissociation
 * tracking, safety evaluation and protocol dispatch, response scheduling, and finally
 * the auto-termination check.
 */
public class SessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    public static final String PHASE_TIMER_PREFIX = "phase-";
    public static final String DURATION_TIMER     = "session-duration";
    public static final String TERMINATE_TIMER    = "session-terminate";

    private final SessionTimers timers;
    private final SessionFeeds feeds;
    private final StateFusionEngine fusionEngine;
    private final DissociationTracker dissociationTracker;
    private final SafetyMonitor safetyMonitor;
    private final SafetyProtocolDispatcher safetyDispatcher;
    private final ResponseScheduler responseScheduler;
    private final StateHistory history;
    private final SessionRecordSink recordSink;
    private final List<SensorService> sensors;
    private final SessionFlowLogger flowLogger;
    private final Duration defaultDuration;
    private final boolean autoTerminateOnHighAlert;

    private volatile SessionStatus status = SessionStatus.PREPARING;
    private TherapeuticSession session;
    private SessionMetrics lastMetrics;

    // active-time bookkeeping, guarded by the timer lock
    private Duration remaining = Duration.ZERO;
    private Instant activeSince;
    private Duration phaseElapsed = Duration.ZERO;
    private Instant phaseRunStart;
    private Instant pausedAt;

    public SessionCoordinator(SessionTimers timers,
                              SessionFeeds feeds,
                              StateFusionEngine fusionEngine,
                              DissociationTracker dissociationTracker,
                              SafetyMonitor safetyMonitor,
                              SafetyProtocolDispatcher safetyDispatcher,
                              ResponseScheduler responseScheduler,
                              StateHistory history,
                              SessionRecordSink recordSink,
                              List<SensorService> sensors,
                              SessionFlowLogger flowLogger,
                              Duration defaultDuration,
                              boolean autoTerminateOnHighAlert) {
        this.timers                   = timers;
        this.feeds                    = feeds;
        this.fusionEngine             = fusionEngine;
        this.dissociationTracker      = dissociationTracker;
        this.safetyMonitor            = safetyMonitor;
        this.safetyDispatcher         = safetyDispatcher;
        this.responseScheduler        = responseScheduler;
        this.history                  = history;
        this.recordSink               = recordSink;
        this.sensors                  = List.copyOf(sensors);
        this.flowLogger               = flowLogger;
        this.defaultDuration          = defaultDuration;
        this.autoTerminateOnHighAlert = autoTerminateOnHighAlert;

        fusionEngine.addListener(this::onFusedState);
    }

    // ── control surface ───────────────────────────────────────────────────────

    /**
     * Starts a new session in {@code phase}. A {@code null} or non-positive duration
     * uses the configured default.
     *
     * @return the new session id
     * @throws SessionStartException if a component could not start; everything already
     *                               started is stopped again and the status is {@code ERROR}
     * @throws IllegalStateException if a session is active or paused
     */
    public String startSession(SessionPhase phase, Duration duration) {
        return timers.exclusive(() -> {
            if (status.isLive()) {
                throw new IllegalStateException("Cannot start a session while one is " + status);
            }
            Duration planned = duration == null || duration.isZero() || duration.isNegative()
                ? defaultDuration : duration;
            String sessionId = UUID.randomUUID().toString();
            Instant now = timers.now();
            setStatus(SessionStatus.PREPARING);

            Deque<Runnable> rollback = new ArrayDeque<>();
            String component = "session";
            try {
                for (SensorService sensor : sensors) {
                    component = sensor.name();
                    sensor.start();
                    rollback.push(sensor::stop);
                }
                component = "fusion";
                fusionEngine.start();
                rollback.push(fusionEngine::stop);

                component = "response-scheduler";
                responseScheduler.start(this::onResponseDelivered);
                rollback.push(responseScheduler::stop);
            } catch (SensorUnavailableException e) {
                throw failStartup(sessionId, e.getSensor(), e, rollback);
            } catch (RuntimeException e) {
                throw failStartup(sessionId, component, e, rollback);
            }

            session = new TherapeuticSession(sessionId, phase, now, planned);
            lastMetrics = null;
            history.clear();
            dissociationTracker.reset();
            safetyMonitor.reset();
            safetyMonitor.startMonitoring(now);
            safetyDispatcher.reset();

            remaining     = planned;
            activeSince   = now;
            phaseElapsed  = Duration.ZERO;
            phaseRunStart = now;
            pausedAt      = null;

            setStatus(SessionStatus.ACTIVE);
            scheduleSessionTimers();
            feeds.publishPhase(phase);
            flowLogger.stage(SessionFlowLogger.SESSION_STARTED, sessionId, phase);
            return sessionId;
        });
    }

    /**
     * Ends the live session: cancels every timer, stops all components, closes any open
     * dissociation episode and finalizes the metrics.
     *
     * @throws IllegalStateException if no session is active or paused
     */
    public SessionMetrics endSession() {
        return timers.exclusive(() -> {
            if (!status.isLive()) {
                throw new IllegalStateException("No session to end, status=" + status);
            }
            return finish("requested");
        });
    }

    /**
     * Stops ingestion and all timers; session state is kept for resume. An open
     * dissociation episode is closed at the pause, since nothing is observed until resume.
     */
    public void pauseSession() {
        timers.exclusive(() -> {
            if (status != SessionStatus.ACTIVE) {
                throw new IllegalStateException("Cannot pause a session that is " + status);
            }
            Instant now = timers.now();
            remaining    = remaining.minus(Duration.between(activeSince, now));
            phaseElapsed = phaseElapsed.plus(Duration.between(phaseRunStart, now));

            cancelSessionTimers();
            fusionEngine.stop();
            responseScheduler.stop();
            sensors.forEach(this::pauseSensor);

            String sessionId = session.getId();
            dissociationTracker.closeOpenEpisode(now).ifPresent(episode -> recordEpisode(sessionId, episode));
            pausedAt = now;

            setStatus(SessionStatus.PAUSED);
            flowLogger.stage(SessionFlowLogger.SESSION_PAUSED, session.getId(), remaining);
        });
    }

    /**
     * Restarts ingestion and reschedules phase and duration timers from the remaining budget.
     * Safety duration checks resume where they stopped.
     */
    public void resumeSession() {
        timers.exclusive(() -> {
            if (status != SessionStatus.PAUSED) {
                throw new IllegalStateException("Cannot resume a session that is " + status);
            }
            Instant now = timers.now();
            sensors.forEach(this::resumeSensor);
            fusionEngine.start();
            responseScheduler.start(this::onResponseDelivered);
            safetyMonitor.resumeAfterPause(Duration.between(pausedAt, now));
            pausedAt = null;

            activeSince   = now;
            phaseRunStart = now;
            setStatus(SessionStatus.ACTIVE);
            scheduleSessionTimers();
            flowLogger.stage(SessionFlowLogger.SESSION_RESUMED, session.getId(), remaining);
        });
    }

    /**
     * Moves the live session to {@code phase} now. Later phase transitions are rescheduled
     * from the new phase when the session is active.
     */
    public void advanceToPhase(SessionPhase phase) {
        timers.exclusive(() -> {
            if (!status.isLive()) {
                throw new IllegalStateException("Cannot change phase of a session that is " + status);
            }
            moveToPhase(phase);
            if (status == SessionStatus.ACTIVE) {
                timers.cancelPrefix(PHASE_TIMER_PREFIX);
                schedulePhaseTimers();
            }
        });
    }

    // ── inspection ────────────────────────────────────────────────────────────

    public SessionStatus getStatus() {
        return status;
    }

    public Optional<String> currentSessionId() {
        return timers.exclusive(() -> Optional.ofNullable(session).map(TherapeuticSession::getId));
    }

    public Optional<SessionPhase> currentPhase() {
        return timers.exclusive(() -> Optional.ofNullable(session).map(TherapeuticSession::getPhase));
    }

    /** Metrics of the most recently completed session. */
    public Optional<SessionMetrics> lastMetrics() {
        return timers.exclusive(() -> Optional.ofNullable(lastMetrics));
    }

    public List<DissociationEpisode> currentEpisodes() {
        return timers.exclusive(() -> session == null ? List.<DissociationEpisode>of() : List.copyOf(session.getEpisodes()));
    }

    public StateHistory history() {
        return history;
    }

    // ── per-tick pipeline ─────────────────────────────────────────────────────

    private void onFusedState(IntegratedState state) {
        if (status != SessionStatus.ACTIVE || session == null) return;
        String sessionId = session.getId();

        history.add(state);
        session.addState(state);
        guarded(sessionId, "record-state", () -> recordSink.recordState(sessionId, state));

        DissociationStatus dissociation = dissociationTracker.process(state);
        feeds.publishDissociation(dissociation);
        if (dissociation.isRecent()) {
            dissociationTracker.latestEpisode().ifPresent(episode -> recordEpisode(sessionId, episode));
        }

        SafetyAssessment assessment = safetyMonitor.evaluate(state);
        SafetyCheck intervention    = safetyMonitor.needsIntervention(state);
        SafetyCheck termination     = safetyMonitor.shouldTerminateSession(state);
        safetyDispatcher.dispatch(sessionId, assessment, intervention, termination);

        boolean safetyPending = intervention.required()
            || assessment.hasEvent() && (assessment.event().requires(SafetyAction.CALMING_INTERVENTION)
                                         || assessment.event().requires(SafetyAction.SESSION_TERMINATION));
        responseScheduler.onState(state, session.getPhase(), dissociation, safetyPending);

        boolean terminate = termination.required() || assessment.level() == AlertLevel.HIGH;
        if (autoTerminateOnHighAlert && terminate && !timers.isScheduled(TERMINATE_TIMER)) {
            SessionTraceUtil.withMdc(sessionId, () ->
                log.warn("SESSION_AUTO_TERMINATION level={} terminationRequired={}",
                         assessment.level(), termination.required()));
            timers.scheduleOnce(TERMINATE_TIMER, Duration.ZERO, () -> {
                if (status.isLive()) finish("safety-termination");
            });
        }
    }

    private void recordEpisode(String sessionId, DissociationEpisode episode) {
        session.recordEpisode(episode);
        guarded(sessionId, "record-episode", () -> recordSink.recordEpisode(sessionId, episode));
    }

    private void onResponseDelivered(TherapeuticResponse response) {
        if (status != SessionStatus.ACTIVE || session == null) return;
        session.recordResponse(response);
        flowLogger.response(session.getId(), response);
    }

    // ── timers ────────────────────────────────────────────────────────────────

    private void scheduleSessionTimers() {
        schedulePhaseTimers();
        timers.scheduleOnce(DURATION_TIMER, remaining, () -> {
            if (status == SessionStatus.ACTIVE) finish("duration-elapsed");
        });
    }

    private void schedulePhaseTimers() {
        List<PhaseSchedule.PhaseTransition> transitions =
            PhaseSchedule.transitionsFrom(session.getPhase(), session.getPlannedDuration(), phaseElapsed);
        for (PhaseSchedule.PhaseTransition transition : transitions) {
            SessionPhase target = transition.phase();
            timers.scheduleOnce(PHASE_TIMER_PREFIX + target.name().toLowerCase(Locale.ROOT),
                                transition.delay(), () -> onPhaseTimer(target));
        }
    }

    private void onPhaseTimer(SessionPhase target) {
        if (status != SessionStatus.ACTIVE) return;
        if (target.ordinal() <= session.getPhase().ordinal()) return;
        moveToPhase(target);
    }

    private void cancelSessionTimers() {
        timers.cancelPrefix(PHASE_TIMER_PREFIX);
        timers.cancel(DURATION_TIMER);
        timers.cancel(TERMINATE_TIMER);
    }

    private void moveToPhase(SessionPhase phase) {
        session.advancePhase(phase);
        phaseElapsed  = Duration.ZERO;
        phaseRunStart = timers.now();
        feeds.publishPhase(phase);
        flowLogger.stage(SessionFlowLogger.PHASE_ADVANCED, session.getId(), phase);
    }

    // ── teardown ──────────────────────────────────────────────────────────────

    private SessionMetrics finish(String reason) {
        Instant now = timers.now();
        timers.cancelAll();
        fusionEngine.stop();
        responseScheduler.stop();
        for (int i = sensors.size() - 1; i >= 0; i--) {
            stopSensor(sensors.get(i));
        }

        String sessionId = session.getId();
        dissociationTracker.closeOpenEpisode(now).ifPresent(episode -> recordEpisode(sessionId, episode));

        SessionMetrics metrics = session.end(now);
        lastMetrics = metrics;
        setStatus(SessionStatus.COMPLETED);
        flowLogger.stage(SessionFlowLogger.SESSION_ENDED, sessionId, reason);
        return metrics;
    }

    private SessionStartException failStartup(String sessionId, String component, Exception cause,
                                              Deque<Runnable> rollback) {
        rollBack(rollback);
        session = null;
        setStatus(SessionStatus.ERROR);
        flowLogger.startupFailed(sessionId, component, cause);
        return new SessionStartException(component, "failed to start: " + cause.getMessage(), cause);
    }

    private void rollBack(Deque<Runnable> rollback) {
        while (!rollback.isEmpty()) {
            try {
                rollback.pop().run();
            } catch (RuntimeException e) {
                log.warn("ROLLBACK_STEP_FAILED error={}", e.getMessage(), e);
            }
        }
    }

    private void stopSensor(SensorService sensor) {
        try {
            sensor.stop();
        } catch (RuntimeException e) {
            log.warn("SENSOR_STOP_FAILED name={} error={}", sensor.name(), e.getMessage(), e);
        }
    }

    private void pauseSensor(SensorService sensor) {
        try {
            sensor.pause();
        } catch (RuntimeException e) {
            log.warn("SENSOR_PAUSE_FAILED name={} error={}", sensor.name(), e.getMessage(), e);
        }
    }

    private void resumeSensor(SensorService sensor) {
        try {
            sensor.resume();
        } catch (RuntimeException e) {
            log.warn("SENSOR_RESUME_FAILED name={} error={}", sensor.name(), e.getMessage(), e);
        }
    }

    private void guarded(String sessionId, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            SessionTraceUtil.withMdc(sessionId, () ->
                log.warn("PIPELINE_STEP_FAILED step={} sessionId={} error={}", step, sessionId, e.getMessage(), e));
        }
    }

    private void setStatus(SessionStatus next) {
        status = next;
        feeds.publishSessionStatus(next);
    }
}
