package com.biomirror.common.safety;

import com.biomirror.common.model.IntegratedState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Monotonic alert-level state machine ({@code NONE < LOW < MEDIUM < HIGH}) plus the
 * duration-based intervention and termination checks.
 *
 * <p>Per-tick rules, first match wins:
 * <ol>
 *   <li>distress emotion with severe intensity and arousal → {@code HIGH}</li>
 *   <li>severe dissociation → {@code MEDIUM}</li>
 *   <li>extreme arousal with extreme heart rate → {@code MEDIUM}</li>
 *   <li>prolonged negative state → {@code LOW}</li>
 * </ol>
 * A candidate takes effect only when strictly above the current level. The level
 * returns to {@code NONE} only after {@link SafetyThresholds#clearReadingsToReset()}
 * consecutive readings in which nothing fired.
 *
 * <p>States of {@code POOR} or {@code INVALID} quality never change anything: the
 * per-tick evaluation is skipped and the duration checks repeat their last answer.
 *
 * <p>The monitor only decides. Every side effect is returned as a {@link SafetyEvent}
 * carrying {@link SafetyAction}s for the caller to execute. All mutation goes through
 * the synchronized public methods.
 */
public class SafetyMonitor {

    private static final Logger log = LoggerFactory.getLogger(SafetyMonitor.class);

    private final SafetyThresholds thresholds;

    private AlertLevel currentLevel = AlertLevel.NONE;
    private int clearReadings;
    private Instant sessionStart;

    // ── duration timers ───────────────────────────────────────────────────────
    private Instant sustainedArousalSince;
    private Instant severeDissociationSince;
    private Instant negativeStateSince;

    // ── one-time alert latches ────────────────────────────────────────────────
    private boolean interventionRequired;
    private boolean guardianAlertedForIntervention;
    private boolean terminationRequired;
    private boolean therapistAlerted;

    public SafetyMonitor(SafetyThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /** Clears all state and anchors the guardian grace period at {@code start}. */
    public synchronized void startMonitoring(Instant start) {
        reset();
        this.sessionStart = start;
    }

    public synchronized void reset() {
        currentLevel                    = AlertLevel.NONE;
        clearReadings                   = 0;
        sessionStart                    = null;
        sustainedArousalSince           = null;
        severeDissociationSince         = null;
        negativeStateSince              = null;
        interventionRequired            = false;
        guardianAlertedForIntervention  = false;
        terminationRequired             = false;
        therapistAlerted                = false;
    }

    /**
     * Moves every duration anchor forward by {@code pausedFor}, so a paused span never
     * counts toward sustained distress, persistent dissociation, a prolonged negative
     * state or the guardian grace period.
     */
    public synchronized void resumeAfterPause(Duration pausedFor) {
        if (pausedFor.isNegative() || pausedFor.isZero()) return;
        sessionStart            = shifted(sessionStart, pausedFor);
        sustainedArousalSince   = shifted(sustainedArousalSince, pausedFor);
        severeDissociationSince = shifted(severeDissociationSince, pausedFor);
        negativeStateSince      = shifted(negativeStateSince, pausedFor);
        log.debug("SAFETY_TIMERS_SHIFTED pausedMs={}", pausedFor.toMillis());
    }

    public synchronized AlertLevel currentLevel() {
        return currentLevel;
    }

    // ── per-tick evaluation ───────────────────────────────────────────────────

    public synchronized SafetyAssessment evaluate(IntegratedState state) {
        if (state.dataQuality().isUnreliable()) {
            log.debug("SAFETY_EVALUATION_SKIPPED dataQuality={}", state.dataQuality());
            return SafetyAssessment.skipped(currentLevel);
        }
        track(state);

        AlertLevel candidate = AlertLevel.NONE;
        SafetyTrigger trigger = null;

        if (state.dominantEmotion().isDistress()
            && state.emotionalIntensity() > thresholds.distressIntensity()
            && state.arousalLevel() > thresholds.distressArousal()) {
            candidate = AlertLevel.HIGH;
            trigger   = SafetyTrigger.SEVERE_DISTRESS;
        } else if (state.dissociationIndex() > thresholds.severeDissociation()) {
            candidate = AlertLevel.MEDIUM;
            trigger   = SafetyTrigger.SEVERE_DISSOCIATION;
        } else if (state.arousalLevel() > thresholds.extremeArousal()
                   && state.heartRate() > thresholds.extremeHeartRate()) {
            candidate = AlertLevel.MEDIUM;
            trigger   = SafetyTrigger.EXTREME_AROUSAL;
        } else if (exceeded(negativeStateSince, state.timestamp(), thresholds.prolongedNegativeAfter())) {
            candidate = AlertLevel.LOW;
            trigger   = SafetyTrigger.PROLONGED_NEGATIVE_STATE;
        }

        if (trigger == null) {
            return clearReading(state);
        }
        clearReadings = 0;

        if (!candidate.isHigherThan(currentLevel)) {
            return new SafetyAssessment(currentLevel, null, true);
        }

        AlertLevel previous = currentLevel;
        currentLevel = candidate;
        SafetyEvent event = new SafetyEvent(state.timestamp(), candidate, trigger,
            escalationActions(candidate, state.timestamp()), state);
        log.warn("SAFETY_ESCALATED from={} to={} trigger={} actions={}",
                 previous, candidate, trigger, event.actions());
        return new SafetyAssessment(currentLevel, event, true);
    }

    private SafetyAssessment clearReading(IntegratedState state) {
        if (currentLevel == AlertLevel.NONE) {
            return new SafetyAssessment(AlertLevel.NONE, null, true);
        }
        clearReadings++;
        if (clearReadings < thresholds.clearReadingsToReset()) {
            return new SafetyAssessment(currentLevel, null, true);
        }
        AlertLevel previous = currentLevel;
        currentLevel  = AlertLevel.NONE;
        clearReadings = 0;
        log.info("SAFETY_LEVEL_RESET from={} clearReadings={}", previous, thresholds.clearReadingsToReset());
        SafetyEvent event = new SafetyEvent(state.timestamp(), AlertLevel.NONE,
            SafetyTrigger.LEVEL_RESET, List.of(), state);
        return new SafetyAssessment(AlertLevel.NONE, event, true);
    }

    private List<SafetyAction> escalationActions(AlertLevel level, Instant now) {
        List<SafetyAction> actions = new ArrayList<>();
        switch (level) {
            case LOW -> actions.add(SafetyAction.THERAPIST_REVIEW);
            case MEDIUM -> {
                actions.add(SafetyAction.CALMING_INTERVENTION);
                if (exceeded(sessionStart, now, thresholds.guardianNotifyAfter())) {
                    actions.add(SafetyAction.GUARDIAN_NOTIFICATION);
                }
            }
            case HIGH -> {
                actions.add(SafetyAction.SESSION_TERMINATION);
                actions.add(SafetyAction.GUARDIAN_NOTIFICATION);
            }
            default -> { }
        }
        return actions;
    }

    // ── duration-based checks ─────────────────────────────────────────────────

    /**
     * Intervention is required when arousal has stayed above the sustained threshold
     * for longer than {@link SafetyThresholds#interventionAfter()}, or the dissociation
     * index is severe. Raises an event on the rising edge; the guardian is alerted for
     * sustained distress at most once per session.
     */
    public synchronized SafetyCheck needsIntervention(IntegratedState state) {
        if (state.dataQuality().isUnreliable()) {
            return new SafetyCheck(interventionRequired, null);
        }
        track(state);

        Instant now = state.timestamp();
        boolean sustained = exceeded(sustainedArousalSince, now, thresholds.interventionAfter());
        boolean dissociated = state.dissociationIndex() > thresholds.severeDissociation();
        boolean required = sustained || dissociated;

        List<SafetyAction> actions = new ArrayList<>();
        if (required && !interventionRequired) {
            actions.add(SafetyAction.MANDATORY_INTERVENTION);
        }
        if (sustained && !guardianAlertedForIntervention) {
            actions.add(SafetyAction.GUARDIAN_NOTIFICATION);
            guardianAlertedForIntervention = true;
        }
        interventionRequired = required;

        if (actions.isEmpty()) {
            return new SafetyCheck(required, null);
        }
        SafetyTrigger trigger = sustained ? SafetyTrigger.SUSTAINED_DISTRESS : SafetyTrigger.SEVERE_DISSOCIATION;
        log.warn("SAFETY_INTERVENTION_REQUIRED trigger={} actions={}", trigger, actions);
        return new SafetyCheck(true, new SafetyEvent(now, currentLevel, trigger, actions, state));
    }

    /**
     * Termination is required when distress has been sustained beyond
     * {@link SafetyThresholds#terminationAfter()} or severe dissociation has persisted
     * beyond {@link SafetyThresholds#dissociationTerminationAfter()}. The therapist alert
     * fires once when the condition first holds; later calls keep returning
     * {@code true} without an event until the condition clears.
     */
    public synchronized SafetyCheck shouldTerminateSession(IntegratedState state) {
        if (state.dataQuality().isUnreliable()) {
            return new SafetyCheck(terminationRequired, null);
        }
        track(state);

        Instant now = state.timestamp();
        boolean sustained = exceeded(sustainedArousalSince, now, thresholds.terminationAfter());
        boolean dissociated = severeDissociationSince != null
            && !Duration.between(severeDissociationSince, now).minus(thresholds.dissociationTerminationAfter()).isNegative();
        terminationRequired = sustained || dissociated;

        if (!terminationRequired) {
            therapistAlerted = false;
            return SafetyCheck.CLEAR;
        }
        if (therapistAlerted) {
            return new SafetyCheck(true, null);
        }
        therapistAlerted = true;
        SafetyTrigger trigger = sustained ? SafetyTrigger.SUSTAINED_DISTRESS : SafetyTrigger.PERSISTENT_DISSOCIATION;
        log.error("SAFETY_TERMINATION_REQUIRED trigger={}", trigger);
        return new SafetyCheck(true, new SafetyEvent(now, currentLevel, trigger,
            List.of(SafetyAction.THERAPIST_ALERT), state));
    }

    // ── timers ────────────────────────────────────────────────────────────────

    /** Idempotent for a given state, so every public check may call it. */
    private void track(IntegratedState state) {
        Instant now = state.timestamp();

        sustainedArousalSince = state.arousalLevel() > thresholds.sustainedArousal()
            ? firstSeen(sustainedArousalSince, now) : null;

        severeDissociationSince = state.dissociationIndex() > thresholds.severeDissociation()
            ? firstSeen(severeDissociationSince, now) : null;

        negativeStateSince = state.dominantEmotion().isNegative()
                             && state.emotionalIntensity() > thresholds.prolongedNegativeIntensity()
            ? firstSeen(negativeStateSince, now) : null;
    }

    private static Instant shifted(Instant since, Duration by) {
        return since == null ? null : since.plus(by);
    }

    private static Instant firstSeen(Instant since, Instant now) {
        return since == null ? now : since;
    }

    private static boolean exceeded(Instant since, Instant now, Duration limit) {
        return since != null && Duration.between(since, now).compareTo(limit) > 0;
    }
}
