package com.biomirror.orchestrator.safety;

import com.biomirror.common.safety.AlertLevel;
import com.biomirror.common.safety.SafetyAction;
import com.biomirror.common.safety.SafetyAssessment;
import com.biomirror.common.safety.SafetyCheck;
import com.biomirror.common.safety.SafetyEvent;
import com.biomirror.orchestrator.feed.SessionFeeds;
import com.biomirror.orchestrator.logger.SessionFlowLogger;
import com.biomirror.orchestrator.notification.SafetyNotificationPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries out the side effects of one tick's safety results: publishes events and
 * alert-level changes, and maps each {@link SafetyAction} to the notification
 * collaborator. A failing notifier is logged and never breaks the tick.
 */
public class SafetyProtocolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SafetyProtocolDispatcher.class);

    private final SessionFeeds feeds;
    private final SafetyNotificationPublisher notifier;
    private final SessionFlowLogger flowLogger;

    private AlertLevel publishedLevel = AlertLevel.NONE;

    public SafetyProtocolDispatcher(SessionFeeds feeds, SafetyNotificationPublisher notifier,
                                    SessionFlowLogger flowLogger) {
        this.feeds      = feeds;
        this.notifier   = notifier;
        this.flowLogger = flowLogger;
    }

    /** Forgets the last published level; called when a session starts. */
    public void reset() {
        publishedLevel = AlertLevel.NONE;
    }

    public void dispatch(String sessionId, SafetyAssessment assessment,
                         SafetyCheck intervention, SafetyCheck termination) {
        if (assessment.hasEvent()) {
            handle(sessionId, assessment.event());
        }
        if (intervention.hasEvent()) {
            handle(sessionId, intervention.event());
        }
        if (termination.hasEvent()) {
            handle(sessionId, termination.event());
        }
        if (assessment.level() != publishedLevel) {
            publishedLevel = assessment.level();
            feeds.publishAlertLevel(publishedLevel);
        }
    }

    private void handle(String sessionId, SafetyEvent event) {
        flowLogger.safety(sessionId, event);
        feeds.publishSafetyEvent(event);
        for (SafetyAction action : event.actions()) {
            try {
                perform(sessionId, action, event);
            } catch (RuntimeException e) {
                log.warn("SAFETY_ACTION_FAILED sessionId={} action={} error={}",
                         sessionId, action, e.getMessage(), e);
            }
        }
    }

    private void perform(String sessionId, SafetyAction action, SafetyEvent event) {
        switch (action) {
            case THERAPIST_REVIEW       -> notifier.flagForTherapistReview(sessionId, event);
            case CALMING_INTERVENTION,
                 MANDATORY_INTERVENTION -> notifier.suggestSessionPause(sessionId, event);
            case SESSION_TERMINATION    -> notifier.suggestSessionTermination(sessionId, event);
            case GUARDIAN_NOTIFICATION  -> notifier.notifyGuardian(sessionId, event);
            case THERAPIST_ALERT        -> notifier.alertTherapist(sessionId, event);
        }
    }
}
