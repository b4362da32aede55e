package com.biomirror.orchestrator.notification;

import com.biomirror.common.safety.SafetyEvent;
import com.biomirror.common.trace.SessionTraceUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every safety notification to the log. Guardian notifications are logged as
 * skipped when guardian delivery is disabled or no contact is configured.
 */
public class LoggingSafetyNotificationPublisher implements SafetyNotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingSafetyNotificationPublisher.class);

    private final boolean guardianEnabled;
    private final String guardianContact;

    public LoggingSafetyNotificationPublisher(boolean guardianEnabled, String guardianContact) {
        this.guardianEnabled = guardianEnabled;
        this.guardianContact = guardianContact == null ? "" : guardianContact;
    }

    public boolean isGuardianDeliveryEnabled() {
        return guardianEnabled && !guardianContact.isBlank();
    }

    @Override
    public void notifyGuardian(String sessionId, SafetyEvent event) {
        if (!isGuardianDeliveryEnabled()) {
            SessionTraceUtil.withMdc(sessionId, () ->
                log.info("GUARDIAN_NOTIFICATION_SKIPPED reason=no-contact trigger={} level={}",
                         event.trigger(), event.level()));
            return;
        }
        SessionTraceUtil.withMdc(sessionId, () ->
            log.warn("GUARDIAN_NOTIFIED contact={} trigger={} level={} at={}",
                     guardianContact, event.trigger(), event.level(), event.timestamp()));
    }

    @Override
    public void alertTherapist(String sessionId, SafetyEvent event) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.error("THERAPIST_ALERT trigger={} level={} at={}", event.trigger(), event.level(), event.timestamp()));
    }

    @Override
    public void flagForTherapistReview(String sessionId, SafetyEvent event) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.info("THERAPIST_REVIEW_FLAGGED trigger={} emotion={} intensity={}",
                     event.trigger(), event.state().dominantEmotion(), event.state().emotionalIntensity()));
    }

    @Override
    public void suggestSessionPause(String sessionId, SafetyEvent event) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.warn("SESSION_PAUSE_SUGGESTED trigger={}", event.trigger()));
    }

    @Override
    public void suggestSessionTermination(String sessionId, SafetyEvent event) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.warn("SESSION_TERMINATION_SUGGESTED trigger={} level={}", event.trigger(), event.level()));
    }
}
