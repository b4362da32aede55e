package com.biomirror.orchestrator.notification;

import com.biomirror.common.safety.SafetyEvent;

/**
 * Outbound safety notifications to the people around the user. Delivery transport
 * (push, SMS, dashboard) belongs to the implementation.
 */
public interface SafetyNotificationPublisher {

    void notifyGuardian(String sessionId, SafetyEvent event);

    void alertTherapist(String sessionId, SafetyEvent event);

    void flagForTherapistReview(String sessionId, SafetyEvent event);

    void suggestSessionPause(String sessionId, SafetyEvent event);

    void suggestSessionTermination(String sessionId, SafetyEvent event);
}
