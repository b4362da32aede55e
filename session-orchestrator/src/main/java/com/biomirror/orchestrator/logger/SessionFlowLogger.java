package com.biomirror.orchestrator.logger;

import com.biomirror.common.response.TherapeuticResponse;
import com.biomirror.common.safety.SafetyEvent;
import com.biomirror.common.trace.SessionTraceUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Observability for the session lifecycle. Logs each stage without touching
 * pipeline behavior; every method is a pure side effect.
 *
 * <p>Lifecycle stages:
 * <ol>
 *   <li>{@link #SESSION_STARTED}    sensors, fusion and response delivery running</li>
 *   <li>{@link #PHASE_ADVANCED}     phase timer fired or phase set explicitly</li>
 *   <li>{@link #SESSION_PAUSED}     ingestion and timers stopped, session state kept</li>
 *   <li>{@link #SESSION_RESUMED}    ingestion and timers restarted with the remaining budget</li>
 *   <li>{@link #SAFETY_ESCALATED}   safety event raised on good data</li>
 *   <li>{@link #RESPONSE_DELIVERED} character response handed to presentation</li>
 *   <li>{@link #SESSION_ENDED}      timers cancelled, metrics finalized</li>
 *   <li>{@link #STARTUP_FAILED}     start rolled back, session in error</li>
 * </ol>
 */
@Component
public class SessionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(SessionFlowLogger.class);

    public static final String SESSION_STARTED    = "SESSION_STARTED";
    public static final String PHASE_ADVANCED     = "PHASE_ADVANCED";
    public static final String SESSION_PAUSED     = "SESSION_PAUSED";
    public static final String SESSION_RESUMED    = "SESSION_RESUMED";
    public static final String SAFETY_ESCALATED   = "SAFETY_ESCALATED";
    public static final String RESPONSE_DELIVERED = "RESPONSE_DELIVERED";
    public static final String SESSION_ENDED      = "SESSION_ENDED";
    public static final String STARTUP_FAILED     = "STARTUP_FAILED";

    /**
     * Logs a lifecycle stage with one extra detail, e.g. the new phase or the end reason.
     */
    public void stage(String stageName, String sessionId, Object detail) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.info("[SessionFlow] stage={} sessionId={} detail={}", stageName, sessionId, detail)
        );
    }

    public void safety(String sessionId, SafetyEvent event) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.warn("[SessionFlow] stage={} sessionId={} level={} trigger={} actions={}",
                     SAFETY_ESCALATED, sessionId, event.level(), event.trigger(), event.actions())
        );
    }

    public void response(String sessionId, TherapeuticResponse response) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.info("[SessionFlow] stage={} sessionId={} type={} level={} emotion={}",
                     RESPONSE_DELIVERED, sessionId, response.responseType(),
                     response.interventionLevel(), response.characterEmotion())
        );
    }

    public void startupFailed(String sessionId, String component, Throwable cause) {
        SessionTraceUtil.withMdc(sessionId, () ->
            log.error("[SessionFlow] stage={} sessionId={} component={} error={}",
                      STARTUP_FAILED, sessionId, component, cause.getMessage())
        );
    }
}
