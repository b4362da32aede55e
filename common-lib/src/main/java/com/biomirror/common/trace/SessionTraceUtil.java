package com.biomirror.common.trace;

import org.slf4j.MDC;

/**
 * Bridges the session id into MDC for the duration of a log statement.
 *
 * <p>MDC is written only around {@code logAction} and removed afterwards, so
 * timer threads never carry a stale session id.
 *
 * <pre>
 *     SessionTraceUtil.withMdc(session.getId(), () -> log.info("..."));
 * </pre>
 */
public final class SessionTraceUtil {

    public static final String SESSION_ID_KEY = "sessionId";

    private SessionTraceUtil() {}

    /**
     * Runs {@code logAction} with {@code sessionId} in MDC, restoring any previous value.
     *
     * @param sessionId the session id to expose to the log pattern, {@code null} for none
     * @param logAction the log statement to execute
     */
    public static void withMdc(String sessionId, Runnable logAction) {
        String previous = MDC.get(SESSION_ID_KEY);
        if (sessionId != null) {
            MDC.put(SESSION_ID_KEY, sessionId);
        }
        try {
            logAction.run();
        } finally {
            if (previous != null) {
                MDC.put(SESSION_ID_KEY, previous);
            } else {
                MDC.remove(SESSION_ID_KEY);
            }
        }
    }
}
