package com.biomirror.orchestrator.session;

/**
 * Coordinator lifecycle: {@code PREPARING → ACTIVE ⇄ PAUSED → COMPLETED},
 * or {@code ERROR} when startup fails.
 */
public enum SessionStatus {
    PREPARING,
    ACTIVE,
    PAUSED,
    COMPLETED,
    ERROR;

    public boolean isLive() {
        return this == ACTIVE || this == PAUSED;
    }
}
