package com.biomirror.common.exception;

/**
 * Raised by session start when a required component could not be started.
 * Components started before the failure have already been rolled back.
 */
public class SessionStartException extends RuntimeException {
    private final String component;

    public SessionStartException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SessionStartException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
