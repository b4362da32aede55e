package com.biomirror.common.safety;

/**
 * Result of the duration-based checks.
 *
 * @param required whether the condition currently holds
 * @param event    one-time event raised on this call, {@code null} otherwise
 */
public record SafetyCheck(boolean required, SafetyEvent event) {

    public static final SafetyCheck CLEAR = new SafetyCheck(false, null);

    public boolean hasEvent() {
        return event != null;
    }
}
