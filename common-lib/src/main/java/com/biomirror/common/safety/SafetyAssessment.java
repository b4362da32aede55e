package com.biomirror.common.safety;

/**
 * Result of one per-tick {@link SafetyMonitor#evaluate} call.
 *
 * @param level     alert level after the evaluation
 * @param event     escalation or reset raised on this tick, {@code null} when nothing changed
 * @param evaluated {@code false} when the tick was skipped for poor data quality
 */
public record SafetyAssessment(AlertLevel level, SafetyEvent event, boolean evaluated) {

    public static SafetyAssessment skipped(AlertLevel level) {
        return new SafetyAssessment(level, null, false);
    }

    public boolean hasEvent() {
        return event != null;
    }
}
