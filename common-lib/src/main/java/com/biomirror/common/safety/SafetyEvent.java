package com.biomirror.common.safety;

import com.biomirror.common.model.IntegratedState;

import java.time.Instant;
import java.util.List;

/**
 * Escalation, reset or one-time alert raised by the {@link SafetyMonitor}.
 *
 * @param timestamp time of the state that raised the event
 * @param level     alert level after the event
 * @param trigger   condition that fired
 * @param actions   side effects to perform, in order
 * @param state     state snapshot that raised the event
 */
public record SafetyEvent(
    Instant timestamp,
    AlertLevel level,
    SafetyTrigger trigger,
    List<SafetyAction> actions,
    IntegratedState state
) {
    public SafetyEvent {
        actions = List.copyOf(actions);
    }

    public boolean requires(SafetyAction action) {
        return actions.contains(action);
    }
}
