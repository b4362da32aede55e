package com.biomirror.common.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts phase allocations into one-shot transition delays.
 */
public final class PhaseSchedule {

    /** A deferred move into {@code phase} after {@code delay}. */
    public record PhaseTransition(SessionPhase phase, Duration delay) {}

    private PhaseSchedule() {}

    /**
     * Transitions for every phase after {@code current}, with delays accumulated
     * from the current phase's allocation. {@code elapsedInCurrent} is time already
     * spent in the current phase (non-zero after a resume).
     */
    public static List<PhaseTransition> transitionsFrom(SessionPhase current, Duration total,
                                                        Duration elapsedInCurrent) {
        List<PhaseTransition> transitions = new ArrayList<>();
        long cumulativeMillis = -elapsedInCurrent.toMillis();
        SessionPhase phase = current;
        while (phase.next() != null) {
            cumulativeMillis += allocationOf(phase, total).toMillis();
            SessionPhase next = phase.next();
            transitions.add(new PhaseTransition(next, Duration.ofMillis(Math.max(0, cumulativeMillis))));
            phase = next;
        }
        return transitions;
    }

    public static Duration allocationOf(SessionPhase phase, Duration total) {
        return Duration.ofMillis(Math.round(total.toMillis() * phase.allocation()));
    }
}
