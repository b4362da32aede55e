package com.biomirror.common.session;

import com.biomirror.common.session.PhaseSchedule.PhaseTransition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhaseScheduleTest {

    @Test
    void cumulativeDelaysFromConnection() {
        List<PhaseTransition> t = PhaseSchedule.transitionsFrom(
            SessionPhase.CONNECTION, Duration.ofSeconds(1000), Duration.ZERO);

        assertEquals(List.of(
            new PhaseTransition(SessionPhase.AWARENESS, Duration.ofSeconds(150)),
            new PhaseTransition(SessionPhase.INTEGRATION, Duration.ofSeconds(450)),
            new PhaseTransition(SessionPhase.REGULATION, Duration.ofSeconds(750)),
            new PhaseTransition(SessionPhase.TRANSFER, Duration.ofSeconds(900))), t);
    }

    @Test
    void resumeSubtractsTimeAlreadySpent() {
        List<PhaseTransition> t = PhaseSchedule.transitionsFrom(
            SessionPhase.AWARENESS, Duration.ofSeconds(1000), Duration.ofSeconds(100));

        assertEquals(SessionPhase.INTEGRATION, t.get(0).phase());
        assertEquals(Duration.ofSeconds(200), t.get(0).delay());
        assertEquals(Duration.ofSeconds(500), t.get(1).delay());
        assertEquals(3, t.size());
    }

    @Test
    void lastPhaseHasNoTransitions() {
        assertTrue(PhaseSchedule.transitionsFrom(
            SessionPhase.TRANSFER, Duration.ofSeconds(1000), Duration.ZERO).isEmpty());
    }

    @Test
    void allocationsCoverTheWholeSession() {
        double total = 0;
        for (SessionPhase p : SessionPhase.values()) total += p.allocation();
        assertEquals(1.0, total, 1e-9);
    }

    @Test
    void linearNavigation() {
        assertEquals(SessionPhase.AWARENESS, SessionPhase.CONNECTION.next());
        assertNull(SessionPhase.TRANSFER.next());
        assertEquals(SessionPhase.REGULATION, SessionPhase.TRANSFER.previous());
        assertNull(SessionPhase.CONNECTION.previous());
    }
}
