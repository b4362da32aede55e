package com.biomirror.common.safety;

import com.biomirror.common.model.DataQuality;
import com.biomirror.common.model.EmotionType;
import com.biomirror.common.model.IntegratedState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static com.biomirror.common.fixtures.Samples.at;
import static com.biomirror.common.fixtures.Samples.state;
import static org.junit.jupiter.api.Assertions.*;

class SafetyMonitorTest {

    private SafetyMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new SafetyMonitor(SafetyThresholds.defaults());
        monitor.startMonitoring(at(0));
    }

    // ── state builders ────────────────────────────────────────────────────────

    private static IntegratedState calm(Instant t) {
        return state(t, EmotionType.NEUTRAL, 0.4, 0.4, 0.8, 0.1, 75, DataQuality.GOOD);
    }

    private static IntegratedState severeDistress(Instant t) {
        return state(t, EmotionType.FEAR, 0.9, 0.85, 0.7, 0.1, 110, DataQuality.GOOD);
    }

    private static IntegratedState severeDissociation(Instant t) {
        return state(t, EmotionType.DISSOCIATION, 0.3, 0.3, 0.2, 0.85, 65, DataQuality.GOOD);
    }

    private static IntegratedState extremeArousal(Instant t) {
        return state(t, EmotionType.SURPRISE, 0.6, 0.95, 0.6, 0.1, 130, DataQuality.GOOD);
    }

    private static IntegratedState highArousal(Instant t) {
        return state(t, EmotionType.NEUTRAL, 0.5, 0.95, 0.6, 0.1, 90, DataQuality.GOOD);
    }

    // ── per-tick evaluation ───────────────────────────────────────────────────

    @Nested
    @DisplayName("Per-tick evaluation")
    class Evaluation {

        @Test
        @DisplayName("poor or invalid data never changes the level")
        void poorDataSkipped() {
            IntegratedState bad = state(at(1), EmotionType.FEAR, 0.95, 0.95, 0.1, 0.95, 140, DataQuality.POOR);
            SafetyAssessment a = monitor.evaluate(bad);

            assertFalse(a.evaluated());
            assertFalse(a.hasEvent());
            assertEquals(AlertLevel.NONE, monitor.currentLevel());

            IntegratedState invalid = state(at(2), EmotionType.FEAR, 0.95, 0.95, 0.1, 0.95, 140, DataQuality.INVALID);
            assertFalse(monitor.evaluate(invalid).evaluated());
            assertEquals(AlertLevel.NONE, monitor.currentLevel());
        }

        @Test
        @DisplayName("severe distress escalates to HIGH with termination and guardian")
        void severeDistressIsHigh() {
            SafetyAssessment a = monitor.evaluate(severeDistress(at(1)));

            assertEquals(AlertLevel.HIGH, a.level());
            assertEquals(SafetyTrigger.SEVERE_DISTRESS, a.event().trigger());
            assertEquals(List.of(SafetyAction.SESSION_TERMINATION, SafetyAction.GUARDIAN_NOTIFICATION),
                         a.event().actions());
        }

        @Test
        @DisplayName("severe dissociation early in the session only calms")
        void dissociationEarly() {
            SafetyAssessment a = monitor.evaluate(severeDissociation(at(60)));

            assertEquals(AlertLevel.MEDIUM, a.level());
            assertEquals(List.of(SafetyAction.CALMING_INTERVENTION), a.event().actions());
        }

        @Test
        @DisplayName("medium alert after five minutes also notifies the guardian")
        void dissociationLate() {
            SafetyAssessment a = monitor.evaluate(severeDissociation(at(301)));

            assertTrue(a.event().requires(SafetyAction.CALMING_INTERVENTION));
            assertTrue(a.event().requires(SafetyAction.GUARDIAN_NOTIFICATION));
        }

        @Test
        void extremeArousalIsMedium() {
            SafetyAssessment a = monitor.evaluate(extremeArousal(at(1)));

            assertEquals(AlertLevel.MEDIUM, a.level());
            assertEquals(SafetyTrigger.EXTREME_AROUSAL, a.event().trigger());
        }

        @Test
        void prolongedNegativeStateIsLow() {
            SafetyAssessment last = null;
            for (int s = 0; s <= 61; s++) {
                last = monitor.evaluate(state(at(s), EmotionType.SADNESS, 0.7, 0.3, 0.6, 0.1, 70, DataQuality.GOOD));
                if (s <= 60) assertEquals(AlertLevel.NONE, last.level(), "at " + s);
            }
            assertEquals(AlertLevel.LOW, last.level());
            assertEquals(List.of(SafetyAction.THERAPIST_REVIEW), last.event().actions());
        }

        @Test
        @DisplayName("a lower candidate never downgrades an open escalation")
        void noDowngrade() {
            monitor.evaluate(severeDistress(at(1)));
            SafetyAssessment a = monitor.evaluate(severeDissociation(at(2)));

            assertEquals(AlertLevel.HIGH, a.level());
            assertFalse(a.hasEvent());
        }

        @Test
        @DisplayName("level resets only after the configured clear readings")
        void resetAfterClearReadings() {
            monitor.evaluate(extremeArousal(at(0)));
            int needed = SafetyThresholds.defaults().clearReadingsToReset();

            for (int i = 1; i < needed; i++) {
                assertEquals(AlertLevel.MEDIUM, monitor.evaluate(calm(at(i))).level());
            }
            SafetyAssessment reset = monitor.evaluate(calm(at(needed)));
            assertEquals(AlertLevel.NONE, reset.level());
            assertEquals(SafetyTrigger.LEVEL_RESET, reset.event().trigger());
        }

        @Test
        @DisplayName("a trigger inside the hold window restarts the clear count")
        void triggerRestartsClearCount() {
            SafetyMonitor quick = new SafetyMonitor(SafetyThresholds.defaults().withClearReadingsToReset(3));
            quick.startMonitoring(at(0));
            quick.evaluate(extremeArousal(at(0)));
            quick.evaluate(calm(at(1)));
            quick.evaluate(calm(at(2)));
            quick.evaluate(extremeArousal(at(3)));
            quick.evaluate(calm(at(4)));
            quick.evaluate(calm(at(5)));

            assertEquals(AlertLevel.MEDIUM, quick.currentLevel());
            assertEquals(AlertLevel.NONE, quick.evaluate(calm(at(6))).level());
        }

        @Test
        @DisplayName("level never decreases except through an explicit reset")
        void monotonicEscalation() {
            Random rnd = new Random(2026);
            AlertLevel previous = AlertLevel.NONE;
            for (int i = 0; i < 2000; i++) {
                Instant t = at(i * 0.2);
                IntegratedState s = switch (rnd.nextInt(6)) {
                    case 0 -> severeDistress(t);
                    case 1 -> severeDissociation(t);
                    case 2 -> extremeArousal(t);
                    case 3 -> state(t, EmotionType.ANGER, 0.9, 0.9, 0.3, 0.9, 140, DataQuality.POOR);
                    default -> calm(t);
                };
                SafetyAssessment a = monitor.evaluate(s);
                if (a.level().compareTo(previous) < 0) {
                    assertTrue(a.hasEvent(), "downgrade without event at tick " + i);
                    assertEquals(SafetyTrigger.LEVEL_RESET, a.event().trigger());
                    assertEquals(AlertLevel.NONE, a.level());
                }
                previous = a.level();
            }
        }
    }

    // ── needsIntervention ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("Intervention check")
    class Intervention {

        @Test
        @DisplayName("sustained arousal beyond 120s requires intervention and alerts guardian once")
        void sustainedArousal() {
            int events = 0;
            for (int s = 0; s <= 130; s++) {
                SafetyCheck check = monitor.needsIntervention(highArousal(at(s)));
                assertEquals(s > 120, check.required(), "at " + s);
                if (check.hasEvent()) {
                    events++;
                    assertEquals(121, s);
                    assertTrue(check.event().requires(SafetyAction.MANDATORY_INTERVENTION));
                    assertTrue(check.event().requires(SafetyAction.GUARDIAN_NOTIFICATION));
                }
            }
            assertEquals(1, events);

            monitor.needsIntervention(calm(at(131)));
            SafetyCheck again = null;
            for (int s = 132; s <= 260; s++) {
                SafetyCheck c = monitor.needsIntervention(highArousal(at(s)));
                if (c.hasEvent()) again = c;
            }
            assertNotNull(again);
            assertTrue(again.event().requires(SafetyAction.MANDATORY_INTERVENTION));
            assertFalse(again.event().requires(SafetyAction.GUARDIAN_NOTIFICATION));
        }

        @Test
        void severeDissociationRequiresInterventionImmediately() {
            SafetyCheck check = monitor.needsIntervention(severeDissociation(at(1)));

            assertTrue(check.required());
            assertEquals(List.of(SafetyAction.MANDATORY_INTERVENTION), check.event().actions());
            assertFalse(monitor.needsIntervention(severeDissociation(at(2))).hasEvent());
        }
    }

    // ── shouldTerminateSession ────────────────────────────────────────────────

    @Nested
    @DisplayName("Termination check")
    class Termination {

        @Test
        @DisplayName("therapist alert fires exactly once while the condition holds")
        void idempotentAlert() {
            int alerts = 0;
            int trueCount = 0;
            for (int s = 0; s <= 300; s++) {
                SafetyCheck check = monitor.shouldTerminateSession(highArousal(at(s)));
                if (check.required()) trueCount++;
                if (check.hasEvent()) {
                    alerts++;
                    assertEquals(List.of(SafetyAction.THERAPIST_ALERT), check.event().actions());
                }
            }
            assertEquals(1, alerts);
            assertEquals(300 - 240, trueCount);
        }

        @Test
        @DisplayName("poor data repeats the last answer without alerting")
        void poorDataLatches() {
            for (int s = 0; s <= 241; s++) {
                monitor.shouldTerminateSession(highArousal(at(s)));
            }
            IntegratedState bad = state(at(242), EmotionType.NEUTRAL, 0.1, 0.1, 0.1, 0.1, 60, DataQuality.INVALID);
            SafetyCheck check = monitor.shouldTerminateSession(bad);

            assertTrue(check.required());
            assertFalse(check.hasEvent());
        }

        @Test
        void persistentDissociationTerminates() {
            SafetyCheck last = null;
            for (int s = 0; s <= 30; s++) {
                last = monitor.shouldTerminateSession(severeDissociation(at(s)));
                if (s < 30) assertFalse(last.required(), "at " + s);
            }
            assertTrue(last.required());
            assertEquals(SafetyTrigger.PERSISTENT_DISSOCIATION, last.event().trigger());
        }

        @Test
        void resetClearsLatches() {
            for (int s = 0; s <= 241; s++) {
                monitor.shouldTerminateSession(highArousal(at(s)));
            }
            monitor.reset();
            assertFalse(monitor.shouldTerminateSession(highArousal(at(242))).required());
            assertEquals(AlertLevel.NONE, monitor.currentLevel());
        }
    }

    @Nested
    @DisplayName("Resume after pause")
    class ResumeAfterPause {

        @Test
        @DisplayName("a paused span never counts toward sustained distress")
        void pausedSpanExcluded() {
            for (int s = 0; s <= 2; s++) {
                monitor.shouldTerminateSession(highArousal(at(s)));
            }
            monitor.resumeAfterPause(Duration.ofSeconds(300));

            SafetyCheck check = monitor.shouldTerminateSession(highArousal(at(302.6)));

            assertFalse(check.required());
            assertFalse(check.hasEvent());
        }

        @Test
        @DisplayName("arousal observed before and after the pause still adds up")
        void observedTimeAccumulates() {
            for (int s = 0; s <= 100; s++) {
                monitor.shouldTerminateSession(highArousal(at(s)));
            }
            monitor.resumeAfterPause(Duration.ofSeconds(300));

            assertFalse(monitor.shouldTerminateSession(highArousal(at(540))).required());
            SafetyCheck check = monitor.shouldTerminateSession(highArousal(at(541)));
            assertTrue(check.required());
            assertEquals(SafetyTrigger.SUSTAINED_DISTRESS, check.event().trigger());
        }

        @Test
        @DisplayName("the guardian grace period counts active time only")
        void guardianGraceShifted() {
            monitor.resumeAfterPause(Duration.ofSeconds(400));

            SafetyAssessment a = monitor.evaluate(severeDissociation(at(350)));

            assertEquals(AlertLevel.MEDIUM, a.level());
            assertEquals(List.of(SafetyAction.CALMING_INTERVENTION), a.event().actions());
        }
    }
}
