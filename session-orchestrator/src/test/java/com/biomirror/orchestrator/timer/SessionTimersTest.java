package com.biomirror.orchestrator.timer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionTimersTest {

    private VirtualTimeScheduler clock;
    private SessionTimers timers;

    @BeforeEach
    void setUp() {
        clock  = VirtualTimeScheduler.create();
        timers = new SessionTimers(clock);
    }

    @AfterEach
    void tearDown() {
        timers.cancelAll();
        clock.dispose();
    }

    // ── scheduling ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        @Test
        @DisplayName("periodic timer fires once per period, first after one period")
        void periodicFiresEveryPeriod() {
            AtomicInteger count = new AtomicInteger();
            timers.schedulePeriodically("tick", Duration.ofMillis(200), count::incrementAndGet);

            clock.advanceTimeBy(Duration.ofMillis(199));
            assertEquals(0, count.get());

            clock.advanceTimeBy(Duration.ofMillis(801));
            assertEquals(5, count.get());
        }

        @Test
        @DisplayName("callbacks see the scheduler clock at their due time")
        void clockFollowsScheduler() {
            List<Instant> seen = new ArrayList<>();
            timers.schedulePeriodically("tick", Duration.ofMillis(500), () -> seen.add(timers.now()));

            clock.advanceTimeBy(Duration.ofSeconds(1));

            assertEquals(List.of(Instant.ofEpochMilli(500), Instant.ofEpochMilli(1000)), seen);
        }

        @Test
        @DisplayName("one-shot timer fires once and deregisters itself")
        void oneShotDeregisters() {
            AtomicInteger count = new AtomicInteger();
            timers.scheduleOnce("once", Duration.ofSeconds(2), count::incrementAndGet);
            assertTrue(timers.isScheduled("once"));

            clock.advanceTimeBy(Duration.ofSeconds(10));

            assertEquals(1, count.get());
            assertFalse(timers.isScheduled("once"));
            assertEquals(0, timers.activeCount());
        }

        @Test
        @DisplayName("scheduling under an existing name replaces the previous timer")
        void sameNameReplaces() {
            AtomicInteger first = new AtomicInteger();
            AtomicInteger second = new AtomicInteger();
            timers.scheduleOnce("job", Duration.ofSeconds(1), first::incrementAndGet);
            timers.scheduleOnce("job", Duration.ofSeconds(3), second::incrementAndGet);

            clock.advanceTimeBy(Duration.ofSeconds(5));

            assertEquals(0, first.get());
            assertEquals(1, second.get());
        }

        @Test
        @DisplayName("a failing callback is logged and the periodic timer keeps running")
        void failingCallbackKeepsRunning() {
            AtomicInteger attempts = new AtomicInteger();
            timers.schedulePeriodically("flaky", Duration.ofMillis(100), () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("boom");
            });

            clock.advanceTimeBy(Duration.ofMillis(500));

            assertEquals(5, attempts.get());
            assertTrue(timers.isScheduled("flaky"));
        }
    }

    // ── cancellation ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancelled timer never fires")
        void cancelledNeverFires() {
            AtomicInteger count = new AtomicInteger();
            timers.schedulePeriodically("tick", Duration.ofMillis(100), count::incrementAndGet);
            clock.advanceTimeBy(Duration.ofMillis(300));

            timers.cancel("tick");
            clock.advanceTimeBy(Duration.ofSeconds(5));

            assertEquals(3, count.get());
            assertFalse(timers.isScheduled("tick"));
        }

        @Test
        @DisplayName("cancelPrefix removes only matching timers")
        void cancelPrefixMatchesOnly() {
            AtomicInteger phases = new AtomicInteger();
            AtomicInteger other = new AtomicInteger();
            timers.scheduleOnce("phase-awareness", Duration.ofSeconds(1), phases::incrementAndGet);
            timers.scheduleOnce("phase-integration", Duration.ofSeconds(2), phases::incrementAndGet);
            timers.scheduleOnce("session-duration", Duration.ofSeconds(3), other::incrementAndGet);

            timers.cancelPrefix("phase-");
            clock.advanceTimeBy(Duration.ofSeconds(5));

            assertEquals(0, phases.get());
            assertEquals(1, other.get());
        }

        @Test
        @DisplayName("a callback cancelling a timer due at the same instant prevents it from running")
        void cancelFromCallbackWins() {
            AtomicInteger victim = new AtomicInteger();
            timers.scheduleOnce("first", Duration.ofSeconds(1), () -> timers.cancel("second"));
            timers.scheduleOnce("second", Duration.ofSeconds(1), victim::incrementAndGet);

            clock.advanceTimeBy(Duration.ofSeconds(2));

            assertEquals(0, victim.get());
        }

        @Test
        @DisplayName("cancelAll leaves nothing scheduled and marks handles cancelled")
        void cancelAllClearsEverything() {
            SessionTimers.TimerHandle handle =
                timers.schedulePeriodically("a", Duration.ofMillis(100), () -> { });
            timers.scheduleOnce("b", Duration.ofSeconds(1), () -> { });

            timers.cancelAll();

            assertEquals(0, timers.activeCount());
            assertTrue(handle.isCancelled());
        }
    }
}
