package com.biomirror.orchestrator.timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owner of every session timer and the single clock the pipeline reads.
 *
 * <p>Each timer is registered under a name and runs on the injected Reactor
 * {@link Scheduler}. Timer callbacks and control operations run under one
 * reentrant lock, and a callback checks its own cancellation flag after acquiring
 * the lock. Once {@link #cancel(String)} or {@link #cancelAll()} returns, a
 * cancelled callback cannot run even if its thread was already waiting.
 *
 * <p>Production uses a single-threaded scheduler; tests pass a
 * {@code VirtualTimeScheduler} and drive time explicitly.
 */
public class SessionTimers {

    private static final Logger log = LoggerFactory.getLogger(SessionTimers.class);

    private final Scheduler scheduler;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TimerHandle> timers = new ConcurrentHashMap<>();

    public SessionTimers(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /** Current time on the scheduler's clock. */
    public Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    // ── scheduling ────────────────────────────────────────────────────────────

    /**
     * Runs {@code task} every {@code period}, first after one period. Replaces any
     * timer already registered under {@code name}.
     */
    public TimerHandle schedulePeriodically(String name, Duration period, Runnable task) {
        return exclusive(() -> {
            cancel(name);
            TimerHandle handle = new TimerHandle(name);
            handle.disposable = scheduler.schedulePeriodically(
                () -> runGuarded(handle, task, false),
                period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
            timers.put(name, handle);
            log.debug("TIMER_SCHEDULED name={} periodMs={}", name, period.toMillis());
            return handle;
        });
    }

    /** Runs {@code task} once after {@code delay}. Replaces any timer under {@code name}. */
    public TimerHandle scheduleOnce(String name, Duration delay, Runnable task) {
        return exclusive(() -> {
            cancel(name);
            TimerHandle handle = new TimerHandle(name);
            handle.disposable = scheduler.schedule(
                () -> runGuarded(handle, task, true),
                Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
            timers.put(name, handle);
            log.debug("TIMER_SCHEDULED name={} delayMs={}", name, delay.toMillis());
            return handle;
        });
    }

    // ── cancellation ──────────────────────────────────────────────────────────

    public void cancel(String name) {
        exclusive(() -> {
            TimerHandle handle = timers.remove(name);
            if (handle != null) {
                handle.cancel();
            }
        });
    }

    /** Cancels every timer whose name starts with {@code prefix}. */
    public void cancelPrefix(String prefix) {
        exclusive(() -> List.copyOf(timers.keySet()).stream()
            .filter(name -> name.startsWith(prefix))
            .forEach(this::cancel));
    }

    public void cancelAll() {
        exclusive(() -> List.copyOf(timers.keySet()).forEach(this::cancel));
    }

    public boolean isScheduled(String name) {
        return timers.containsKey(name);
    }

    public int activeCount() {
        return timers.size();
    }

    // ── mutual exclusion ──────────────────────────────────────────────────────

    /** Runs {@code action} while holding the timer lock. */
    public void exclusive(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void runGuarded(TimerHandle handle, Runnable task, boolean oneShot) {
        lock.lock();
        try {
            if (handle.cancelled) {
                return;
            }
            if (oneShot) {
                timers.remove(handle.name, handle);
            }
            task.run();
        } catch (RuntimeException e) {
            log.error("TIMER_CALLBACK_FAILED name={}", handle.name, e);
        } finally {
            lock.unlock();
        }
    }

    /** Cancellation token for one registered timer. */
    public static final class TimerHandle {

        private final String name;
        private volatile boolean cancelled;
        private volatile Disposable disposable;

        private TimerHandle(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public boolean isCancelled() {
            return cancelled;
        }

        void cancel() {
            cancelled = true;
            Disposable d = disposable;
            if (d != null) {
                d.dispose();
            }
        }
    }
}
