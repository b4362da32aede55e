package com.biomirror.orchestrator.scheduler;

import com.biomirror.common.dissociation.DissociationSeverity;
import com.biomirror.common.dissociation.DissociationStatus;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.response.ResponseGenerator;
import com.biomirror.common.response.ResponseTriggerPolicy;
import com.biomirror.common.response.StateChange;
import com.biomirror.common.response.TherapeuticResponse;
import com.biomirror.common.session.SessionPhase;
import com.biomirror.orchestrator.feed.SessionFeeds;
import com.biomirror.orchestrator.timer.SessionTimers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Turns the fused-state stream into a throttled, non-overlapping sequence of
 * {@link TherapeuticResponse}s for the companion character.
 *
 * <p>Responses are queued on {@link #onState} and delivered by a periodic dequeue tick.
 * A delivered response stays active for its declared duration; nothing is dequeued
 * while one is active or before {@link ResponseTriggerPolicy#responseDelay()} has
 * passed since the previous delivery.
 *
 * <p>Queue discipline:
 * <ul>
 *   <li>at most {@code maxQueued} entries; when full, the oldest non-safety entry is dropped</li>
 *   <li>safety responses go to the head and are not duplicated while one is queued or active</li>
 *   <li>a severity escalation of an active dissociation episode queues a grounding response</li>
 * </ul>
 *
 * <p>All methods run under the session timer lock: {@link #onState} from the fusion
 * tick, the dequeue tick from its own timer.
 */
public class ResponseScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResponseScheduler.class);

    public static final String TICK_TIMER = "response-tick";

    private record QueuedResponse(TherapeuticResponse response, boolean safety) {}

    private final SessionTimers timers;
    private final SessionFeeds feeds;
    private final ResponseGenerator generator;
    private final ResponseTriggerPolicy policy;
    private final Duration tickInterval;
    private final int maxQueued;

    private final Deque<QueuedResponse> queue = new ArrayDeque<>();
    private Consumer<TherapeuticResponse> deliveryListener = response -> { };
    private boolean running;

    private IntegratedState previous;
    private DissociationSeverity lastSeverity;
    private TherapeuticResponse active;
    private boolean activeIsSafety;
    private Instant lastDeliveredAt;
    private long dropped;

    public ResponseScheduler(SessionTimers timers, SessionFeeds feeds, ResponseGenerator generator,
                             ResponseTriggerPolicy policy, Duration tickInterval, int maxQueued) {
        this.timers       = timers;
        this.feeds        = feeds;
        this.generator    = generator;
        this.policy       = policy;
        this.tickInterval = tickInterval;
        this.maxQueued    = Math.max(1, maxQueued);
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    public void start(Consumer<TherapeuticResponse> listener) {
        timers.exclusive(() -> {
            clear();
            this.deliveryListener = listener != null ? listener : response -> { };
            running = true;
            timers.schedulePeriodically(TICK_TIMER, tickInterval, this::tick);
            log.info("RESPONSE_SCHEDULER_STARTED tickMs={} delayMs={} maxQueued={}",
                     tickInterval.toMillis(), policy.responseDelay().toMillis(), maxQueued);
        });
    }

    /** Cancels the dequeue tick and discards queued and active responses. */
    public void stop() {
        timers.exclusive(() -> {
            running = false;
            timers.cancel(TICK_TIMER);
            if (!queue.isEmpty()) {
                log.debug("RESPONSE_QUEUE_DISCARDED size={}", queue.size());
            }
            clear();
        });
    }

    private void clear() {
        queue.clear();
        previous        = null;
        lastSeverity    = null;
        active          = null;
        activeIsSafety  = false;
        lastDeliveredAt = null;
    }

    // ── intake ────────────────────────────────────────────────────────────────

    /**
     * Offers one fused state. A pending safety intervention always yields a safety
     * response; otherwise a grounding response on dissociation escalation, or a
     * phase response when the change since the previous state is significant and
     * passes the trigger policy.
     */
    public void onState(IntegratedState state, SessionPhase phase,
                        DissociationStatus dissociation, boolean safetyPending) {
        timers.exclusive(() -> {
            if (!running) return;
            Instant now = state.timestamp();
            boolean escalated = trackSeverity(dissociation);
            IntegratedState before = previous;
            previous = state;

            if (safetyPending) {
                if (safetyOutstanding(now)) {
                    log.debug("SAFETY_RESPONSE_ALREADY_PENDING");
                } else {
                    enqueue(generator.generate(state, phase, dissociation, true, now), true);
                }
                return;
            }
            if (escalated) {
                enqueue(generator.groundingResponse(dissociation, now), false);
                return;
            }
            if (before == null) return;

            StateChange change = StateChange.between(before, state);
            if (change.isSignificant() && policy.shouldRespond(change)) {
                enqueue(generator.generate(state, phase, dissociation, false, now), false);
            }
        });
    }

    private boolean trackSeverity(DissociationStatus dissociation) {
        if (dissociation == null || !dissociation.isActive()) {
            lastSeverity = null;
            return false;
        }
        DissociationSeverity severity = dissociation.severity();
        boolean escalated = dissociation.isConfirmedEpisode()
                            && (lastSeverity == null || !lastSeverity.isAtLeast(severity));
        lastSeverity = severity;
        return escalated;
    }

    private boolean safetyOutstanding(Instant now) {
        if (active != null && activeIsSafety && now.isBefore(active.endsAt())) {
            return true;
        }
        return queue.stream().anyMatch(QueuedResponse::safety);
    }

    private void enqueue(TherapeuticResponse response, boolean safety) {
        if (queue.size() >= maxQueued && !dropOldestNonSafety()) {
            log.debug("RESPONSE_DROPPED type={} reason=queue-full", response.responseType());
            dropped++;
            return;
        }
        if (safety) {
            queue.addFirst(new QueuedResponse(response, true));
        } else {
            queue.addLast(new QueuedResponse(response, false));
        }
        log.debug("RESPONSE_QUEUED type={} safety={} queued={}", response.responseType(), safety, queue.size());
    }

    private boolean dropOldestNonSafety() {
        Iterator<QueuedResponse> it = queue.iterator();
        while (it.hasNext()) {
            QueuedResponse queued = it.next();
            if (!queued.safety()) {
                it.remove();
                dropped++;
                log.debug("RESPONSE_DROPPED type={} reason=superseded", queued.response().responseType());
                return true;
            }
        }
        return false;
    }

    // ── delivery ──────────────────────────────────────────────────────────────

    void tick() {
        if (!running) return;
        Instant now = timers.now();

        if (active != null) {
            if (now.isBefore(active.endsAt())) return;
            active = null;
            activeIsSafety = false;
        }
        if (lastDeliveredAt != null
            && Duration.between(lastDeliveredAt, now).compareTo(policy.responseDelay()) < 0) {
            return;
        }
        QueuedResponse next = queue.pollFirst();
        if (next == null) return;

        TherapeuticResponse delivered = next.response().withTimestamp(now);
        active          = delivered;
        activeIsSafety  = next.safety();
        lastDeliveredAt = now;
        log.debug("RESPONSE_DELIVERED type={} level={} durationMs={}",
                  delivered.responseType(), delivered.interventionLevel(), delivered.duration().toMillis());

        feeds.publishResponse(delivered);
        try {
            deliveryListener.accept(delivered);
        } catch (RuntimeException e) {
            log.warn("RESPONSE_LISTENER_FAILED type={} error={}", delivered.responseType(), e.getMessage(), e);
        }
    }

    // ── inspection ────────────────────────────────────────────────────────────

    public int queuedCount() {
        return timers.exclusive(queue::size);
    }

    public long droppedCount() {
        return dropped;
    }

    public boolean isResponseActive() {
        return timers.exclusive(() -> active != null && timers.now().isBefore(active.endsAt()));
    }
}
