package com.biomirror.orchestrator.fusion;

import com.biomirror.common.fusion.StateFusionCalculator;
import com.biomirror.common.model.FacialSample;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.model.PhysiologicalSample;
import com.biomirror.orchestrator.feed.SessionFeeds;
import com.biomirror.orchestrator.timer.SessionTimers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Fuses the latest facial and physiological samples into one {@link IntegratedState}
 * on a fixed tick.
 *
 * <p>Sensor callbacks write single-slot "latest value" cells from their own threads;
 * a new sample overwrites the previous one. The tick reads both cells, fuses them and
 * delivers the state synchronously: first to the state feed, then to every registered
 * listener in registration order. A tick with either cell empty emits nothing.
 *
 * <p>Each cell carries a version counter so the tick can tell whether anything arrived
 * since the last fused pair. What happens on a stale tick is decided by the
 * {@link StalenessPolicy}.
 */
public class StateFusionEngine {

    private static final Logger log = LoggerFactory.getLogger(StateFusionEngine.class);

    public static final String TICK_TIMER = "fusion-tick";

    private final SessionTimers timers;
    private final SessionFeeds feeds;
    private final Duration tickInterval;
    private final StalenessPolicy stalenessPolicy;

    private final AtomicReference<FacialSample> latestFacial = new AtomicReference<>();
    private final AtomicReference<PhysiologicalSample> latestPhysiological = new AtomicReference<>();
    private final AtomicLong facialVersion = new AtomicLong();
    private final AtomicLong physiologicalVersion = new AtomicLong();

    private final List<Consumer<IntegratedState>> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean running;

    // tick-owned, guarded by the timer lock
    private long lastFusedFacialVersion = -1;
    private long lastFusedPhysiologicalVersion = -1;
    private long emittedStates;
    private long staleTicks;

    public StateFusionEngine(SessionTimers timers, SessionFeeds feeds,
                             Duration tickInterval, StalenessPolicy stalenessPolicy) {
        this.timers          = timers;
        this.feeds           = feeds;
        this.tickInterval    = tickInterval;
        this.stalenessPolicy = stalenessPolicy;
    }

    // ── inbound ───────────────────────────────────────────────────────────────

    /** Overwrites the facial cell. Ignored while the engine is stopped. */
    public void submitFacialSample(FacialSample sample) {
        if (!running || sample == null) return;
        latestFacial.set(sample);
        facialVersion.incrementAndGet();
    }

    /** Overwrites the physiological cell. Ignored while the engine is stopped. */
    public void submitPhysiologicalSample(PhysiologicalSample sample) {
        if (!running || sample == null) return;
        latestPhysiological.set(sample);
        physiologicalVersion.incrementAndGet();
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    public void start() {
        timers.exclusive(() -> {
            clearCells();
            running = true;
            timers.schedulePeriodically(TICK_TIMER, tickInterval, this::tick);
            log.info("FUSION_STARTED tickMs={} stalenessPolicy={}", tickInterval.toMillis(), stalenessPolicy);
        });
    }

    /** Cancels the tick and empties both cells. No state is emitted after this returns. */
    public void stop() {
        timers.exclusive(() -> {
            running = false;
            timers.cancel(TICK_TIMER);
            clearCells();
            log.info("FUSION_STOPPED emitted={} staleTicks={}", emittedStates, staleTicks);
        });
    }

    private void clearCells() {
        latestFacial.set(null);
        latestPhysiological.set(null);
        lastFusedFacialVersion = -1;
        lastFusedPhysiologicalVersion = -1;
    }

    public boolean isRunning() {
        return running;
    }

    public void addListener(Consumer<IntegratedState> listener) {
        listeners.add(listener);
    }

    public long emittedStates() {
        return emittedStates;
    }

    public long staleTicks() {
        return staleTicks;
    }

    // ── tick ──────────────────────────────────────────────────────────────────

    void tick() {
        if (!running) return;

        // versions are read before the cells so a concurrent submit is never lost
        long fv = facialVersion.get();
        long pv = physiologicalVersion.get();
        FacialSample facial = latestFacial.get();
        PhysiologicalSample physiological = latestPhysiological.get();
        if (facial == null || physiological == null) {
            return;
        }

        boolean stale = fv == lastFusedFacialVersion && pv == lastFusedPhysiologicalVersion;
        if (stale) {
            staleTicks++;
            if (stalenessPolicy == StalenessPolicy.SKIP_STALE) {
                log.debug("FUSION_TICK_SKIPPED_STALE staleTicks={}", staleTicks);
                return;
            }
            log.debug("FUSION_TICK_STALE holding last pair staleTicks={}", staleTicks);
        }
        lastFusedFacialVersion = fv;
        lastFusedPhysiologicalVersion = pv;

        IntegratedState state = StateFusionCalculator.fuse(facial, physiological, timers.now());
        emittedStates++;
        log.debug("STATE_FUSED emotion={} coherence={} dissociation={} quality={}",
                  state.dominantEmotion(), state.coherenceIndex(), state.dissociationIndex(), state.dataQuality());

        feeds.publishState(state);
        for (Consumer<IntegratedState> listener : listeners) {
            if (!running) break;
            try {
                listener.accept(state);
            } catch (RuntimeException e) {
                log.warn("FUSION_LISTENER_FAILED listener={} error={}", listener, e.getMessage(), e);
            }
        }
    }
}
