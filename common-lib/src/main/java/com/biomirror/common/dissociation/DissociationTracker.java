package com.biomirror.common.dissociation;

import com.biomirror.common.model.IntegratedState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Episode detector over the fused-state stream.
 *
 * <p>State machine: {@code idle → active(start, maxIntensity) → idle}. An episode
 * opens when the dissociation index rises above {@value #EPISODE_THRESHOLD} and
 * closes when it falls back to or below it. Closed episodes shorter than
 * {@link #MILD_DURATION} are discarded; longer ones are kept in a history bounded
 * to the last {@value #HISTORY_LIMIT}.
 *
 * <p>Not thread-safe. Invoked in-line on the fusion tick.
 */
public class DissociationTracker {

    private static final Logger log = LoggerFactory.getLogger(DissociationTracker.class);

    public static final double EPISODE_THRESHOLD = 0.6;
    public static final int HISTORY_LIMIT = 20;

    public static final Duration MILD_DURATION     = Duration.ofSeconds(5);
    public static final Duration MODERATE_DURATION = Duration.ofSeconds(30);
    public static final Duration SEVERE_DURATION   = Duration.ofSeconds(120);

    /** Peak intensity that makes a recorded episode moderate regardless of duration. */
    public static final double MODERATE_PEAK = 0.8;

    /** Peak intensity that makes a recorded episode severe regardless of duration. */
    public static final double SEVERE_PEAK = 0.9;

    private boolean inEpisode;
    private Instant episodeStart;
    private double maxIntensity;
    private final Deque<DissociationEpisode> history = new ArrayDeque<>();

    /**
     * Advances the state machine with one fused state.
     */
    public DissociationStatus process(IntegratedState state) {
        double index = state.dissociationIndex();
        Instant now  = state.timestamp();

        if (index > EPISODE_THRESHOLD) {
            if (!inEpisode) {
                inEpisode    = true;
                episodeStart = now;
                maxIntensity = index;
                log.debug("DISSOCIATION_EPISODE_OPENED index={} at={}", index, now);
            } else {
                maxIntensity = Math.max(maxIntensity, index);
            }
            Duration elapsed = Duration.between(episodeStart, now);
            return DissociationStatus.active(severityForElapsed(elapsed), elapsed, index);
        }

        if (!inEpisode) {
            return DissociationStatus.NONE;
        }
        return close(now).map(episode ->
            DissociationStatus.recent(episode.severity(), episode.duration(), episode.maxIntensity())
        ).orElse(DissociationStatus.NONE);
    }

    /**
     * Closes an open episode at {@code endTime}, when the session pauses or ends while
     * the subject is still dissociated.
     */
    public Optional<DissociationEpisode> closeOpenEpisode(Instant endTime) {
        return inEpisode ? close(endTime) : Optional.empty();
    }

    public boolean isInEpisode() {
        return inEpisode;
    }

    /** Recorded episodes, oldest first. */
    public List<DissociationEpisode> history() {
        return new ArrayList<>(history);
    }

    public Optional<DissociationEpisode> latestEpisode() {
        return Optional.ofNullable(history.peekLast());
    }

    public void reset() {
        inEpisode    = false;
        episodeStart = null;
        maxIntensity = 0.0;
        history.clear();
    }

    // ── severity ──────────────────────────────────────────────────────────────

    /** Severity of an open episode, by elapsed duration only. */
    public static DissociationSeverity severityForElapsed(Duration elapsed) {
        if (elapsed.compareTo(SEVERE_DURATION) >= 0)   return DissociationSeverity.SEVERE;
        if (elapsed.compareTo(MODERATE_DURATION) >= 0) return DissociationSeverity.MODERATE;
        if (elapsed.compareTo(MILD_DURATION) >= 0)     return DissociationSeverity.MILD;
        return DissociationSeverity.POTENTIAL;
    }

    /** Severity of a recorded episode, by duration and peak intensity. */
    public static DissociationSeverity severityForEpisode(Duration duration, double peak) {
        if (duration.compareTo(SEVERE_DURATION) > 0 || peak > SEVERE_PEAK)     return DissociationSeverity.SEVERE;
        if (duration.compareTo(MODERATE_DURATION) > 0 || peak > MODERATE_PEAK) return DissociationSeverity.MODERATE;
        return DissociationSeverity.MILD;
    }

    private Optional<DissociationEpisode> close(Instant endTime) {
        Duration duration = Duration.between(episodeStart, endTime);
        double peak = maxIntensity;
        Instant start = episodeStart;

        inEpisode    = false;
        episodeStart = null;
        maxIntensity = 0.0;

        if (duration.compareTo(MILD_DURATION) < 0) {
            log.debug("DISSOCIATION_EPISODE_DISCARDED durationMs={} peak={}", duration.toMillis(), peak);
            return Optional.empty();
        }

        DissociationEpisode episode = new DissociationEpisode(start, endTime, peak,
            severityForEpisode(duration, peak));
        history.addLast(episode);
        while (history.size() > HISTORY_LIMIT) {
            history.removeFirst();
        }
        log.info("DISSOCIATION_EPISODE_RECORDED severity={} durationMs={} peak={}",
                 episode.severity(), duration.toMillis(), peak);
        return Optional.of(episode);
    }
}
