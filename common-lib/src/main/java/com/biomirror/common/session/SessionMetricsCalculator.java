package com.biomirror.common.session;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.model.EmotionType;
import com.biomirror.common.model.IntegratedState;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Pure metric functions over a finished session's states and episodes.
 */
public final class SessionMetricsCalculator {

    /** Arousal above this counts as an activation peak. */
    public static final double ACTIVATION_AROUSAL = 0.7;

    /** Arousal below this counts as returned to baseline. */
    public static final double BASELINE_AROUSAL = 0.4;

    /** Drop below the peak that counts as recovery. */
    public static final double RECOVERY_DROP = 0.2;

    /** Average recovery time that maps to a recovery speed of 0.5. */
    private static final double REFERENCE_RECOVERY_SECONDS = 60.0;

    private SessionMetricsCalculator() {}

    public static SessionMetrics compute(List<IntegratedState> states,
                                         List<DissociationEpisode> episodes,
                                         int interventionsDelivered,
                                         Instant start, Instant end) {
        Set<EmotionType> expressed = EnumSet.noneOf(EmotionType.class);
        int masking = 0;
        for (IntegratedState s : states) {
            expressed.add(s.dominantEmotion());
            if (s.isEmotionMasked()) masking++;
        }

        Duration sessionDuration = Duration.between(start, end);
        Duration dissociationTime = episodes.stream()
            .map(DissociationEpisode::duration)
            .reduce(Duration.ZERO, Duration::plus);
        double dissociationShare = sessionDuration.isZero() ? 0.0
            : Math.min(100.0, dissociationTime.toMillis() * 100.0 / sessionDuration.toMillis());

        Peak peak = peakArousal(states);

        return new SessionMetrics(
            averageCoherence(states),
            expressed,
            (double) expressed.size() / EmotionType.taxonomySize(),
            peak.arousal(),
            peak.time(),
            fastestRecovery(states),
            regulationCapacity(states),
            regulationImprovement(states),
            masking,
            episodes.size(),
            dissociationTime,
            dissociationShare,
            interventionsDelivered,
            sessionDuration
        );
    }

    public static double averageCoherence(List<IntegratedState> states) {
        if (states.isEmpty()) return 0.0;
        double sum = 0.0;
        for (IntegratedState s : states) sum += s.coherenceIndex();
        return sum / states.size();
    }

    // ── regulation ────────────────────────────────────────────────────────────

    /**
     * Mean of the regulated-state ratio and a recovery speed of
     * {@code 1 / (1 + averageRecovery / 60s)}; 0.5 when there are five states or fewer.
     */
    public static double regulationCapacity(List<IntegratedState> states) {
        if (states.size() <= 5) return 0.5;

        double regulatedRatio = regulatedRatio(states);
        double recoverySpeed = 0.5;
        int activations = 0;
        double totalRecoverySeconds = 0.0;

        for (int i = 0; i < states.size() - 1; i++) {
            if (states.get(i).arousalLevel() <= ACTIVATION_AROUSAL) continue;
            activations++;
            for (int j = i + 1; j < states.size(); j++) {
                if (states.get(j).arousalLevel() < BASELINE_AROUSAL) {
                    totalRecoverySeconds += secondsBetween(states.get(i).timestamp(), states.get(j).timestamp());
                    break;
                }
            }
        }
        if (activations > 0) {
            double average = totalRecoverySeconds / activations;
            recoverySpeed = 1.0 / (1.0 + average / REFERENCE_RECOVERY_SECONDS);
        }
        return (regulatedRatio + recoverySpeed) / 2.0;
    }

    /** Regulated ratio of the last third minus the first third; 0 with ten states or fewer. */
    public static double regulationImprovement(List<IntegratedState> states) {
        if (states.size() <= 10) return 0.0;
        int third = states.size() / 3;
        return regulatedRatio(states.subList(states.size() - third, states.size()))
            - regulatedRatio(states.subList(0, third));
    }

    private static double regulatedRatio(List<IntegratedState> states) {
        if (states.isEmpty()) return 0.0;
        long regulated = states.stream().filter(s -> s.emotionalRegulation().isRegulated()).count();
        return (double) regulated / states.size();
    }

    // ── arousal peaks ─────────────────────────────────────────────────────────

    private record Peak(double arousal, Instant time) {}

    private static Peak peakArousal(List<IntegratedState> states) {
        double peak = 0.0;
        Instant time = null;
        for (IntegratedState s : states) {
            if (s.arousalLevel() > ACTIVATION_AROUSAL && s.arousalLevel() > peak) {
                peak = s.arousalLevel();
                time = s.timestamp();
            }
        }
        return new Peak(peak, time);
    }

    /**
     * Shortest time from a running arousal peak above {@value #ACTIVATION_AROUSAL}
     * to a state {@value #RECOVERY_DROP} below it.
     */
    static Duration fastestRecovery(List<IntegratedState> states) {
        double peak = 0.0;
        Instant peakTime = null;
        Duration fastest = Duration.ZERO;
        for (IntegratedState s : states) {
            if (s.arousalLevel() > ACTIVATION_AROUSAL && s.arousalLevel() > peak) {
                peak = s.arousalLevel();
                peakTime = s.timestamp();
            }
            if (peakTime != null && s.arousalLevel() < peak - RECOVERY_DROP) {
                Duration recovery = Duration.between(peakTime, s.timestamp());
                if (fastest.isZero() || recovery.compareTo(fastest) < 0) {
                    fastest = recovery;
                }
            }
        }
        return fastest;
    }

    private static double secondsBetween(Instant a, Instant b) {
        return Duration.between(a, b).toMillis() / 1000.0;
    }
}
