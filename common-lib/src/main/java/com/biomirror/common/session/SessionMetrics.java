package com.biomirror.common.session;

import com.biomirror.common.model.EmotionType;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Summary computed when a session ends.
 *
 * @param averageCoherenceIndex      mean coherence over all states
 * @param emotionsExpressed          distinct dominant emotions seen
 * @param emotionalRangeIndex        distinct emotions divided by the taxonomy size
 * @param peakArousal                highest arousal above the activation threshold, 0 if none
 * @param timeOfPeakArousal          time of {@code peakArousal}, {@code null} if none
 * @param regulationRecoveryTime     fastest drop of 0.2 below a peak, {@link Duration#ZERO} if none
 * @param regulationCapacity         mean of regulated ratio and recovery speed
 * @param regulationImprovement      regulated ratio of last third minus first third
 * @param emotionalMaskingInstances  states with masking above threshold
 * @param dissociationEpisodeCount   recorded episodes
 * @param totalDissociationTime      summed recorded episode durations
 * @param percentageTimeInDissociation share of session duration spent in recorded episodes
 * @param interventionsDelivered     responses delivered to the character
 * @param sessionDuration            wall time from start to end
 */
public record SessionMetrics(
    double averageCoherenceIndex,
    Set<EmotionType> emotionsExpressed,
    double emotionalRangeIndex,
    double peakArousal,
    Instant timeOfPeakArousal,
    Duration regulationRecoveryTime,
    double regulationCapacity,
    double regulationImprovement,
    int emotionalMaskingInstances,
    int dissociationEpisodeCount,
    Duration totalDissociationTime,
    double percentageTimeInDissociation,
    int interventionsDelivered,
    Duration sessionDuration
) {
    public SessionMetrics {
        emotionsExpressed = Set.copyOf(emotionsExpressed);
    }
}
