package com.biomirror.common.dissociation;

import java.time.Duration;
import java.time.Instant;

/**
 * A closed dissociation episode long enough to be recorded.
 */
public record DissociationEpisode(
    Instant startTime,
    Instant endTime,
    double maxIntensity,
    DissociationSeverity severity
) {

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }
}
