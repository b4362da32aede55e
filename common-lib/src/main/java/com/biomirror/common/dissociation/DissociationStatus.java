package com.biomirror.common.dissociation;

import java.time.Duration;

/**
 * Per-tick output of the {@link DissociationTracker}.
 *
 * <ul>
 *   <li>{@code NONE}: no episode open and nothing closed this tick</li>
 *   <li>{@code ACTIVE}: an episode is open; intensity is the current index</li>
 *   <li>{@code RECENT}: an episode closed this tick and was recorded; intensity is its maximum</li>
 * </ul>
 */
public record DissociationStatus(Kind kind, DissociationSeverity severity, Duration duration, double intensity) {

    public enum Kind { NONE, ACTIVE, RECENT }

    public static final DissociationStatus NONE =
        new DissociationStatus(Kind.NONE, null, Duration.ZERO, 0.0);

    public static DissociationStatus active(DissociationSeverity severity, Duration duration, double intensity) {
        return new DissociationStatus(Kind.ACTIVE, severity, duration, intensity);
    }

    public static DissociationStatus recent(DissociationSeverity severity, Duration duration, double maxIntensity) {
        return new DissociationStatus(Kind.RECENT, severity, duration, maxIntensity);
    }

    public boolean isActive() {
        return kind == Kind.ACTIVE;
    }

    public boolean isRecent() {
        return kind == Kind.RECENT;
    }

    /** True for an open episode that has reached at least mild severity. */
    public boolean isConfirmedEpisode() {
        return isActive() && severity != DissociationSeverity.POTENTIAL;
    }
}
