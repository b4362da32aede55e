package com.biomirror.common.dissociation;

/**
 * Severity of a dissociation episode, ordered from least to most severe.
 */
public enum DissociationSeverity {

    /** Open episode that has not yet reached the minimum recordable duration. */
    POTENTIAL,
    MILD,
    MODERATE,
    SEVERE;

    public boolean isAtLeast(DissociationSeverity other) {
        return compareTo(other) >= 0;
    }
}
