package com.biomirror.common.session;

import java.util.List;

/**
 * The five sequential therapeutic stages, with the share of the session budget
 * each one is allocated.
 */
public enum SessionPhase {

    CONNECTION("Connection",
        "Build rapport and safety with the companion.",
        List.of("Establish trust", "Introduce mirroring", "Create a sense of safety"),
        0.15),

    AWARENESS("Awareness",
        "Notice and name emotions as they appear.",
        List.of("Recognize facial expressions", "Connect feelings to body signals", "Name emotions"),
        0.30),

    INTEGRATION("Integration",
        "Connect what the face shows with what the body feels.",
        List.of("Reduce masking", "Improve coherence", "Accept mixed feelings"),
        0.30),

    REGULATION("Regulation",
        "Practise calming and self-soothing strategies.",
        List.of("Practise breathing", "Recover from activation", "Choose a calming strategy"),
        0.15),

    TRANSFER("Transfer",
        "Carry the skills into everyday situations.",
        List.of("Plan real-world use", "Review strategies", "Celebrate progress"),
        0.10);

    private final String displayName;
    private final String description;
    private final List<String> objectives;
    private final double allocation;

    SessionPhase(String displayName, String description, List<String> objectives, double allocation) {
        this.displayName = displayName;
        this.description = description;
        this.objectives  = objectives;
        this.allocation  = allocation;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public List<String> objectives() {
        return objectives;
    }

    /** Fraction of the total session duration allocated to this phase. */
    public double allocation() {
        return allocation;
    }

    /** The following phase, or {@code null} for {@link #TRANSFER}. */
    public SessionPhase next() {
        int i = ordinal() + 1;
        return i < values().length ? values()[i] : null;
    }

    /** The preceding phase, or {@code null} for {@link #CONNECTION}. */
    public SessionPhase previous() {
        int i = ordinal() - 1;
        return i >= 0 ? values()[i] : null;
    }
}
