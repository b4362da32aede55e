package com.biomirror.common.response;

import com.biomirror.common.dissociation.DissociationSeverity;

import java.util.List;

/**
 * Technique table for dissociation grounding, filtered by preference.
 *
 * <pre>
 *   SEVERE            → SENSORY, else BREATHING
 *   MODERATE          → MOVEMENT, else BREATHING
 *   MILD / POTENTIAL  → COGNITIVE, else NAMING
 * </pre>
 * When neither is allowed the first allowed technique is used, and when nothing is
 * allowed the preferred technique of the row.
 */
public final class GroundingTechniqueSelector {

    private GroundingTechniqueSelector() {}

    public static GroundingTechnique select(DissociationSeverity severity, List<GroundingTechnique> allowed) {
        return switch (severity) {
            case SEVERE   -> pick(allowed, GroundingTechnique.SENSORY, GroundingTechnique.BREATHING);
            case MODERATE -> pick(allowed, GroundingTechnique.MOVEMENT, GroundingTechnique.BREATHING);
            case MILD, POTENTIAL -> pick(allowed, GroundingTechnique.COGNITIVE, GroundingTechnique.NAMING);
        };
    }

    private static GroundingTechnique pick(List<GroundingTechnique> allowed,
                                           GroundingTechnique preferred,
                                           GroundingTechnique fallback) {
        if (allowed.contains(preferred)) return preferred;
        if (allowed.contains(fallback))  return fallback;
        return allowed.isEmpty() ? preferred : allowed.get(0);
    }
}
