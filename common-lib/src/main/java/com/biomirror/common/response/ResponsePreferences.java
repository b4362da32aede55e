package com.biomirror.common.response;

import java.util.List;

/**
 * User/therapist preferences that shape response generation.
 *
 * @param groundingTechniques          allowed grounding techniques, most preferred first
 * @param emotionalMirroringSensitivity 0 mirrors cautiously, 1 mirrors fully
 */
public record ResponsePreferences(List<GroundingTechnique> groundingTechniques,
                                  double emotionalMirroringSensitivity) {

    public ResponsePreferences {
        groundingTechniques = List.copyOf(groundingTechniques);
    }

    public static ResponsePreferences defaults() {
        return new ResponsePreferences(List.of(GroundingTechnique.values()), 0.5);
    }

    /** Share of intensity withheld when mirroring during the awareness phase. */
    public double titrationLevel() {
        double sensitivity = Math.max(0.0, Math.min(1.0, emotionalMirroringSensitivity));
        return 0.4 * (1.0 - sensitivity);
    }
}
