package com.biomirror.common.response;

/** Category of intervention used to counter dissociation. */
public enum GroundingTechnique {
    BREATHING,
    SENSORY,
    MOVEMENT,
    COGNITIVE,
    NAMING
}
