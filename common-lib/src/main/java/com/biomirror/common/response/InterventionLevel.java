package com.biomirror.common.response;

/** How strongly a response steers the subject, lightest first. */
public enum InterventionLevel {
    MINIMAL,
    MODERATE,
    SIGNIFICANT,
    INTENSIVE
}
