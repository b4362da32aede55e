package com.biomirror.common.response;

public enum ResponseType {
    MIRRORING,
    EXPLORATION,
    VALIDATION,
    REGULATION,
    GROUNDING,
    TRANSFER,
    CELEBRATION,
    INTEGRATION,
    TITRATION
}
