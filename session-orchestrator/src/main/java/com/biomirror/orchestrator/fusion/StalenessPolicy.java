package com.biomirror.orchestrator.fusion;

/**
 * What a fusion tick does when neither sample cell changed since the previous tick.
 */
public enum StalenessPolicy {

    /** Re-fuse the last pair (sample-and-hold). Stale ticks are counted and logged at DEBUG. */
    HOLD_LAST,

    /** Emit only when at least one input changed since the last emitted state. */
    SKIP_STALE
}
