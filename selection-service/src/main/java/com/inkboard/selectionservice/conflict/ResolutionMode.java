package com.inkboard.selectionservice.conflict;

/**
 * How a conflict currently stands.
 */
public enum ResolutionMode {
    /** An ownership lock exists on the element. */
    OWNERSHIP,
    /** Participants agreed to keep the element multiply selected. */
    SHARED,
    /** Unresolved for longer than the configured conflict timeout. */
    TIMEOUT,
    /** Waiting for someone to resolve it. */
    MANUAL
}
