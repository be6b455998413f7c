package com.harden.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Global phase of the hardening pipeline.
 * <p>
 * Declaration order is the only legal direction of travel: a pipeline moves
 * forward through these constants and never back, except that a failure
 * during discovery jumps straight to {@link #ERRORED}.
 */
public enum PipelinePhase {
    IDLE,
    DISCOVERING,
    ANALYZING,
    AWAITING_DECISIONS,
    HARDENING,
    VERIFYING,
    COMPLETE,
    ERRORED;

    /**
     * Phases during which a fan-out barrier or discovery walk is in flight.
     */
    public boolean isRunning() {
        return this == DISCOVERING || this == ANALYZING || this == HARDENING || this == VERIFYING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
