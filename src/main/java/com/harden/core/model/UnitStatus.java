package com.harden.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a single unit within the pipeline.
 */
public enum UnitStatus {
    PENDING,
    ANALYZING,
    ANALYZED,
    HARDENING,
    SKIPPED,
    HARDENED,
    VERIFYING,
    VERIFIED,
    ERROR;

    /**
     * True while a worker owns the unit.
     */
    public boolean isActive() {
        return this == ANALYZING || this == HARDENING || this == VERIFYING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
