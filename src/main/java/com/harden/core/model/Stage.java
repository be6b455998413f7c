package com.harden.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * A per-unit unit of work that the phase executor fans out.
 * Each stage knows the status a unit shows while it is being worked on.
 */
public enum Stage {
    ANALYSIS("Analysis", UnitStatus.ANALYZING),
    HARDENING("Hardening", UnitStatus.HARDENING),
    VERIFICATION("Verification", UnitStatus.VERIFYING);

    private final String label;
    private final UnitStatus activeStatus;

    Stage(String label, UnitStatus activeStatus) {
        this.label = label;
        this.activeStatus = activeStatus;
    }

    public String label() {
        return label;
    }

    public UnitStatus activeStatus() {
        return activeStatus;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup by wire name, e.g. {@code "analysis"}.
     */
    public static Optional<Stage> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Stage stage : values()) {
            if (stage.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
