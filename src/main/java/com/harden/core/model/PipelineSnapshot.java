package com.harden.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fully materialized copy of the pipeline state, safe to hand to observers
 * and serializers without holding any lock.
 *
 * @param phase       global phase at the time of the copy
 * @param units       units keyed by name, in discovery order
 * @param errors      error log, oldest first
 * @param startedAt   when analysis started, null before that
 * @param completedAt when verification finished, null before that
 */
public record PipelineSnapshot(
    PipelinePhase phase,
    Map<String, Unit> units,
    List<ErrorEntry> errors,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt
) {

    public Unit unit(String name) {
        return units.get(name);
    }

    public long countByStatus(UnitStatus status) {
        return units.values().stream().filter(u -> u.status() == status).count();
    }
}
