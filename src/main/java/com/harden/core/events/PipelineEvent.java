package com.harden.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A change to the pipeline state, used for SSE streaming and CLI progress output.
 *
 * @param eventType event type (e.g. "phase.changed", "unit.updated", "error.recorded")
 * @param unitName  the unit this event relates to (nullable for pipeline-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String unitName,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String PHASE_CHANGED = "phase.changed";
    public static final String UNIT_UPDATED = "unit.updated";
    public static final String UNITS_DISCOVERED = "units.discovered";
    public static final String ERROR_RECORDED = "error.recorded";
    public static final String PIPELINE_RESET = "pipeline.reset";

    public static PipelineEvent of(String eventType, String unitName, Map<String, Object> payload) {
        return new PipelineEvent(eventType, unitName, payload, Instant.now());
    }
}
