package com.harden.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.harden.core.engine.PhaseConflictException;
import com.harden.core.events.EventBus;
import com.harden.core.events.PipelineEvent;
import com.harden.core.model.ErrorEntry;
import com.harden.core.model.PipelinePhase;
import com.harden.core.model.PipelineSnapshot;
import com.harden.core.model.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The single, process-wide record of the pipeline: phase, units, error log and timestamps.
 * <p>
 * One monitor guards every field. Units are immutable and replaced wholesale, so
 * {@link #snapshot()} hands out a consistent copy that never changes underneath a reader.
 * Change events are published on the {@link EventBus} after the monitor is released.
 */
@Component
public class PipelineState {

    private static final Logger log = LoggerFactory.getLogger(PipelineState.class);

    private final Object lock = new Object();
    private final EventBus eventBus;
    private final Clock clock;

    private PipelinePhase phase = PipelinePhase.IDLE;
    private final LinkedHashMap<String, Unit> units = new LinkedHashMap<>();
    private final List<ErrorEntry> errors = new ArrayList<>();
    private Instant startedAt;
    private Instant completedAt;

    public PipelineState(EventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    PipelineState(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public PipelinePhase phase() {
        synchronized (lock) {
            return phase;
        }
    }

    public Optional<Unit> unit(String name) {
        synchronized (lock) {
            return Optional.ofNullable(units.get(name));
        }
    }

    /**
     * Units in discovery order.
     */
    public List<Unit> units() {
        synchronized (lock) {
            return List.copyOf(units.values());
        }
    }

    /**
     * Moves from {@code expected} to {@code next} atomically.
     *
     * @throws PhaseConflictException if the current phase is not {@code expected}
     */
    public void claim(PipelinePhase expected, PipelinePhase next) {
        synchronized (lock) {
            if (phase != expected) {
                throw new PhaseConflictException(
                        "Expected phase " + expected.wireName() + " to enter " + next.wireName(), phase);
            }
            transition(next);
        }
        publishPhase(next);
    }

    /**
     * Moves forward to {@code next}. Staying in the same phase is allowed;
     * {@link PipelinePhase#ERRORED} is reachable only from discovery.
     *
     * @throws PhaseConflictException for a backward or otherwise illegal move
     */
    public void advance(PipelinePhase next) {
        synchronized (lock) {
            if (next == PipelinePhase.ERRORED && phase != PipelinePhase.DISCOVERING) {
                throw new PhaseConflictException("Only discovery can fail the pipeline", phase);
            }
            if (next.ordinal() < phase.ordinal() || phase == PipelinePhase.ERRORED) {
                throw new PhaseConflictException("Cannot move back to " + next.wireName(), phase);
            }
            if (next == phase) {
                return;
            }
            transition(next);
        }
        publishPhase(next);
    }

    /**
     * @throws PhaseConflictException if the current phase is not {@code expected}
     */
    public void requirePhase(PipelinePhase expected, String operation) {
        synchronized (lock) {
            if (phase != expected) {
                throw new PhaseConflictException(operation + " requires phase " + expected.wireName(), phase);
            }
        }
    }

    /**
     * Adds discovered units, overwriting entries with the same name.
     */
    public void registerUnits(List<Unit> discovered) {
        synchronized (lock) {
            for (Unit unit : discovered) {
                units.put(unit.name(), unit);
            }
        }
        eventBus.publish(PipelineEvent.of(PipelineEvent.UNITS_DISCOVERED, null,
                Map.of("count", discovered.size())));
    }

    /**
     * Replaces one unit with the result of {@code update}. Unknown names are ignored.
     *
     * @return the new unit, or empty when no unit has that name
     */
    public Optional<Unit> updateUnit(String name, UnaryOperator<Unit> update) {
        Unit updated;
        synchronized (lock) {
            Unit current = units.get(name);
            if (current == null) {
                return Optional.empty();
            }
            updated = update.apply(current);
            units.put(name, updated);
        }
        eventBus.publish(PipelineEvent.of(PipelineEvent.UNIT_UPDATED, name,
                Map.of("status", updated.status().wireName())));
        return Optional.of(updated);
    }

    /**
     * Records every decision and moves to hardening in one step.
     * Decisions naming unknown units are not applied; each one adds an error log entry.
     *
     * @return the names of units that received a decision, in submission order
     * @throws PhaseConflictException if the pipeline is not awaiting decisions
     */
    public List<String> applyDecisions(Map<String, JsonNode> decisions) {
        var decided = new ArrayList<String>();
        var unknown = new ArrayList<String>();
        synchronized (lock) {
            if (phase != PipelinePhase.AWAITING_DECISIONS) {
                throw new PhaseConflictException("Decisions are only accepted while awaiting decisions", phase);
            }
            for (var entry : decisions.entrySet()) {
                Unit current = units.get(entry.getKey());
                if (current == null) {
                    unknown.add(entry.getKey());
                    errors.add(new ErrorEntry("Decision for unknown unit ignored: " + entry.getKey(), clock.instant()));
                    continue;
                }
                units.put(current.name(), current.withDecision(entry.getValue()));
                decided.add(current.name());
            }
            transition(PipelinePhase.HARDENING);
        }
        for (String name : unknown) {
            log.warn("Ignoring decision for unknown unit {}", name);
            eventBus.publish(PipelineEvent.of(PipelineEvent.ERROR_RECORDED, name,
                    Map.of("message", "Decision for unknown unit ignored: " + name)));
        }
        for (String name : decided) {
            eventBus.publish(PipelineEvent.of(PipelineEvent.UNIT_UPDATED, name, Map.of("decided", true)));
        }
        publishPhase(PipelinePhase.HARDENING);
        return decided;
    }

    public void addError(String message) {
        synchronized (lock) {
            errors.add(new ErrorEntry(message, clock.instant()));
        }
        eventBus.publish(PipelineEvent.of(PipelineEvent.ERROR_RECORDED, null, Map.of("message", message)));
    }

    /**
     * Returns to a fresh idle pipeline.
     *
     * @throws PhaseConflictException while discovery or a phase is running
     */
    public void reset() {
        synchronized (lock) {
            if (phase.isRunning()) {
                throw new PhaseConflictException("Cannot reset a running pipeline", phase);
            }
            units.clear();
            errors.clear();
            startedAt = null;
            completedAt = null;
            phase = PipelinePhase.IDLE;
        }
        log.info("Pipeline reset");
        eventBus.publish(PipelineEvent.of(PipelineEvent.PIPELINE_RESET, null, Map.of()));
    }

    /**
     * Consistent copy of the whole state.
     */
    public PipelineSnapshot snapshot() {
        synchronized (lock) {
            var copies = new LinkedHashMap<String, Unit>();
            units.forEach((name, unit) -> copies.put(name, unit.detachedCopy()));
            return new PipelineSnapshot(
                    phase,
                    Collections.unmodifiableMap(copies),
                    List.copyOf(errors),
                    startedAt,
                    completedAt);
        }
    }

    // Caller holds the lock.
    private void transition(PipelinePhase next) {
        log.info("Pipeline phase {} -> {}", phase.wireName(), next.wireName());
        phase = next;
        if (next == PipelinePhase.ANALYZING && startedAt == null) {
            startedAt = clock.instant();
        }
        if (next == PipelinePhase.COMPLETE && completedAt == null) {
            completedAt = clock.instant();
        }
    }

    private void publishPhase(PipelinePhase next) {
        eventBus.publish(PipelineEvent.of(PipelineEvent.PHASE_CHANGED, null, Map.of("phase", next.wireName())));
    }
}
