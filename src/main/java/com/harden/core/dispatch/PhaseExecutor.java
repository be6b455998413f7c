package com.harden.core.dispatch;

import com.harden.core.logging.MdcContext;
import com.harden.core.metrics.HardenMetrics;
import com.harden.core.model.Stage;
import com.harden.core.model.Unit;
import com.harden.core.model.UnitStatus;
import com.harden.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fans one stage out over a set of units and waits for all of them.
 * <p>
 * Every unit gets its own worker. A worker first shows the stage's active
 * status, then runs the action and applies the returned update. Any failure
 * is contained to its unit: the unit moves to {@link UnitStatus#ERROR} and the
 * pipeline error log gains {@code "<Stage> failed for <name>: <message>"}.
 */
@Component
public class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final PipelineState state;
    private final HardenMetrics metrics;
    private final Executor workers;
    private final Executor retries;

    public PhaseExecutor(PipelineState state, HardenMetrics metrics,
                         @Qualifier("hardenWorkerExecutor") Executor workers,
                         @Qualifier("hardenRetryExecutor") Executor retries) {
        this.state = state;
        this.metrics = metrics;
        this.workers = workers;
        this.retries = retries;
    }

    /**
     * Runs {@code action} for every unit concurrently and returns once all workers finished.
     * Worker failures never propagate.
     *
     * @throws IllegalArgumentException if {@code units} or {@code action} is null
     */
    public void runParallel(Stage stage, Collection<Unit> units, UnitAction action) {
        if (units == null) {
            throw new IllegalArgumentException("Eligible units must not be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("Unit action must not be null");
        }
        if (units.isEmpty()) {
            log.info("{}: no eligible units", stage.label());
            return;
        }

        log.info("{}: dispatching {} units", stage.label(), units.size());
        if (metrics != null) {
            metrics.recordFanOut(stage, units.size());
        }
        long startMs = System.currentTimeMillis();

        var names = new ArrayList<String>();
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (Unit unit : units) {
            names.add(unit.name());
            futures.add(CompletableFuture.runAsync(() -> runContained(stage, unit, action), workers));
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).join();
            } catch (CompletionException e) {
                // runContained handles Exception; anything reaching here is an Error
                markFailed(stage, names.get(i), e.getCause() != null ? e.getCause() : e);
            }
        }

        long elapsedMs = System.currentTimeMillis() - startMs;
        if (metrics != null) {
            metrics.recordPhaseDuration(stage, elapsedMs);
        }
        log.info("{}: all {} units finished in {}ms", stage.label(), units.size(), elapsedMs);
    }

    /**
     * Runs {@code action} for one unit on the retry pool and returns immediately.
     * The worker is contained exactly like a phase worker.
     */
    public void runDetached(Stage stage, Unit unit, UnitAction action) {
        if (unit == null || action == null) {
            throw new IllegalArgumentException("Unit and action must not be null");
        }
        CompletableFuture.runAsync(() -> runContained(stage, unit, action), retries)
                .exceptionally(e -> {
                    markFailed(stage, unit.name(), e.getCause() != null ? e.getCause() : e);
                    return null;
                });
    }

    private void runContained(Stage stage, Unit unit, UnitAction action) {
        MdcContext.setUnit(unit.name(), stage);
        String name = unit.name();
        try {
            Unit started = state.updateUnit(name, u -> u.withStatus(stage.activeStatus()))
                    .orElse(unit.withStatus(stage.activeStatus()));
            UnitAction.UnitUpdate update = action.run(started);
            Unit finished = state.updateUnit(name, update::apply).orElse(null);
            recordOutcome(stage, finished != null ? finished.status().wireName() : "discarded");
            log.debug("{} finished for {}", stage.label(), name);
        } catch (Exception e) {
            markFailed(stage, name, e);
        } finally {
            MdcContext.clear();
        }
    }

    private void markFailed(Stage stage, String name, Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("{} failed for {}: {}", stage.label(), name, message);
        state.updateUnit(name, u -> u.withStatus(UnitStatus.ERROR).withError(message));
        state.addError(stage.label() + " failed for " + name + ": " + message);
        recordOutcome(stage, UnitStatus.ERROR.wireName());
    }

    private void recordOutcome(Stage stage, String outcome) {
        if (metrics != null) {
            metrics.recordUnitOutcome(stage, outcome);
        }
    }
}
