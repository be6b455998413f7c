package com.harden.core.dispatch;

import com.harden.core.model.Unit;

/**
 * The per-unit work of one stage.
 * <p>
 * Receives an immutable copy of the unit taken when the worker started and
 * returns the change to apply once the work is done. Any exception is
 * contained by the {@link PhaseExecutor} and marks only this unit as failed.
 */
@FunctionalInterface
public interface UnitAction {

    UnitUpdate run(Unit unit) throws Exception;

    /**
     * A change applied atomically to the current version of a unit.
     */
    @FunctionalInterface
    interface UnitUpdate {
        Unit apply(Unit current);
    }
}
