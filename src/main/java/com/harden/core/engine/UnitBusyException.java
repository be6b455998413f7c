package com.harden.core.engine;

import com.harden.core.model.UnitStatus;

/**
 * Thrown when a retry targets a unit that a worker is still processing.
 */
public class UnitBusyException extends RuntimeException {

    private final UnitStatus status;

    public UnitBusyException(String unitName, UnitStatus status) {
        super("Unit " + unitName + " is busy (" + status.wireName() + ")");
        this.status = status;
    }

    public UnitStatus getStatus() {
        return status;
    }
}
