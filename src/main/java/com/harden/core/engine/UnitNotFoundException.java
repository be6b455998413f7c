package com.harden.core.engine;

/**
 * Thrown by ad-hoc operations that name a unit the registry does not contain.
 */
public class UnitNotFoundException extends RuntimeException {

    private final String unitName;

    public UnitNotFoundException(String unitName) {
        super("Unit not found: " + unitName);
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
