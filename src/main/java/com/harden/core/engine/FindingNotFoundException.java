package com.harden.core.engine;

/**
 * Thrown when a unit's analysis has no finding with the requested id.
 */
public class FindingNotFoundException extends RuntimeException {

    private final String unitName;
    private final String findingId;

    public FindingNotFoundException(String unitName, String findingId) {
        super("Finding " + findingId + " not found for unit " + unitName);
        this.unitName = unitName;
        this.findingId = findingId;
    }

    public String getUnitName() {
        return unitName;
    }

    public String getFindingId() {
        return findingId;
    }
}
