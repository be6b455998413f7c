package com.harden.core.engine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when an ad-hoc query cannot read the source file of a discovered unit.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String unitName;

    public SourceUnavailableException(String unitName, Path sourcePath, IOException cause) {
        super("Cannot read source of " + unitName + " at " + sourcePath + ": " + cause.getMessage(), cause);
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
