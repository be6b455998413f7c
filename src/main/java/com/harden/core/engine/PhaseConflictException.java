package com.harden.core.engine;

import com.harden.core.model.PipelinePhase;

/**
 * Thrown when an operation is not legal in the pipeline's current phase.
 */
public class PhaseConflictException extends RuntimeException {

    private final PipelinePhase currentPhase;

    public PhaseConflictException(String message, PipelinePhase currentPhase) {
        super(message + "; current phase: " + currentPhase.wireName());
        this.currentPhase = currentPhase;
    }

    public PipelinePhase getCurrentPhase() {
        return currentPhase;
    }
}
