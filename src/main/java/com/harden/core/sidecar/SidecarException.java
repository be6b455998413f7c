package com.harden.core.sidecar;

/**
 * Thrown when a sidecar artifact cannot be written, or would land outside the project root.
 */
public class SidecarException extends RuntimeException {
    public SidecarException(String message) {
        super(message);
    }

    public SidecarException(String message, Throwable cause) {
        super(message, cause);
    }
}
