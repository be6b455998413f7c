package com.harden.core.scanner;

/**
 * Thrown when the unit source tree cannot be discovered. Pipeline-fatal.
 */
public class DiscoveryException extends RuntimeException {
    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
