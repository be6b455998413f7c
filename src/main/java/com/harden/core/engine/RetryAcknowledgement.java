package com.harden.core.engine;

/**
 * Immediate answer to a retry request; the re-run itself continues in the background.
 */
public record RetryAcknowledgement(String status, String unit) {

    public static RetryAcknowledgement retrying(String unit) {
        return new RetryAcknowledgement("retrying", unit);
    }
}
