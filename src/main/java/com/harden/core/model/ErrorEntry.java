package com.harden.core.model;

import java.time.Instant;

/**
 * One entry of the pipeline's append-only error log.
 *
 * @param message what failed
 * @param at      when the failure was recorded
 */
public record ErrorEntry(String message, Instant at) {
}
