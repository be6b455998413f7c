package com.harden.dispatch.api;

/**
 * Request body for POST /api/v1/pipeline/units/{name}/ask.
 */
public record AskRequest(String question) {}
