package com.harden.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One discovered source artifact subject to analysis, hardening and verification.
 * <p>
 * Units are immutable values. The pipeline state replaces a unit wholesale under
 * its lock, so any reference a worker or observer holds is always internally
 * consistent.
 *
 * @param name         unique key, the file stem (e.g. {@code posts_controller})
 * @param path         location relative to the project root
 * @param fullPath     absolute location of the source file
 * @param status       current lifecycle status
 * @param analysis     normalized analysis result, null until analysis ran
 * @param decision     human decision, opaque apart from its {@code action} field
 * @param hardened     normalized hardening result, null until hardening ran
 * @param verification normalized verification result, null until verification ran
 * @param error        message of the failure that put the unit in {@link UnitStatus#ERROR}
 * @param prompts      last prompt sent per stage, keyed by {@link Stage#wireName()}
 */
public record Unit(
    String name,
    String path,
    @JsonProperty("full_path") String fullPath,
    UnitStatus status,
    JsonNode analysis,
    JsonNode decision,
    JsonNode hardened,
    JsonNode verification,
    String error,
    @JsonIgnore Map<String, String> prompts
) {

    public static final String SKIP_ACTION = "skip";

    public Unit {
        prompts = prompts == null ? Map.of() : Map.copyOf(prompts);
    }

    /**
     * A freshly discovered unit: pending, with no results.
     */
    public static Unit discovered(String name, String path, String fullPath) {
        return new Unit(name, path, fullPath, UnitStatus.PENDING,
                null, null, null, null, null, Map.of());
    }

    @JsonIgnore
    public Path sourcePath() {
        return Path.of(fullPath);
    }

    /**
     * True when a decision exists and its action is {@code "skip"}.
     */
    @JsonIgnore
    public boolean isSkipDecision() {
        return decision != null && SKIP_ACTION.equals(decisionAction());
    }

    /**
     * True when a decision exists and does not skip the unit.
     */
    @JsonIgnore
    public boolean isProceedDecision() {
        return decision != null && !decision.isNull() && !isSkipDecision();
    }

    @JsonIgnore
    public String decisionAction() {
        if (decision == null || !decision.hasNonNull("action")) {
            return null;
        }
        return decision.get("action").asText();
    }

    public Unit withStatus(UnitStatus newStatus) {
        return new Unit(name, path, fullPath, newStatus, analysis, decision, hardened, verification, error, prompts);
    }

    public Unit withAnalysis(JsonNode newAnalysis) {
        return new Unit(name, path, fullPath, status, newAnalysis, decision, hardened, verification, error, prompts);
    }

    public Unit withDecision(JsonNode newDecision) {
        return new Unit(name, path, fullPath, status, analysis, newDecision, hardened, verification, error, prompts);
    }

    public Unit withHardened(JsonNode newHardened) {
        return new Unit(name, path, fullPath, status, analysis, decision, newHardened, verification, error, prompts);
    }

    public Unit withVerification(JsonNode newVerification) {
        return new Unit(name, path, fullPath, status, analysis, decision, hardened, newVerification, error, prompts);
    }

    public Unit withError(String newError) {
        return new Unit(name, path, fullPath, status, analysis, decision, hardened, verification, newError, prompts);
    }

    public Unit withPrompt(Stage stage, String prompt) {
        var updated = new LinkedHashMap<>(prompts);
        updated.put(stage.wireName(), prompt);
        return new Unit(name, path, fullPath, status, analysis, decision, hardened, verification, error, updated);
    }

    /**
     * Copy whose JSON results share no mutable nodes with this unit.
     */
    public Unit detachedCopy() {
        return new Unit(name, path, fullPath, status, copyOf(analysis), copyOf(decision),
                copyOf(hardened), copyOf(verification), error, prompts);
    }

    private static JsonNode copyOf(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }
}
