package com.harden.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.harden.core.dispatch.PhaseExecutor;
import com.harden.core.dispatch.UnitAction;
import com.harden.core.llm.ReasoningTool;
import com.harden.core.llm.ResponseNormalizer;
import com.harden.core.metrics.HardenMetrics;
import com.harden.core.model.PipelinePhase;
import com.harden.core.model.PipelineSnapshot;
import com.harden.core.model.Stage;
import com.harden.core.model.Unit;
import com.harden.core.model.UnitStatus;
import com.harden.core.prompts.PromptBuilder;
import com.harden.core.scanner.UnitScanner;
import com.harden.core.sidecar.SidecarStore;
import com.harden.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * Top-level state machine of the hardening pipeline.
 * <p>
 * Sequence: discover, analyze every unit, wait for a human decision per unit,
 * harden the units that were not skipped, verify the units that hardened.
 * Each stage is a fan-out over the eligible units followed by a barrier.
 * Ad-hoc questions, finding explanations and single-unit retries bypass the
 * sequence and never change the global phase.
 */
@Service
public class HardeningPipeline {

    private static final Logger log = LoggerFactory.getLogger(HardeningPipeline.class);

    static final String ANALYSIS_ARTIFACT = "analysis.json";
    static final String DECISION_ARTIFACT = "decision.json";
    static final String HARDENED_ARTIFACT = "hardened.json";
    static final String PREVIEW_ARTIFACT = "hardened_preview";
    static final String VERIFICATION_ARTIFACT = "verification.json";

    private static final Pattern ARTIFACT_NAME = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.-]*");

    private final PipelineState state;
    private final UnitScanner scanner;
    private final PhaseExecutor executor;
    private final ReasoningTool tool;
    private final ResponseNormalizer normalizer;
    private final SidecarStore sidecar;
    private final HardenMetrics metrics;
    private final Executor orchestration;

    private volatile boolean discoveryComplete;

    public HardeningPipeline(PipelineState state, UnitScanner scanner, PhaseExecutor executor,
                             ReasoningTool tool, ResponseNormalizer normalizer, SidecarStore sidecar,
                             HardenMetrics metrics,
                             @Qualifier("hardenOrchestrationExecutor") Executor orchestration) {
        this.state = state;
        this.scanner = scanner;
        this.executor = executor;
        this.tool = tool;
        this.normalizer = normalizer;
        this.sidecar = sidecar;
        this.metrics = metrics;
        this.orchestration = orchestration;
    }

    // --- Phase sequence ---

    /**
     * Claims {@code idle -> discovering} and then runs discovery followed by
     * analysis on the orchestration thread.
     *
     * @throws PhaseConflictException if the pipeline is not idle
     */
    public void startAsync() {
        state.claim(PipelinePhase.IDLE, PipelinePhase.DISCOVERING);
        orchestration.execute(() -> {
            try {
                if (scanUnits()) {
                    runAnalysis();
                }
            } catch (RuntimeException e) {
                log.error("Pipeline run failed: {}", e.getMessage(), e);
                state.addError("Pipeline run failed: " + e.getMessage());
            }
        });
    }

    /**
     * Synchronous discovery from an idle pipeline.
     *
     * @return true when units were registered, false when discovery failed and the pipeline is errored
     * @throws PhaseConflictException if the pipeline is not idle
     */
    public boolean discover() {
        state.claim(PipelinePhase.IDLE, PipelinePhase.DISCOVERING);
        return scanUnits();
    }

    private boolean scanUnits() {
        try {
            List<Unit> units = scanner.scan();
            state.registerUnits(units);
            discoveryComplete = true;
            return true;
        } catch (RuntimeException e) {
            log.error("Discovery failed: {}", e.getMessage());
            state.addError("Discovery failed: " + e.getMessage());
            state.advance(PipelinePhase.ERRORED);
            return false;
        }
    }

    /**
     * Analyzes every discovered unit, then waits for decisions.
     *
     * @throws PhaseConflictException unless discovery has completed
     */
    public void runAnalysis() {
        if (!discoveryComplete) {
            throw new PhaseConflictException("Analysis requires completed discovery", state.phase());
        }
        state.claim(PipelinePhase.DISCOVERING, PipelinePhase.ANALYZING);
        executor.runParallel(Stage.ANALYSIS, state.units(), this::analyzeUnit);
        state.advance(PipelinePhase.AWAITING_DECISIONS);
    }

    /**
     * Records the decisions, persists them, and runs hardening and verification.
     *
     * @param decisions decision object per unit name
     * @throws PhaseConflictException if the pipeline is not awaiting decisions
     */
    public void submitDecisions(Map<String, JsonNode> decisions) {
        acceptDecisions(decisions);
        runHardening();
    }

    /**
     * Same as {@link #submitDecisions} but returns once the decisions are recorded;
     * hardening and verification continue on the orchestration thread.
     */
    public void submitDecisionsAsync(Map<String, JsonNode> decisions) {
        acceptDecisions(decisions);
        orchestration.execute(() -> {
            try {
                runHardening();
            } catch (RuntimeException e) {
                log.error("Hardening run failed: {}", e.getMessage(), e);
                state.addError("Hardening run failed: " + e.getMessage());
            }
        });
    }

    private void acceptDecisions(Map<String, JsonNode> decisions) {
        List<String> decided = state.applyDecisions(decisions);
        log.info("Recorded {} decisions", decided.size());
        for (String name : decided) {
            state.unit(name).ifPresent(unit -> {
                try {
                    sidecar.write(unit.sourcePath(), DECISION_ARTIFACT, unit.decision().toPrettyString());
                } catch (RuntimeException e) {
                    log.warn("Could not persist decision for {}: {}", name, e.getMessage());
                    state.addError("Could not persist decision for " + name + ": " + e.getMessage());
                }
            });
        }
    }

    /**
     * Hardens every decided, non-skipped unit, then runs verification.
     * Only reachable once {@link PipelineState#applyDecisions} moved the pipeline to hardening.
     */
    void runHardening() {
        state.requirePhase(PipelinePhase.HARDENING, "Hardening");
        var eligible = new ArrayList<Unit>();
        for (Unit unit : state.units()) {
            if (unit.status() == UnitStatus.ERROR) {
                continue;
            }
            if (unit.isSkipDecision()) {
                state.updateUnit(unit.name(), u -> u.withStatus(UnitStatus.SKIPPED));
            } else if (unit.isProceedDecision()) {
                eligible.add(unit);
            }
        }
        executor.runParallel(Stage.HARDENING, eligible, this::hardenUnit);
        runVerification();
    }

    /**
     * Verifies every hardened unit, then completes the pipeline.
     */
    void runVerification() {
        state.claim(PipelinePhase.HARDENING, PipelinePhase.VERIFYING);
        List<Unit> eligible = state.units().stream()
                .filter(u -> u.status() == UnitStatus.HARDENED)
                .toList();
        executor.runParallel(Stage.VERIFICATION, eligible, this::verifyUnit);
        state.advance(PipelinePhase.COMPLETE);
        log.info("Pipeline complete");
    }

    // --- Per-unit actions ---

    UnitAction.UnitUpdate analyzeUnit(Unit unit) throws IOException {
        String source = readSource(unit);
        String prompt = PromptBuilder.analyze(unit.name(), fileName(unit), source);
        recordPrompt(unit, Stage.ANALYSIS, prompt);

        JsonNode analysis = invokeAndParse(Stage.ANALYSIS, prompt);
        sidecar.write(unit.sourcePath(), ANALYSIS_ARTIFACT, analysis.toPrettyString());
        return current -> current.withStatus(UnitStatus.ANALYZED).withAnalysis(analysis).withError(null);
    }

    UnitAction.UnitUpdate hardenUnit(Unit unit) throws IOException {
        String source = readSource(unit);
        String prompt = PromptBuilder.harden(unit.name(), fileName(unit), source,
                serialized(unit.analysis()), unit.decision());
        recordPrompt(unit, Stage.HARDENING, prompt);

        JsonNode hardened = invokeAndParse(Stage.HARDENING, prompt);
        sidecar.write(unit.sourcePath(), HARDENED_ARTIFACT, hardened.toPrettyString());
        JsonNode hardenedSource = hardened.get("hardened_source");
        if (hardenedSource != null && hardenedSource.isTextual()) {
            sidecar.writeVerbatim(unit.sourcePath(), previewName(unit), hardenedSource.asText());
        }
        return current -> current.withStatus(UnitStatus.HARDENED).withHardened(hardened);
    }

    UnitAction.UnitUpdate verifyUnit(Unit unit) throws IOException {
        String original = readSource(unit);
        JsonNode hardenedSource = unit.hardened() != null ? unit.hardened().get("hardened_source") : null;
        String hardened = hardenedSource != null && hardenedSource.isTextual() ? hardenedSource.asText() : "";
        String prompt = PromptBuilder.verify(unit.name(), fileName(unit), original, hardened,
                serialized(unit.analysis()));
        recordPrompt(unit, Stage.VERIFICATION, prompt);

        JsonNode verification = invokeAndParse(Stage.VERIFICATION, prompt);
        sidecar.write(unit.sourcePath(), VERIFICATION_ARTIFACT, verification.toPrettyString());
        return current -> current.withStatus(UnitStatus.VERIFIED).withVerification(verification);
    }

    // --- Ad-hoc operations ---

    /**
     * Asks the tool a free-form question about one unit. Never changes state.
     *
     * @return the tool's raw answer
     * @throws UnitNotFoundException      if no unit has that name
     * @throws SourceUnavailableException if the unit's source can no longer be read
     */
    public String askAboutUnit(String unitName, String question) {
        Unit unit = requireUnit(unitName);
        String prompt = PromptBuilder.ask(unit.name(), fileName(unit), readSourceUnchecked(unit),
                serialized(unit.analysis()), question);
        return tool.invoke(prompt);
    }

    /**
     * Asks the tool to explain one finding of a unit's analysis. Never changes state.
     *
     * @return the tool's raw explanation
     * @throws UnitNotFoundException    if no unit has that name
     * @throws FindingNotFoundException if the analysis has no finding with that id
     * @throws SourceUnavailableException if the unit's source can no longer be read
     */
    public String explainFinding(String unitName, String findingId) {
        Unit unit = requireUnit(unitName);
        JsonNode finding = findFinding(unit, findingId)
                .orElseThrow(() -> new FindingNotFoundException(unitName, findingId));
        String prompt = PromptBuilder.explain(unit.name(), fileName(unit), readSourceUnchecked(unit),
                finding.toPrettyString());
        return tool.invoke(prompt);
    }

    /**
     * Re-runs analysis for one unit in the background, independent of the global phase.
     *
     * @throws UnitNotFoundException if no unit has that name
     * @throws UnitBusyException     if a worker is already running for the unit
     */
    public RetryAcknowledgement retryUnit(String unitName) {
        Unit unit = state.updateUnit(unitName, u -> {
            if (u.status().isActive()) {
                throw new UnitBusyException(unitName, u.status());
            }
            return u.withStatus(UnitStatus.ANALYZING).withError(null);
        }).orElseThrow(() -> new UnitNotFoundException(unitName));
        log.info("Retrying analysis for {}", unitName);
        executor.runDetached(Stage.ANALYSIS, unit, this::analyzeUnit);
        return RetryAcknowledgement.retrying(unitName);
    }

    /**
     * The last prompt sent to the tool for a unit and stage.
     *
     * @throws UnitNotFoundException if no unit has that name
     */
    public Optional<String> prompt(String unitName, Stage stage) {
        return Optional.ofNullable(requireUnit(unitName).prompts().get(stage.wireName()));
    }

    /**
     * Reads a sidecar artifact of a unit, e.g. {@code analysis.json}.
     *
     * @throws UnitNotFoundException if no unit has that name
     */
    public Optional<String> artifact(String unitName, String artifactName) {
        Unit unit = requireUnit(unitName);
        if (artifactName == null || !ARTIFACT_NAME.matcher(artifactName).matches()) {
            return Optional.empty();
        }
        return sidecar.read(unit.sourcePath(), artifactName);
    }

    /**
     * Returns to a fresh idle pipeline.
     *
     * @throws PhaseConflictException while a phase is running
     */
    public void reset() {
        state.reset();
        discoveryComplete = false;
    }

    public PipelineSnapshot snapshot() {
        return state.snapshot();
    }

    // --- Helpers ---

    private Unit requireUnit(String unitName) {
        return state.unit(unitName).orElseThrow(() -> new UnitNotFoundException(unitName));
    }

    private void recordPrompt(Unit unit, Stage stage, String prompt) {
        state.updateUnit(unit.name(), u -> u.withPrompt(stage, prompt));
    }

    private JsonNode invokeAndParse(Stage stage, String prompt) {
        long startMs = System.currentTimeMillis();
        String raw;
        try {
            raw = tool.invoke(prompt);
        } catch (RuntimeException e) {
            recordInvocation(stage, "failure", startMs);
            throw e;
        }
        recordInvocation(stage, "success", startMs);
        JsonNode parsed = normalizer.parse(raw);
        if (ResponseNormalizer.isDegraded(parsed) && metrics != null) {
            metrics.recordDegradedResponse(stage);
        }
        return parsed;
    }

    private void recordInvocation(Stage stage, String outcome, long startMs) {
        if (metrics != null) {
            metrics.recordToolInvocation(stage, outcome, System.currentTimeMillis() - startMs);
        }
    }

    private static Optional<JsonNode> findFinding(Unit unit, String findingId) {
        if (unit.analysis() == null) {
            return Optional.empty();
        }
        JsonNode findings = unit.analysis().path("findings");
        if (!findings.isArray()) {
            return Optional.empty();
        }
        for (JsonNode finding : findings) {
            if (findingId.equals(finding.path("id").asText(null))) {
                return Optional.of(finding);
            }
        }
        return Optional.empty();
    }

    private static String readSource(Unit unit) throws IOException {
        return Files.readString(unit.sourcePath(), StandardCharsets.UTF_8);
    }

    private static String readSourceUnchecked(Unit unit) {
        try {
            return readSource(unit);
        } catch (IOException e) {
            throw new SourceUnavailableException(unit.name(), unit.sourcePath(), e);
        }
    }

    private static String serialized(JsonNode node) {
        return (node != null ? node : JsonNodeFactory.instance.objectNode()).toPrettyString();
    }

    private static String fileName(Unit unit) {
        return unit.sourcePath().getFileName().toString();
    }

    static String previewName(Unit unit) {
        String name = fileName(unit);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? PREVIEW_ARTIFACT + name.substring(dot) : PREVIEW_ARTIFACT;
    }
}
