package com.harden.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harden.core.config.HardenProperties;
import com.harden.core.engine.HardeningPipeline;
import com.harden.core.events.EventBus;
import com.harden.core.events.PipelineEvent;
import com.harden.core.model.PipelinePhase;
import com.harden.core.model.PipelineSnapshot;
import com.harden.core.model.Unit;
import com.harden.core.model.UnitStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: harden run [--root DIR] [--decisions FILE | --approve-all]
 * <p>
 * Runs the pipeline in-process. Without decisions it stops after analysis,
 * leaving the analysis artifacts in the sidecar directories for review.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the pipeline in this process")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--root", "-r"}, description = "Project root (default: harden.discovery.root)")
    private Path root;

    @ArgGroup(exclusive = true)
    private DecisionSource decisionSource;

    static class DecisionSource {
        @Option(names = {"--decisions", "-d"}, description = "JSON file mapping unit name to decision")
        Path decisionsFile;

        @Option(names = "--approve-all", description = "Approve every analyzed unit")
        boolean approveAll;
    }

    private final HardeningPipeline pipeline;
    private final HardenProperties properties;
    private final EventBus eventBus;
    private final ObjectMapper mapper;

    public RunCommand(HardeningPipeline pipeline, HardenProperties properties, EventBus eventBus,
                      ObjectMapper mapper) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.eventBus = eventBus;
        this.mapper = mapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (root != null) {
            properties.getDiscovery().setRoot(root.toString());
        }

        Map<String, JsonNode> fileDecisions = null;
        if (decisionSource != null && decisionSource.decisionsFile != null) {
            try {
                fileDecisions = mapper.readValue(decisionSource.decisionsFile.toFile(),
                        new TypeReference<Map<String, JsonNode>>() {});
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read decisions from " + decisionSource.decisionsFile + ": "
                        + rootCauseMessage(e));
                return 2;
            }
        }

        ConsoleOutput.info("Discovering units under " + properties.getSourceRoot());
        EventBus.Subscription subscription = eventBus.subscribeAll(this::printProgress);
        try {
            if (!pipeline.discover()) {
                ConsoleOutput.snapshot(pipeline.snapshot());
                return 1;
            }
            ConsoleOutput.info("Analyzing " + pipeline.snapshot().units().size() + " units...");
            pipeline.runAnalysis();

            Map<String, JsonNode> decisions = fileDecisions != null ? fileDecisions
                    : decisionSource != null && decisionSource.approveAll ? approveAll(pipeline.snapshot())
                    : null;
            if (decisions == null) {
                ConsoleOutput.snapshot(pipeline.snapshot());
                ConsoleOutput.info("Analysis complete. Re-run with --decisions or --approve-all to harden.");
                return 0;
            }

            ConsoleOutput.info("Hardening with " + decisions.size() + " decisions...");
            pipeline.submitDecisions(decisions);
        } catch (Exception e) {
            ConsoleOutput.error("Pipeline failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        PipelineSnapshot result = pipeline.snapshot();
        ConsoleOutput.snapshot(result);
        if (result.phase() == PipelinePhase.COMPLETE && result.countByStatus(UnitStatus.ERROR) == 0) {
            ConsoleOutput.success("Pipeline complete");
            return 0;
        }
        return 1;
    }

    private Map<String, JsonNode> approveAll(PipelineSnapshot snapshot) {
        var decisions = new LinkedHashMap<String, JsonNode>();
        for (Unit unit : snapshot.units().values()) {
            if (unit.status() == UnitStatus.ANALYZED) {
                decisions.put(unit.name(), mapper.createObjectNode().put("action", "approve"));
            }
        }
        return decisions;
    }

    private void printProgress(PipelineEvent event) {
        if (PipelineEvent.UNIT_UPDATED.equals(event.eventType()) && event.payload().containsKey("status")) {
            String status = String.valueOf(event.payload().get("status"));
            for (UnitStatus candidate : UnitStatus.values()) {
                if (candidate.wireName().equals(status)) {
                    ConsoleOutput.unitStatus(event.unitName(), candidate);
                }
            }
        } else if (PipelineEvent.ERROR_RECORDED.equals(event.eventType())) {
            ConsoleOutput.error(String.valueOf(event.payload().get("message")));
        }
    }

    static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
