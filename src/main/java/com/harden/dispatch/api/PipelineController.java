package com.harden.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.harden.core.engine.FindingNotFoundException;
import com.harden.core.engine.HardeningPipeline;
import com.harden.core.engine.PhaseConflictException;
import com.harden.core.engine.RetryAcknowledgement;
import com.harden.core.engine.SourceUnavailableException;
import com.harden.core.engine.UnitBusyException;
import com.harden.core.engine.UnitNotFoundException;
import com.harden.core.llm.ToolInvocationException;
import com.harden.core.model.PipelinePhase;
import com.harden.core.model.PipelineSnapshot;
import com.harden.core.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for driving and observing the hardening pipeline.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final HardeningPipeline pipeline;
    private final SseStreamingService sseStreamingService;

    public PipelineController(HardeningPipeline pipeline, SseStreamingService sseStreamingService) {
        this.pipeline = pipeline;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/pipeline/start. Discovery and analysis run asynchronously.
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, String>> start() {
        try {
            pipeline.startAsync();
        } catch (PhaseConflictException e) {
            return conflict(e);
        }
        log.info("Pipeline run accepted");
        return ResponseEntity.accepted().body(Map.of("status", PipelinePhase.DISCOVERING.wireName()));
    }

    @GetMapping("/status")
    public ResponseEntity<PipelineSnapshot> status() {
        return ResponseEntity.ok(pipeline.snapshot());
    }

    /**
     * GET /api/v1/pipeline/events. A {@code snapshot} event on connect and after every change.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return sseStreamingService.createEmitter();
    }

    /**
     * POST /api/v1/pipeline/decisions with a body of {@code {unit_name: decision}}.
     * Hardening and verification run asynchronously.
     */
    @PostMapping("/decisions")
    public ResponseEntity<Map<String, String>> submitDecisions(@RequestBody(required = false) Map<String, JsonNode> decisions) {
        if (decisions == null || decisions.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one decision is required"));
        }
        for (var entry : decisions.entrySet()) {
            if (entry.getValue() == null || !entry.getValue().isObject()) {
                return ResponseEntity.badRequest().body(
                        Map.of("error", "Decision for " + entry.getKey() + " must be an object"));
            }
        }
        try {
            pipeline.submitDecisionsAsync(decisions);
        } catch (PhaseConflictException e) {
            return conflict(e);
        }
        return ResponseEntity.accepted().body(Map.of("status", PipelinePhase.HARDENING.wireName()));
    }

    @PostMapping("/units/{name}/ask")
    public ResponseEntity<Map<String, String>> ask(@PathVariable String name,
                                                   @RequestBody(required = false) AskRequest request) {
        if (request == null || request.question() == null || request.question().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Question is required"));
        }
        try {
            String answer = pipeline.askAboutUnit(name, request.question());
            return ResponseEntity.ok(Map.of("unit", name, "answer", answer));
        } catch (UnitNotFoundException e) {
            return notFound(e);
        } catch (ToolInvocationException e) {
            return toolFailure(e);
        } catch (SourceUnavailableException e) {
            return sourceUnavailable(e);
        }
    }

    @PostMapping("/units/{name}/findings/{findingId}/explain")
    public ResponseEntity<Map<String, String>> explain(@PathVariable String name, @PathVariable String findingId) {
        try {
            String explanation = pipeline.explainFinding(name, findingId);
            var body = new LinkedHashMap<String, String>();
            body.put("unit", name);
            body.put("finding_id", findingId);
            body.put("explanation", explanation);
            return ResponseEntity.ok(body);
        } catch (UnitNotFoundException | FindingNotFoundException e) {
            return notFound(e);
        } catch (ToolInvocationException e) {
            return toolFailure(e);
        } catch (SourceUnavailableException e) {
            return sourceUnavailable(e);
        }
    }

    @PostMapping("/units/{name}/retry")
    public ResponseEntity<?> retry(@PathVariable String name) {
        try {
            RetryAcknowledgement ack = pipeline.retryUnit(name);
            return ResponseEntity.accepted().body(ack);
        } catch (UnitNotFoundException e) {
            return notFound(e);
        } catch (UnitBusyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", e.getMessage(),
                    "status", e.getStatus().wireName()));
        }
    }

    @GetMapping("/units/{name}/prompts/{stage}")
    public ResponseEntity<Map<String, String>> prompt(@PathVariable String name, @PathVariable String stage) {
        Optional<Stage> parsed = Stage.fromWireName(stage);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown stage: " + stage));
        }
        try {
            return pipeline.prompt(name, parsed.get())
                    .map(prompt -> ResponseEntity.ok(Map.of(
                            "unit", name, "stage", parsed.get().wireName(), "prompt", prompt)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "No " + stage + " prompt recorded for " + name)));
        } catch (UnitNotFoundException e) {
            return notFound(e);
        }
    }

    @GetMapping(value = "/units/{name}/artifacts/{artifact:.+}", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> artifact(@PathVariable String name, @PathVariable String artifact) {
        try {
            return pipeline.artifact(name, artifact)
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (UnitNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, String>> reset() {
        try {
            pipeline.reset();
        } catch (PhaseConflictException e) {
            return conflict(e);
        }
        return ResponseEntity.ok(Map.of("status", PipelinePhase.IDLE.wireName()));
    }

    private static ResponseEntity<Map<String, String>> conflict(PhaseConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", e.getMessage(),
                "phase", e.getCurrentPhase().wireName()));
    }

    private static ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    private static ResponseEntity<Map<String, String>> toolFailure(ToolInvocationException e) {
        log.warn("Tool invocation failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
    }

    private static ResponseEntity<Map<String, String>> sourceUnavailable(SourceUnavailableException e) {
        log.error("{}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }
}
