package com.harden.dispatch.api;

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
import com.harden.core.model.Unit;
import com.harden.core.model.UnitStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PipelineController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PipelineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HardeningPipeline pipeline;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    // ── POST /start ────────────────────────────────────────────────

    @Test
    @DisplayName("POST /start returns 202 with status discovering")
    void start() throws Exception {
        mockMvc.perform(post("/api/v1/pipeline/start"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("discovering"));
        verify(pipeline).startAsync();
    }

    @Test
    @DisplayName("POST /start while running returns 409 with the current phase")
    void startConflict() throws Exception {
        doThrow(new PhaseConflictException("Expected phase idle", PipelinePhase.ANALYZING))
                .when(pipeline).startAsync();

        mockMvc.perform(post("/api/v1/pipeline/start"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.phase").value("analyzing"))
                .andExpect(jsonPath("$.error", containsString("analyzing")));
    }

    // ── GET /status ────────────────────────────────────────────────

    @Test
    @DisplayName("GET /status returns the snapshot in wire format")
    void statusReturnsSnapshot() throws Exception {
        Unit unit = Unit.discovered("posts_controller", "app/controllers/posts_controller.rb",
                "/srv/app/controllers/posts_controller.rb");
        when(pipeline.snapshot()).thenReturn(new PipelineSnapshot(
                PipelinePhase.DISCOVERING, Map.of(unit.name(), unit), List.of(), null, null));

        mockMvc.perform(get("/api/v1/pipeline/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("discovering"))
                .andExpect(jsonPath("$.units.posts_controller.status").value("pending"))
                .andExpect(jsonPath("$.units.posts_controller.full_path")
                        .value("/srv/app/controllers/posts_controller.rb"))
                .andExpect(jsonPath("$.units.posts_controller.prompts").doesNotExist())
                .andExpect(jsonPath("$.errors", hasSize(0)));
    }

    @Test
    @DisplayName("GET /events returns an SSE emitter")
    void events() throws Exception {
        when(sseStreamingService.createEmitter()).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/pipeline/events"))
                .andExpect(status().isOk());
    }

    // ── POST /decisions ────────────────────────────────────────────

    @Test
    @DisplayName("POST /decisions returns 202 with status hardening")
    void decisions() throws Exception {
        mockMvc.perform(post("/api/v1/pipeline/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"posts_controller":{"action":"approve"},"users_controller":{"action":"skip"}}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("hardening"));
        verify(pipeline).submitDecisionsAsync(anyMap());
    }

    @Test
    @DisplayName("POST /decisions with an empty body returns 400")
    void decisionsEmpty() throws Exception {
        mockMvc.perform(post("/api/v1/pipeline/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one decision is required"));
        verify(pipeline, never()).submitDecisionsAsync(anyMap());
    }

    @Test
    @DisplayName("POST /decisions with a non-object decision returns 400")
    void decisionsNotObject() throws Exception {
        mockMvc.perform(post("/api/v1/pipeline/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"posts_controller\":\"approve\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("posts_controller")));
    }

    @Test
    @DisplayName("POST /decisions in the wrong phase returns 409")
    void decisionsConflict() throws Exception {
        doThrow(new PhaseConflictException("Decisions are only accepted while awaiting decisions",
                PipelinePhase.ANALYZING)).when(pipeline).submitDecisionsAsync(anyMap());

        mockMvc.perform(post("/api/v1/pipeline/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"posts_controller\":{\"action\":\"approve\"}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.phase").value("analyzing"));
    }

    // ── Ad-hoc ─────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /units/{name}/ask returns the answer")
    void ask() throws Exception {
        when(pipeline.askAboutUnit("posts_controller", "Is create safe?")).thenReturn("Mostly.");

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Is create safe?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unit").value("posts_controller"))
                .andExpect(jsonPath("$.answer").value("Mostly."));
    }

    @Test
    @DisplayName("POST /units/{name}/ask without a question returns 400")
    void askBlank() throws Exception {
        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /units/{name}/ask for an unknown unit returns 404")
    void askUnknown() throws Exception {
        when(pipeline.askAboutUnit(any(), any())).thenThrow(new UnitNotFoundException("nope"));

        mockMvc.perform(post("/api/v1/pipeline/units/nope/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"?\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unit not found: nope"));
    }

    @Test
    @DisplayName("POST /units/{name}/ask returns 502 when the tool fails")
    void askToolFailure() throws Exception {
        when(pipeline.askAboutUnit(any(), any()))
                .thenThrow(new ToolInvocationException("Tool exited with code 2", 2, ""));

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"?\"}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    @DisplayName("POST /units/{name}/ask returns 500 when the source can no longer be read")
    void askSourceUnavailable() throws Exception {
        IOException cause = new NoSuchFileException("/srv/app/controllers/posts_controller.rb");
        when(pipeline.askAboutUnit(any(), any())).thenThrow(new SourceUnavailableException(
                "posts_controller", Path.of("/srv/app/controllers/posts_controller.rb"), cause));

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"?\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", containsString("Cannot read source of posts_controller")));
    }

    @Test
    @DisplayName("POST /units/{name}/findings/{id}/explain returns the explanation")
    void explain() throws Exception {
        when(pipeline.explainFinding("posts_controller", "finding_001")).thenReturn("An attacker could...");

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/findings/finding_001/explain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finding_id").value("finding_001"))
                .andExpect(jsonPath("$.explanation").value("An attacker could..."));
    }

    @Test
    @DisplayName("POST /units/{name}/findings/{id}/explain for a missing finding returns 404")
    void explainMissingFinding() throws Exception {
        when(pipeline.explainFinding("posts_controller", "finding_999"))
                .thenThrow(new FindingNotFoundException("posts_controller", "finding_999"));

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/findings/finding_999/explain"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /units/{name}/retry returns 202 with the acknowledgement")
    void retry() throws Exception {
        when(pipeline.retryUnit("posts_controller")).thenReturn(RetryAcknowledgement.retrying("posts_controller"));

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/retry"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("retrying"))
                .andExpect(jsonPath("$.unit").value("posts_controller"));
    }

    @Test
    @DisplayName("POST /units/{name}/retry for an unknown unit returns 404")
    void retryUnknown() throws Exception {
        when(pipeline.retryUnit("nope")).thenThrow(new UnitNotFoundException("nope"));

        mockMvc.perform(post("/api/v1/pipeline/units/nope/retry"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /units/{name}/findings/{id}/explain returns 500 when the source can no longer be read")
    void explainSourceUnavailable() throws Exception {
        when(pipeline.explainFinding("posts_controller", "finding_001")).thenThrow(new SourceUnavailableException(
                "posts_controller", Path.of("/srv/app/controllers/posts_controller.rb"),
                new NoSuchFileException("/srv/app/controllers/posts_controller.rb")));

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/findings/finding_001/explain"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    @DisplayName("POST /units/{name}/retry while the unit is being processed returns 409")
    void retryBusy() throws Exception {
        when(pipeline.retryUnit("posts_controller"))
                .thenThrow(new UnitBusyException("posts_controller", UnitStatus.HARDENING));

        mockMvc.perform(post("/api/v1/pipeline/units/posts_controller/retry"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("hardening"))
                .andExpect(jsonPath("$.error", containsString("busy")));
    }

    // ── Prompts and artifacts ──────────────────────────────────────

    @Test
    @DisplayName("GET /units/{name}/prompts/{stage} returns the last prompt")
    void prompt() throws Exception {
        when(pipeline.prompt("posts_controller", Stage.ANALYSIS)).thenReturn(Optional.of("Analyze this"));

        mockMvc.perform(get("/api/v1/pipeline/units/posts_controller/prompts/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("analysis"))
                .andExpect(jsonPath("$.prompt").value("Analyze this"));
    }

    @Test
    @DisplayName("GET /units/{name}/prompts/{stage} with an unknown stage returns 400")
    void promptUnknownStage() throws Exception {
        mockMvc.perform(get("/api/v1/pipeline/units/posts_controller/prompts/deploy"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /units/{name}/prompts/{stage} before the stage ran returns 404")
    void promptNotRecorded() throws Exception {
        when(pipeline.prompt("posts_controller", Stage.HARDENING)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/pipeline/units/posts_controller/prompts/hardening"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /units/{name}/artifacts/{file} returns the file as text")
    void artifact() throws Exception {
        when(pipeline.artifact("posts_controller", "analysis.json")).thenReturn(Optional.of("{\"findings\":[]}\n"));

        mockMvc.perform(get("/api/v1/pipeline/units/posts_controller/artifacts/analysis.json"))
                .andExpect(status().isOk())
                .andExpect(content().string("{\"findings\":[]}\n"));
    }

    @Test
    @DisplayName("GET /units/{name}/artifacts/{file} for a missing file returns 404")
    void artifactMissing() throws Exception {
        when(pipeline.artifact("posts_controller", "hardened.json")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/pipeline/units/posts_controller/artifacts/hardened.json"))
                .andExpect(status().isNotFound());
    }

    // ── POST /reset ────────────────────────────────────────────────

    @Test
    @DisplayName("POST /reset returns idle")
    void reset() throws Exception {
        mockMvc.perform(post("/api/v1/pipeline/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("idle"));
    }

    @Test
    @DisplayName("POST /reset while running returns 409")
    void resetConflict() throws Exception {
        doThrow(new PhaseConflictException("Cannot reset a running pipeline", PipelinePhase.HARDENING))
                .when(pipeline).reset();

        mockMvc.perform(post("/api/v1/pipeline/reset"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.phase").value("hardening"));
    }
}
