package com.harden.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harden.core.config.HardenProperties;
import com.harden.core.engine.HardeningPipeline;
import com.harden.core.events.EventBus;
import com.harden.core.model.ErrorEntry;
import com.harden.core.model.PipelinePhase;
import com.harden.core.model.PipelineSnapshot;
import com.harden.core.model.Unit;
import com.harden.core.model.UnitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the harden CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private HardeningPipeline pipeline;
    private HardenProperties properties;
    private EventBus eventBus;
    private AtomicReference<PipelineSnapshot> current;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        pipeline = mock(HardeningPipeline.class);
        properties = new HardenProperties();
        eventBus = new EventBus();
        current = new AtomicReference<>(snapshot(PipelinePhase.AWAITING_DECISIONS,
                unit("a_controller", UnitStatus.ANALYZED),
                unit("b_controller", UnitStatus.ERROR)));
        when(pipeline.snapshot()).thenAnswer(inv -> current.get());
        when(pipeline.discover()).thenReturn(true);
    }

    private Unit unit(String name, UnitStatus status) {
        JsonNode analysis = mapper.createObjectNode().put("overall_risk", "medium")
                .set("findings", mapper.createArrayNode().add(mapper.createObjectNode().put("id", "finding_001")));
        return Unit.discovered(name, "app/controllers/" + name + ".rb", "/srv/app/controllers/" + name + ".rb")
                .withStatus(status)
                .withAnalysis(status == UnitStatus.ERROR ? null : analysis);
    }

    private PipelineSnapshot snapshot(PipelinePhase phase, Unit... units) {
        var map = new LinkedHashMap<String, Unit>();
        for (Unit u : units) {
            map.put(u.name(), u);
        }
        return new PipelineSnapshot(phase, map, List.of(), null, null);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(pipeline, properties, eventBus, mapper);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(mapper);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new HardenCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("serve", "run", "status", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("harden 0.1.0"));
        }

        @Test
        @DisplayName("run --help shows the decision options")
        void runHelp() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--decisions"));
            assertTrue(result.output().contains("--approve-all"));
            assertTrue(result.output().contains("--root"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: harden"));
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("without decisions stops after analysis")
        void analysisOnly() {
            CliResult result = execute("run");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Analysis complete"));
            assertTrue(result.output().contains("a_controller"));
            verify(pipeline).runAnalysis();
            verify(pipeline, never()).submitDecisions(anyMap());
        }

        @Test
        @DisplayName("--approve-all approves every analyzed unit")
        @SuppressWarnings("unchecked")
        void approveAll() {
            current.set(snapshot(PipelinePhase.AWAITING_DECISIONS,
                    unit("a_controller", UnitStatus.ANALYZED),
                    unit("c_controller", UnitStatus.ANALYZED)));
            doAnswer(inv -> {
                current.set(snapshot(PipelinePhase.COMPLETE,
                        unit("a_controller", UnitStatus.VERIFIED),
                        unit("c_controller", UnitStatus.VERIFIED)));
                return null;
            }).when(pipeline).submitDecisions(anyMap());

            CliResult result = execute("run", "--approve-all");

            ArgumentCaptor<Map<String, JsonNode>> captor = ArgumentCaptor.forClass(Map.class);
            verify(pipeline).submitDecisions(captor.capture());
            assertEquals(List.of("a_controller", "c_controller"), List.copyOf(captor.getValue().keySet()));
            assertEquals("approve", captor.getValue().get("a_controller").get("action").asText());
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Pipeline complete"));
        }

        @Test
        @DisplayName("--approve-all leaves errored units out")
        @SuppressWarnings("unchecked")
        void approveAllSkipsErrors() {
            CliResult result = execute("run", "--approve-all");

            ArgumentCaptor<Map<String, JsonNode>> captor = ArgumentCaptor.forClass(Map.class);
            verify(pipeline).submitDecisions(captor.capture());
            assertEquals(List.of("a_controller"), List.copyOf(captor.getValue().keySet()));
            // phase never reached complete in this mock
            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("--decisions reads the decision file")
        @SuppressWarnings("unchecked")
        void decisionsFile() throws IOException {
            Path file = tempDir.resolve("decisions.json");
            Files.writeString(file, """
                    {"a_controller":{"action":"selective","approved_findings":["finding_001"]}}
                    """);

            execute("run", "--decisions", file.toString());

            ArgumentCaptor<Map<String, JsonNode>> captor = ArgumentCaptor.forClass(Map.class);
            verify(pipeline).submitDecisions(captor.capture());
            assertEquals("selective", captor.getValue().get("a_controller").get("action").asText());
        }

        @Test
        @DisplayName("an unreadable decision file exits with 2 before discovery")
        void missingDecisionsFile() {
            CliResult result = execute("run", "--decisions", tempDir.resolve("nope.json").toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Cannot read decisions"));
            verify(pipeline, never()).discover();
        }

        @Test
        @DisplayName("--decisions and --approve-all are mutually exclusive")
        void exclusiveOptions() {
            CliResult result = execute("run", "--decisions", "x.json", "--approve-all");
            assertEquals(2, result.exitCode());
            verify(pipeline, never()).discover();
        }

        @Test
        @DisplayName("failed discovery exits with 1")
        void discoveryFailure() {
            when(pipeline.discover()).thenReturn(false);
            current.set(new PipelineSnapshot(PipelinePhase.ERRORED, Map.of(),
                    List.of(new ErrorEntry("Discovery failed: Source directory not found", Instant.now())),
                    null, null));

            CliResult result = execute("run");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Source directory not found"));
            verify(pipeline, never()).runAnalysis();
        }

        @Test
        @DisplayName("--root overrides the configured project root")
        void rootOption() {
            execute("run", "--root", tempDir.toString());
            assertEquals(tempDir.toAbsolutePath().normalize(), properties.getProjectRoot());
        }

        @Test
        @DisplayName("root cause message walks the cause chain")
        void rootCauseMessage() {
            var e = new RuntimeException("outer", new IllegalStateException("inner"));
            assertEquals("inner", RunCommand.rootCauseMessage(e));
            assertEquals("NullPointerException", RunCommand.rootCauseMessage(new NullPointerException()));
        }
    }

    // =====================================================================
    //  status
    // =====================================================================

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("summarizes snapshot events")
        void summarizeSnapshot() throws Exception {
            String json = mapper.writeValueAsString(current.get());
            String summary = new StatusCommand(mapper).summarize("snapshot", json);
            assertEquals("phase=awaiting_decisions units=2 analyzed=1 error=1 errors=0", summary);
        }

        @Test
        @DisplayName("passes other events through")
        void summarizeOther() {
            assertEquals("{\"x\":1}", new StatusCommand(mapper).summarize("other", "{\"x\":1}"));
            assertEquals("not json", new StatusCommand(mapper).summarize("snapshot", "not json"));
        }

        @Test
        @DisplayName("reports an unreachable server")
        void unreachable() {
            CliResult result = execute("status", "--port", "1");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Cannot connect") || result.output().contains("Status failed"));
        }
    }
}
