package com.harden.core.health;

import com.harden.core.config.HardenProperties;
import com.harden.core.model.PipelinePhase;
import com.harden.core.state.PipelineState;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final HardenProperties properties;
    private final PipelineState state;
    private final String pathVariable;

    public HealthCheckService(HardenProperties properties, PipelineState state) {
        this(properties, state, System.getenv("PATH"));
    }

    HealthCheckService(HardenProperties properties, PipelineState state, String pathVariable) {
        this.properties = properties;
        this.state = state;
        this.pathVariable = pathVariable;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSourceRoot());
        results.add(checkTool());
        results.add(checkPipeline());
        return results;
    }

    private HealthStatus checkSourceRoot() {
        Path sourceRoot = properties.getSourceRoot();
        if (Files.isDirectory(sourceRoot)) {
            return new HealthStatus("source", HealthStatus.Status.UP,
                    "Source directory available", Map.of("path", sourceRoot.toString()));
        }
        return new HealthStatus("source", HealthStatus.Status.DOWN,
                "Source directory not found", Map.of("path", sourceRoot.toString()));
    }

    private HealthStatus checkTool() {
        String command = properties.getTool().getCommand();
        Path resolved = resolveExecutable(command);
        if (resolved != null) {
            return new HealthStatus("tool", HealthStatus.Status.UP,
                    "Tool command found", Map.of("command", command, "path", resolved.toString()));
        }
        return new HealthStatus("tool", HealthStatus.Status.DOWN,
                "Tool command not found on PATH", Map.of("command", command));
    }

    private HealthStatus checkPipeline() {
        PipelinePhase phase = state.phase();
        var metadata = Map.of("phase", phase.wireName());
        if (phase == PipelinePhase.ERRORED) {
            return new HealthStatus("pipeline", HealthStatus.Status.DEGRADED,
                    "Pipeline errored during discovery", metadata);
        }
        return new HealthStatus("pipeline", HealthStatus.Status.UP, "Pipeline available", metadata);
    }

    Path resolveExecutable(String command) {
        if (command == null || command.isBlank()) {
            return null;
        }
        if (command.contains(File.separator)) {
            Path direct = Path.of(command);
            return Files.isExecutable(direct) ? direct : null;
        }
        if (pathVariable == null) {
            return null;
        }
        for (String dir : pathVariable.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, command);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
