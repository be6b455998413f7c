package com.harden.core.config;

import com.harden.core.dispatch.DaemonThreadFactory;
import com.harden.core.llm.ClaudeCliTool;
import com.harden.core.llm.ReasoningTool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {

    /**
     * Without a configured working directory the tool inherits the process's.
     */
    @Bean
    public ReasoningTool reasoningTool(HardenProperties properties) {
        var tool = properties.getTool();
        Path workingDirectory = tool.getWorkingDirectory() == null || tool.getWorkingDirectory().isBlank()
                ? null
                : Path.of(tool.getWorkingDirectory());
        return new ClaudeCliTool(properties.getToolCommandLine(), workingDirectory,
                tool.getTimeout(), tool.getMaxConcurrent());
    }

    /**
     * One thread per unit in flight; phases are not bounded here.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService hardenWorkerExecutor() {
        return Executors.newCachedThreadPool(new DaemonThreadFactory("harden-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService hardenRetryExecutor() {
        return Executors.newCachedThreadPool(new DaemonThreadFactory("harden-retry"));
    }

    /**
     * Runs phase sequences started from the API so requests return immediately.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService hardenOrchestrationExecutor() {
        return Executors.newSingleThreadExecutor(new DaemonThreadFactory("harden-orchestrator"));
    }
}
