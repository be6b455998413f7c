package com.harden.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * {@link ReasoningTool} backed by a command-line process, by default {@code claude -p <prompt>}.
 *
 * <p>The prompt is passed as a single argv element, so no shell is involved and no
 * quoting is needed. Stderr is merged into stdout and captured in a temp file so the
 * process can never block on a full pipe while we wait for it.
 *
 * <p>Optional limits:
 * <ul>
 *   <li>{@code timeout} - a non-zero duration after which the process is destroyed</li>
 *   <li>{@code maxConcurrent} - a positive cap on simultaneous invocations</li>
 * </ul>
 */
public class ClaudeCliTool implements ReasoningTool {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliTool.class);

    static final int MAX_OUTPUT_CAPTURE = 500;

    private final List<String> commandPrefix;
    private final Path workingDirectory;
    private final Duration timeout;
    private final Semaphore slots;

    public ClaudeCliTool(List<String> commandPrefix, Path workingDirectory, Duration timeout, int maxConcurrent) {
        if (commandPrefix == null || commandPrefix.isEmpty() || commandPrefix.get(0).isBlank()) {
            throw new IllegalArgumentException("Tool command must not be empty");
        }
        this.commandPrefix = List.copyOf(commandPrefix);
        this.workingDirectory = workingDirectory;
        this.timeout = timeout != null ? timeout : Duration.ZERO;
        this.slots = maxConcurrent > 0 ? new Semaphore(maxConcurrent, true) : null;
    }

    @Override
    public String invoke(String prompt) {
        acquireSlot();
        try {
            return run(prompt);
        } finally {
            releaseSlot();
        }
    }

    public String commandName() {
        return commandPrefix.get(0);
    }

    private String run(String prompt) {
        var command = new ArrayList<>(commandPrefix);
        command.add(prompt);

        Path capture = null;
        try {
            capture = Files.createTempFile("harden-tool-", ".out");
            var builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(capture.toFile());
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }

            log.debug("Invoking {} ({} prompt chars)", commandName(), prompt.length());
            long startMs = System.currentTimeMillis();
            Process process = builder.start();
            process.getOutputStream().close();

            if (!awaitExit(process)) {
                process.destroyForcibly();
                String output = truncate(readCapture(capture));
                throw new ToolInvocationException(
                        commandName() + " timed out after " + timeout.toSeconds() + "s: " + output,
                        ToolInvocationException.NO_EXIT_CODE, output);
            }

            String output = readCapture(capture);
            int exitCode = process.exitValue();
            log.debug("{} exited {} after {}ms", commandName(), exitCode, System.currentTimeMillis() - startMs);
            if (exitCode != 0) {
                String captured = truncate(output);
                throw new ToolInvocationException(
                        commandName() + " failed (exit " + exitCode + "): " + captured,
                        exitCode, captured);
            }
            return output.strip();
        } catch (IOException e) {
            throw new ToolInvocationException("Failed to run " + commandName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException("Interrupted while waiting for " + commandName(), e);
        } finally {
            deleteCapture(capture);
        }
    }

    private boolean awaitExit(Process process) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void acquireSlot() {
        if (slots == null) {
            return;
        }
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException("Interrupted while waiting for a tool slot", e);
        }
    }

    private void releaseSlot() {
        if (slots != null) {
            slots.release();
        }
    }

    private static String readCapture(Path capture) throws IOException {
        return new String(Files.readAllBytes(capture), StandardCharsets.UTF_8);
    }

    private static void deleteCapture(Path capture) {
        if (capture == null) {
            return;
        }
        try {
            Files.deleteIfExists(capture);
        } catch (IOException e) {
            log.warn("Could not delete tool output capture {}: {}", capture, e.getMessage());
        }
    }

    static String truncate(String output) {
        if (output == null) {
            return "";
        }
        return output.length() <= MAX_OUTPUT_CAPTURE ? output : output.substring(0, MAX_OUTPUT_CAPTURE);
    }
}
