package com.harden.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harden.core.model.PipelineSnapshot;
import com.harden.core.model.UnitStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * CLI command: harden status [--port N] [--watch]
 * <p>
 * Queries a running server for the pipeline snapshot, or follows its SSE stream.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the status of a running pipeline server")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ObjectMapper mapper;
    private final HttpClient client;

    public StatusCommand(ObjectMapper mapper) {
        this(mapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build());
    }

    StatusCommand(ObjectMapper mapper, HttpClient client) {
        this.mapper = mapper;
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            if (watch) {
                runWatchMode();
            } else {
                showStatus();
            }
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to pipeline server at localhost:" + port);
            ConsoleOutput.info("Start the server first: harden serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Status failed: " + RunCommand.rootCauseMessage(e));
        }
    }

    private void showStatus() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri("/status"))
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            ConsoleOutput.error("Server returned HTTP " + response.statusCode());
            return;
        }
        ConsoleOutput.snapshot(mapper.readValue(response.body(), PipelineSnapshot.class));
    }

    private void runWatchMode() throws Exception {
        ConsoleOutput.info("Watching pipeline (connecting to localhost:" + port + ")...");
        System.out.println();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri("/events"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            ConsoleOutput.error("Server returned HTTP " + response.statusCode());
            return;
        }

        final String[] currentEventType = {""};
        response.body().forEach(line -> {
            if (line.startsWith("event:")) {
                currentEventType[0] = line.substring(6).trim();
            } else if (line.startsWith("data:")) {
                String data = line.substring(5).trim();
                String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                ConsoleOutput.watchEvent(eventType, summarize(eventType, data));
                currentEventType[0] = "";
            }
        });

        System.out.println();
        ConsoleOutput.info("Stream ended.");
    }

    String summarize(String eventType, String data) {
        if (!"snapshot".equals(eventType)) {
            return data;
        }
        try {
            PipelineSnapshot snapshot = mapper.readValue(data, PipelineSnapshot.class);
            var sb = new StringBuilder("phase=").append(snapshot.phase().wireName());
            sb.append(" units=").append(snapshot.units().size());
            for (UnitStatus status : UnitStatus.values()) {
                long count = snapshot.countByStatus(status);
                if (count > 0) {
                    sb.append(' ').append(status.wireName()).append('=').append(count);
                }
            }
            sb.append(" errors=").append(snapshot.errors().size());
            return sb.toString();
        } catch (Exception e) {
            return data;
        }
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + port + "/api/v1/pipeline" + path);
    }
}
