package com.harden.dispatch.api;

import com.harden.core.events.EventBus;
import com.harden.core.events.PipelineEvent;
import com.harden.core.state.PipelineState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams the pipeline snapshot to SSE clients.
 * <p>
 * Each client receives a {@code snapshot} event when it connects and another one
 * after every change published on the {@link EventBus}. Heartbeats are sent as SSE
 * comments so idle connections survive proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String SNAPSHOT_EVENT = "snapshot";

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final PipelineState state;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, PipelineState state) {
        this(eventBus, state, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, PipelineState state, long timeoutMs) {
        this.eventBus = eventBus;
        this.state = state;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed (connection likely closed): {}", e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped (emitter not active)");
            }
        }
    }

    /**
     * Creates an emitter, sends the current snapshot and follows every change.
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribeAll(event -> sendSnapshot(emitter, event));
        var registration = new EmitterRegistration(emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed");
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out");
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error: {}", ex.getMessage());
            cleanup(registration);
        });

        sendSnapshot(emitter, null);
        log.info("SSE emitter created (timeout={}ms, active={})", timeoutMs, activeRegistrations.size());
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendSnapshot(SseEmitter emitter, PipelineEvent cause) {
        try {
            emitter.send(SseEmitter.event()
                    .name(SNAPSHOT_EVENT)
                    .data(state.snapshot()));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send snapshot after {}: {}",
                    cause != null ? cause.eventType() : "connect", e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
