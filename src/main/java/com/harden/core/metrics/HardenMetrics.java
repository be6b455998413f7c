package com.harden.core.metrics;

import com.harden.core.model.Stage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class HardenMetrics {

    private final MeterRegistry registry;

    public HardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one call to the reasoning tool.
     *
     * @param outcome "success" or "failure"
     */
    public void recordToolInvocation(Stage stage, String outcome, long ms) {
        Timer.builder("harden.tool.invocation")
                .description("External reasoning tool invocations")
                .tag("stage", stage.wireName())
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records how a unit left a stage.
     *
     * @param outcome the unit status after the worker finished, e.g. "analyzed" or "error"
     */
    public void recordUnitOutcome(Stage stage, String outcome) {
        Counter.builder("harden.units.outcome")
                .description("Per-unit stage outcomes")
                .tag("stage", stage.wireName())
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPhaseDuration(Stage stage, long ms) {
        Timer.builder("harden.phase.duration")
                .tag("stage", stage.wireName())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the number of units fanned out in one stage.
     */
    public void recordFanOut(Stage stage, int unitCount) {
        DistributionSummary.builder("harden.phase.units")
                .description("Units dispatched per stage")
                .tag("stage", stage.wireName())
                .register(registry)
                .record(unitCount);
    }

    public void recordDegradedResponse(Stage stage) {
        Counter.builder("harden.response.degraded")
                .description("Tool responses that could not be parsed as JSON")
                .tag("stage", stage.wireName())
                .register(registry)
                .increment();
    }
}
