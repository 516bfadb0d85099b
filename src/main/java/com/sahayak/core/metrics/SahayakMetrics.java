package com.sahayak.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the voice agent.
 */
@Service
public class SahayakMetrics {

    private final MeterRegistry registry;

    public SahayakMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param source {@code voice} or {@code text}
     */
    public void recordCommand(String source) {
        Counter.builder("sahayak.commands.total")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param source {@code llm} or {@code fallback}
     */
    public void recordPlan(String source) {
        Counter.builder("sahayak.plans.total")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("sahayak.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param service {@code stt}, {@code llm}, {@code tts} or {@code audit}
     */
    public void recordUpstreamFailure(String service) {
        Counter.builder("sahayak.upstream.failures")
                .description("Failed calls to external services")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void recordRateLimited(String scope) {
        Counter.builder("sahayak.ratelimit.denied")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    public void recordMalformedFrame(String code) {
        Counter.builder("sahayak.frames.malformed")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void recordExecutionResult(boolean success) {
        Counter.builder("sahayak.executions.total")
                .tag("result", success ? "success" : "failed")
                .register(registry)
                .increment();
    }

    /**
     * @param event {@code opened}, {@code closed}, {@code replaced} or {@code error}
     */
    public void recordConnection(String event) {
        Counter.builder("sahayak.connections.events")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public void recordUtteranceBytes(int bytes) {
        DistributionSummary.builder("sahayak.utterance.bytes")
                .baseUnit("bytes")
                .register(registry)
                .record(bytes);
    }
}
