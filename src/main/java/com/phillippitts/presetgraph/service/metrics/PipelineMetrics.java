package com.phillippitts.presetgraph.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for node execution.
 *
 * <p>Provides:
 * <ul>
 *   <li>Node latency per block kind and provider</li>
 *   <li>Success/failure counts per provider</li>
 *   <li>Fallback retry counts per provider</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "presetgraph.node";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records node latency.
     *
     * @param kind block kind (input_adapter, text, image)
     * @param provider provider id, "none" for adapters
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String kind, String provider, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to execute a node")
                .tag("kind", kind)
                .tag("provider", provider)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String provider) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of nodes that produced a result")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * @param provider provider id
     * @param reason failure reason (provider_error, missing_context, unexpected_error)
     */
    public void incrementFailure(String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of nodes that ended without a result")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param provider provider of the model that failed and is being replaced
     */
    public void incrementRetry(String provider) {
        Counter.builder(METRIC_PREFIX + ".retry")
                .description("Number of retries on a fallback model")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }
}
