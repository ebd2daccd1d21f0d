package com.phillippitts.presetgraph.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Records node metrics for the executor, tolerating a missing {@link PipelineMetrics}.
 *
 * @see PipelineMetrics
 */
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    /**
     * No-op instance for tests and builder defaults. Never throws and reports as disabled.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(String kind, String provider, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(kind, provider, durationNanos);
        metrics.incrementSuccess(provider);
    }

    public void recordFailure(String kind, String provider, long durationNanos, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(kind, provider, durationNanos);
        metrics.incrementFailure(provider, reason);
    }

    public void recordRetry(String provider) {
        if (metrics == null) {
            return;
        }
        metrics.incrementRetry(provider);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
