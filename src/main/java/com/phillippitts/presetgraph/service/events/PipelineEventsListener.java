package com.phillippitts.presetgraph.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs pipeline events succinctly (no result text). Side-effect failures are throttled per
 * action and reason to avoid log spam when, for example, the clipboard is unavailable.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onNodeCompleted(NodeCompletedEvent e) {
        if (e.outcome() == NodeCompletedEvent.Outcome.SUCCESS) {
            LOG.debug("Node done: run={}, block={}#{}, model={}, retries={}, {}ms",
                    e.runId(), e.blockIndex(), e.blockId(), e.modelId(), e.retries(), e.durationMs());
        } else {
            LOG.info("Node {}: run={}, block={}#{}, model={}, retries={}, {}ms", e.outcome(),
                    e.runId(), e.blockIndex(), e.blockId(), e.modelId(), e.retries(), e.durationMs());
        }
    }

    @EventListener
    void onSideEffectFailed(SideEffectFailedEvent e) {
        if (shouldLog("side-effect-" + e.action() + '-' + e.reason())) {
            LOG.warn("Side effect '{}' failed for block {} (run={}): {}", e.action(), e.blockId(), e.runId(), e.reason());
        }
    }

    @EventListener
    void onRunFinished(PipelineRunFinishedEvent e) {
        LOG.info("Run {} finished: preset={}, cancelled={}, {}ms", e.runId(), e.presetId(), e.cancelled(), e.durationMs());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
