package com.phillippitts.presetgraph.service.runner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks active runs so they can be cancelled by id or all at once.
 *
 * <p><b>Thread Safety:</b> thread-safe.
 */
@Component
public class PipelineRunRegistry {

    private static final Logger LOG = LogManager.getLogger(PipelineRunRegistry.class);

    private final Map<String, RunHandle> active = new ConcurrentHashMap<>();

    void register(RunHandle handle) {
        if (active.putIfAbsent(handle.runId(), handle) != null) {
            throw new IllegalStateException("Run already registered: " + handle.runId());
        }
    }

    void deregister(String runId) {
        active.remove(runId);
    }

    public Optional<RunHandle> find(String runId) {
        return Optional.ofNullable(active.get(runId));
    }

    /**
     * @return true if an active run with that id was found and newly cancelled
     */
    public boolean cancel(String runId) {
        RunHandle handle = active.get(runId);
        if (handle == null) {
            return false;
        }
        boolean cancelled = handle.cancel();
        if (cancelled) {
            LOG.info("Run {} cancelled", runId);
        }
        return cancelled;
    }

    /**
     * Cancels every active run.
     *
     * @return number of runs newly cancelled
     */
    public int cancelAll() {
        int count = 0;
        for (RunHandle handle : active.values()) {
            if (handle.cancel()) {
                count++;
            }
        }
        if (count > 0) {
            LOG.info("Cancelled {} active run(s)", count);
        }
        return count;
    }

    public int activeCount() {
        return active.size();
    }
}
