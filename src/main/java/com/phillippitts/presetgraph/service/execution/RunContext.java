package com.phillippitts.presetgraph.service.execution;

import java.util.Objects;

/**
 * Per-run values shared by reference across all nodes and branches of one run.
 *
 * @param runId  run identifier
 * @param token  shared cancellation flag
 * @param config configuration captured at run start
 * @param walks  root walk and branches still in progress
 */
public record RunContext(String runId, CancellationToken token, RunConfig config, WalkTracker walks) {

    public RunContext {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(walks, "walks must not be null");
    }

    public RunContext(String runId, CancellationToken token, RunConfig config) {
        this(runId, token, config, WalkTracker.untracked());
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
