package com.phillippitts.presetgraph.service.runner;

import com.phillippitts.presetgraph.service.execution.CancellationToken;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a started run.
 *
 * <p>{@link #completion()} completes once the root walk and every branch spawned by the run
 * have returned. Until then the run is listed in the {@link PipelineRunRegistry}.
 */
public final class RunHandle {

    private final String runId;
    private final String presetId;
    private final CancellationToken token;
    private final Instant startedAt;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    RunHandle(String runId, String presetId, CancellationToken token) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.presetId = presetId;
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.startedAt = Instant.now();
    }

    public String runId() {
        return runId;
    }

    public String presetId() {
        return presetId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * Requests cancellation. Nodes not yet started are skipped; a completion in flight
     * finishes but its result is discarded.
     *
     * @return true if this call cancelled the run
     */
    public boolean cancel() {
        return token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }

    CancellationToken token() {
        return token;
    }

    void markDone() {
        completion.complete(null);
    }

    @Override
    public String toString() {
        return "RunHandle[" + runId + ", preset=" + presetId + ", cancelled=" + isCancelled() + "]";
    }
}
