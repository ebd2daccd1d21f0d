package com.phillippitts.presetgraph.service.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One abort flag per run, shared by every node and branch of that run.
 *
 * <p>Monotonic: once cancelled it stays cancelled. Nodes observe it at their boundaries;
 * completions already in flight finish and their results are discarded.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Sets the flag.
     *
     * @return true if this call cancelled the token, false if it already was
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[" + (isCancelled() ? "cancelled" : "active") + "]";
    }
}
