package com.phillippitts.presetgraph.service.execution;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts the walks of one run that are still in progress: the root walk plus every branch
 * spawned from it.
 *
 * <p>Starts at one for the root walk. A branch is counted before it is handed to the branch
 * executor, so the count cannot reach zero while a parent walk is still spawning. The
 * callback runs exactly once, on the thread that finishes the last walk.
 */
public final class WalkTracker {

    private final AtomicInteger activeWalks = new AtomicInteger(1);
    private final Runnable onAllFinished;

    public WalkTracker(Runnable onAllFinished) {
        this.onAllFinished = Objects.requireNonNull(onAllFinished, "onAllFinished must not be null");
    }

    /** Tracker for callers that do not need to know when the run ends. */
    public static WalkTracker untracked() {
        return new WalkTracker(() -> { });
    }

    void branchStarted() {
        activeWalks.incrementAndGet();
    }

    /**
     * Marks one walk (root or branch) as returned.
     *
     * @throws IllegalStateException if more walks finish than were started
     */
    public void walkFinished() {
        int remaining = activeWalks.decrementAndGet();
        if (remaining == 0) {
            onAllFinished.run();
        } else if (remaining < 0) {
            throw new IllegalStateException("walkFinished called more often than walks were started");
        }
    }

    public int activeWalks() {
        return Math.max(0, activeWalks.get());
    }
}
