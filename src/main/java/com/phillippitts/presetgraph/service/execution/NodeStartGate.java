package com.phillippitts.presetgraph.service.execution;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds how many nodes may be in their start phase (model resolution and display creation)
 * at the same time, so a wide fan-out does not open many displays in one burst.
 *
 * <p>Waiting is bounded: if no permit frees up within the timeout the node starts anyway
 * and {@link #enter()} returns false. Only a successful enter must be paired with
 * {@link #exit()}.
 *
 * <p><b>Thread Safety:</b> thread-safe.
 *
 * <pre>{@code
 * boolean entered = gate.enter();
 * try {
 *     // ... create display ...
 * } finally {
 *     if (entered) {
 *         gate.exit();
 *     }
 * }
 * }</pre>
 */
public final class NodeStartGate {

    /** Gate that never blocks. */
    public static final NodeStartGate UNBOUNDED = new NodeStartGate(new Semaphore(Integer.MAX_VALUE), 0);

    private final Semaphore semaphore;
    private final long timeoutMs;

    public NodeStartGate(int maxConcurrentStarts, long timeoutMs) {
        this(new Semaphore(maxConcurrentStarts), timeoutMs);
    }

    NodeStartGate(Semaphore semaphore, long timeoutMs) {
        if (semaphore.availablePermits() <= 0) {
            throw new IllegalArgumentException("maxConcurrentStarts must be positive");
        }
        this.semaphore = semaphore;
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    /**
     * Waits up to the configured timeout for a start permit.
     *
     * @return true if a permit was acquired; false on timeout or interrupt (interrupt flag restored)
     */
    public boolean enter() {
        try {
            return semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void exit() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
