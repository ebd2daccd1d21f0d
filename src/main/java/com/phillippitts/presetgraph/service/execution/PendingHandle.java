package com.phillippitts.presetgraph.service.execution;

import com.phillippitts.presetgraph.service.sink.DisplayHandle;
import com.phillippitts.presetgraph.service.sink.ResultSink;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owned reference to a "processing" display inherited from upstream.
 *
 * <p>Exactly one node owns the handle at a time. Ownership moves to the inline successor via
 * {@link #transfer()}, after which this instance is empty. Closing is idempotent and safe
 * from a streaming callback thread.
 */
public final class PendingHandle {

    private final AtomicReference<DisplayHandle> handle;

    private PendingHandle(DisplayHandle handle) {
        this.handle = new AtomicReference<>(handle);
    }

    public static PendingHandle of(DisplayHandle handle) {
        return new PendingHandle(handle);
    }

    public static PendingHandle empty() {
        return new PendingHandle(null);
    }

    public boolean isPresent() {
        return handle.get() != null;
    }

    public Optional<DisplayHandle> peek() {
        return Optional.ofNullable(handle.get());
    }

    /**
     * Closes the held display, if any, and empties this instance.
     *
     * @return true if a display was closed by this call
     */
    public boolean closeWith(ResultSink sink) {
        DisplayHandle h = handle.getAndSet(null);
        if (h == null) {
            return false;
        }
        sink.closeDisplay(h);
        return true;
    }

    /** Moves the handle into a new instance, leaving this one empty. */
    public PendingHandle transfer() {
        return new PendingHandle(handle.getAndSet(null));
    }

    @Override
    public String toString() {
        DisplayHandle h = handle.get();
        return "PendingHandle[" + (h == null ? "empty" : h.id()) + "]";
    }
}
