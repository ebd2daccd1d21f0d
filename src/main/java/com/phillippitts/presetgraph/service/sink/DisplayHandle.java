package com.phillippitts.presetgraph.service.sink;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque reference to a result display created by a {@link ResultSink}.
 *
 * <p>Only used for UI feedback and for linking a child display to its parent; control flow
 * never depends on it.
 *
 * @param id sink-assigned identifier
 */
public record DisplayHandle(String id) {

    public DisplayHandle {
        Objects.requireNonNull(id, "id must not be null");
    }

    public static DisplayHandle create() {
        return new DisplayHandle(UUID.randomUUID().toString());
    }
}
