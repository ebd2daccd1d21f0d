package com.phillippitts.presetgraph.service.completion;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Running text of one node's streamed completion.
 *
 * <p>Each node invocation owns one accumulator; its lock guards only that node's text.
 * Chunks are applied in the order the provider delivers them.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe.
 */
public final class StreamingAccumulator {

    private final ReentrantLock lock = new ReentrantLock();
    private final StringBuilder text = new StringBuilder();

    /**
     * Applies a chunk and returns the accumulated text after it.
     */
    public String apply(StreamChunk chunk) {
        lock.lock();
        try {
            if (chunk.isReset()) {
                text.setLength(0);
            }
            text.append(chunk.text());
            return text.toString();
        } finally {
            lock.unlock();
        }
    }

    /** Discards everything accumulated so far, e.g. before a retry. */
    public void clear() {
        lock.lock();
        try {
            text.setLength(0);
        } finally {
            lock.unlock();
        }
    }

    public String current() {
        lock.lock();
        try {
            return text.toString();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pure form over raw provider strings: a chunk prefixed with
     * {@link StreamChunk#WIPE_SIGNAL} replaces {@code state}, anything else is appended.
     */
    public static String applyChunk(String state, String rawChunk) {
        StreamChunk chunk = StreamChunk.fromRaw(rawChunk);
        if (chunk.isReset()) {
            return chunk.text();
        }
        return (state == null ? "" : state) + chunk.text();
    }
}
