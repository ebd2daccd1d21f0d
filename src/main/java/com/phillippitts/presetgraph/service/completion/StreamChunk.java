package com.phillippitts.presetgraph.service.completion;

import java.util.Objects;

/**
 * One incremental piece of a streamed completion.
 *
 * <p>{@link Type#APPEND} extends the accumulated text; {@link Type#RESET} discards it and
 * starts over with this chunk's text. Providers that can only emit strings signal a reset
 * with the {@link #WIPE_SIGNAL} prefix, decoded by {@link #fromRaw(String)}.
 *
 * @param type chunk kind
 * @param text chunk text, never null
 */
public record StreamChunk(Type type, String text) {

    /** Raw-string reset marker used on the provider side of the boundary. */
    public static final String WIPE_SIGNAL = "\u0000WIPE\u0000";

    public enum Type { APPEND, RESET }

    public StreamChunk {
        Objects.requireNonNull(type, "type must not be null");
        text = text == null ? "" : text;
    }

    public static StreamChunk append(String text) {
        return new StreamChunk(Type.APPEND, text);
    }

    public static StreamChunk reset(String text) {
        return new StreamChunk(Type.RESET, text);
    }

    /**
     * Decodes a raw provider chunk. A chunk starting with {@link #WIPE_SIGNAL} becomes a
     * {@link Type#RESET} carrying the text after the marker.
     */
    public static StreamChunk fromRaw(String raw) {
        if (raw == null) {
            return append("");
        }
        if (raw.startsWith(WIPE_SIGNAL)) {
            return reset(raw.substring(WIPE_SIGNAL.length()));
        }
        return append(raw);
    }

    public boolean isReset() {
        return type == Type.RESET;
    }
}
