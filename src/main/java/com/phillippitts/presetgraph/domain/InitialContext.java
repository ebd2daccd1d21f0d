package com.phillippitts.presetgraph.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * The payload captured when a run starts. May be empty.
 *
 * <p>The payload is available verbatim to blocks that need raw bytes (an image block) and is
 * independent of the text flowing through the graph. Instances are immutable; accessors
 * return defensive copies.
 */
public final class InitialContext {

    public enum Kind { NONE, IMAGE, AUDIO }

    private static final InitialContext NONE = new InitialContext(Kind.NONE, new byte[0]);

    private final Kind kind;
    private final byte[] bytes;

    private InitialContext(Kind kind, byte[] bytes) {
        this.kind = kind;
        this.bytes = bytes;
    }

    public static InitialContext none() {
        return NONE;
    }

    public static InitialContext image(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return new InitialContext(Kind.IMAGE, bytes.clone());
    }

    public static InitialContext audio(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return new InitialContext(Kind.AUDIO, bytes.clone());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isImage() {
        return kind == Kind.IMAGE;
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InitialContext other)) {
            return false;
        }
        return kind == other.kind && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "InitialContext[" + kind + ", " + bytes.length + " bytes]";
    }
}
