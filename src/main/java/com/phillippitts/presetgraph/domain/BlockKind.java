package com.phillippitts.presetgraph.domain;

/**
 * Kind of processing step a {@link Block} performs.
 */
public enum BlockKind {
    /** Pass-through step: forwards its input text unchanged and carries the captured payload. */
    INPUT_ADAPTER,
    /** Text completion over the incoming text. */
    TEXT,
    /** Vision completion over the captured image bytes. */
    IMAGE
}
