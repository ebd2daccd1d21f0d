package com.phillippitts.presetgraph.domain;

/** How a block's result display renders its text. */
public enum RenderMode {
    PLAIN,
    /** Rendered once complete; streaming is disabled for markdown blocks. */
    MARKDOWN
}
