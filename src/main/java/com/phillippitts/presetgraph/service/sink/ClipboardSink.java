package com.phillippitts.presetgraph.service.sink;

/** Writes node output to the system clipboard. */
public interface ClipboardSink {

    void copyText(String text);

    /** @param imageBytes encoded image (PNG, JPEG...) */
    void copyImage(byte[] imageBytes);
}
