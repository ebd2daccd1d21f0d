package com.phillippitts.presetgraph.service.sink;

/**
 * Generic paste into the last known target window, used when no editing or refine surface
 * is active and for image-only pastes.
 */
public interface PasteSink {

    /**
     * Pastes the current clipboard content.
     *
     * @param text the text that was just copied, or {@code null} for an image paste
     */
    void pasteIntoLastTarget(String text);
}
