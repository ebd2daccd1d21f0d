package com.phillippitts.presetgraph.service.sink;

/**
 * A live text-editing surface owned by the application that can receive text directly.
 */
public interface EditingSurface {

    /** Surface that is never active. */
    EditingSurface INACTIVE = new EditingSurface() {
        @Override
        public boolean isActive() {
            return false;
        }

        @Override
        public void insertText(String text) {
            throw new IllegalStateException("No editing surface is active");
        }

        @Override
        public void refocus() {
            // nothing to focus
        }
    };

    boolean isActive();

    void insertText(String text);

    void refocus();
}
