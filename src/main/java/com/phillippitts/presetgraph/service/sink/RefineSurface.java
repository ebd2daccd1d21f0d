package com.phillippitts.presetgraph.service.sink;

/** The "refine" prompt input of an open result display. */
public interface RefineSurface {

    /** Surface that is never active. */
    RefineSurface INACTIVE = new RefineSurface() {
        @Override
        public boolean isActive() {
            return false;
        }

        @Override
        public void setText(String text) {
            throw new IllegalStateException("No refine surface is active");
        }
    };

    boolean isActive();

    void setText(String text);
}
