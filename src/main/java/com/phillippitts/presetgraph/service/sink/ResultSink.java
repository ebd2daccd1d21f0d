package com.phillippitts.presetgraph.service.sink;

/**
 * Displays node results to the user.
 *
 * <p>Calls for one handle arrive in order but may come from different threads; calls for
 * different handles may be concurrent.
 */
public interface ResultSink {

    DisplayHandle createDisplay(DisplayRequest request);

    void updateDisplay(DisplayHandle handle, String text);

    /** Makes a display created with {@code hidden=true} visible. */
    void showDisplay(DisplayHandle handle);

    /** Toggles the "refining" indicator shown while a node waits for its first output. */
    void setRefining(DisplayHandle handle, boolean refining);

    void closeDisplay(DisplayHandle handle);

    void link(DisplayHandle parent, DisplayHandle child);
}
