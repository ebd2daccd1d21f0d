package com.phillippitts.presetgraph.service.sink;

/** Persists results of visible nodes. */
public interface HistorySink {

    /**
     * @param result    node output
     * @param inputText text the node was given
     */
    void saveText(String result, String inputText);

    void saveImage(byte[] imageBytes, String result);
}
