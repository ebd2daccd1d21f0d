package com.phillippitts.presetgraph.service.sink;

/** Speaks text aloud. Fire-and-forget. */
public interface SpeechSink {

    void speak(String text);
}
