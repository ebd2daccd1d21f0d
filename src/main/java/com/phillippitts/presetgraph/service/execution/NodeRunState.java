package com.phillippitts.presetgraph.service.execution;

import com.phillippitts.presetgraph.domain.Block;
import com.phillippitts.presetgraph.service.completion.StreamChunk;
import com.phillippitts.presetgraph.service.completion.StreamingAccumulator;
import com.phillippitts.presetgraph.service.model.ModelDescriptor;
import com.phillippitts.presetgraph.service.sink.DisplayHandle;
import com.phillippitts.presetgraph.service.sink.ResultSink;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one node invocation, discarded once the node's side effects are scheduled.
 *
 * <p>The display lock serialises accumulator updates and display writes of this node only.
 */
final class NodeRunState {

    private final Block block;
    private final ModelDescriptor model;
    private final String prompt;
    private final DisplayHandle display;
    private final boolean deferredDisplay;
    private final PendingHandle pending;
    private final StreamingAccumulator accumulator = new StreamingAccumulator();
    private final AtomicBoolean outputStarted = new AtomicBoolean();
    private final ReentrantLock displayLock = new ReentrantLock();

    NodeRunState(Block block, ModelDescriptor model, String prompt, DisplayHandle display,
                 boolean deferredDisplay, PendingHandle pending) {
        this.block = block;
        this.model = model;
        this.prompt = prompt;
        this.display = display;
        this.deferredDisplay = deferredDisplay;
        this.pending = pending;
    }

    Block block() {
        return block;
    }

    /** Resolved model; null for input adapters. */
    ModelDescriptor model() {
        return model;
    }

    String prompt() {
        return prompt;
    }

    /** This node's own display, or null if the node is hidden. */
    DisplayHandle display() {
        return display;
    }

    boolean hasDisplay() {
        return display != null;
    }

    StreamingAccumulator accumulator() {
        return accumulator;
    }

    /**
     * Applies a streamed chunk and mirrors the accumulated text to the display.
     */
    void applyChunk(StreamChunk chunk, ResultSink sink) {
        displayLock.lock();
        try {
            String text = accumulator.apply(chunk);
            firstOutput(sink);
            if (display != null) {
                sink.updateDisplay(display, text);
            }
        } finally {
            displayLock.unlock();
        }
    }

    /** Replaces the display text, e.g. with the final result, an error or a retry notice. */
    void showText(String text, ResultSink sink, boolean countsAsOutput) {
        displayLock.lock();
        try {
            if (countsAsOutput) {
                firstOutput(sink);
            }
            if (display != null) {
                sink.updateDisplay(display, text);
            }
        } finally {
            displayLock.unlock();
        }
    }

    /**
     * Runs once, on the first output: stops the refining indicator and, for a display kept
     * hidden until data arrives, shows it and closes the inherited pending display. Hidden
     * nodes leave the pending display open.
     */
    private void firstOutput(ResultSink sink) {
        if (!outputStarted.compareAndSet(false, true) || display == null) {
            return;
        }
        if (!block.isInputAdapter()) {
            sink.setRefining(display, false);
        }
        if (deferredDisplay) {
            sink.showDisplay(display);
            pending.closeWith(sink);
        }
    }

    /**
     * Closes a display that was kept hidden and never received output. Shown displays stay.
     */
    void closeIfNeverShown(ResultSink sink) {
        displayLock.lock();
        try {
            if (deferredDisplay && !outputStarted.get()) {
                closeDisplay(sink);
            }
        } finally {
            displayLock.unlock();
        }
    }

    void closeDisplay(ResultSink sink) {
        if (display != null) {
            sink.closeDisplay(display);
        }
    }
}
