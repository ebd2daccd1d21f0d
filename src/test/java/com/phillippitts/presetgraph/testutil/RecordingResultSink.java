package com.phillippitts.presetgraph.testutil;

import com.phillippitts.presetgraph.service.sink.DisplayHandle;
import com.phillippitts.presetgraph.service.sink.DisplayRequest;
import com.phillippitts.presetgraph.service.sink.ResultSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ResultSink that records every call. Thread-safe.
 */
public class RecordingResultSink implements ResultSink {

    private final Map<DisplayHandle, DisplayRequest> created = new ConcurrentHashMap<>();
    private final List<DisplayHandle> createdOrder = new CopyOnWriteArrayList<>();
    private final Map<DisplayHandle, List<String>> updates = new ConcurrentHashMap<>();
    private final List<DisplayHandle> shown = new CopyOnWriteArrayList<>();
    private final List<DisplayHandle> closed = new CopyOnWriteArrayList<>();
    private final List<String> refining = new CopyOnWriteArrayList<>();
    private final List<DisplayHandle[]> links = new CopyOnWriteArrayList<>();
    private final List<String> journal = new CopyOnWriteArrayList<>();

    @Override
    public DisplayHandle createDisplay(DisplayRequest request) {
        DisplayHandle handle = new DisplayHandle("display-" + request.blockIndex() + "-" + createdOrder.size());
        created.put(handle, request);
        createdOrder.add(handle);
        journal.add("create:" + label(handle));
        return handle;
    }

    @Override
    public void updateDisplay(DisplayHandle handle, String text) {
        updates.computeIfAbsent(handle, h -> new CopyOnWriteArrayList<>()).add(text);
        journal.add("update:" + label(handle) + ":" + text);
    }

    @Override
    public void showDisplay(DisplayHandle handle) {
        shown.add(handle);
        journal.add("show:" + label(handle));
    }

    @Override
    public void setRefining(DisplayHandle handle, boolean on) {
        refining.add(handle.id() + "=" + on);
    }

    @Override
    public void closeDisplay(DisplayHandle handle) {
        closed.add(handle);
        journal.add("close:" + label(handle));
    }

    @Override
    public void link(DisplayHandle parent, DisplayHandle child) {
        links.add(new DisplayHandle[] {parent, child});
    }

    /**
     * Every call in order. Displays opened by this sink are labelled {@code block<index>},
     * other handles by their id, e.g. {@code create:block1}, {@code close:processing}.
     */
    public List<String> journal() {
        return List.copyOf(journal);
    }

    private String label(DisplayHandle handle) {
        DisplayRequest request = created.get(handle);
        return request == null ? handle.id() : "block" + request.blockIndex();
    }

    public List<DisplayHandle> created() {
        return List.copyOf(createdOrder);
    }

    public DisplayRequest request(DisplayHandle handle) {
        return created.get(handle);
    }

    /** Display opened for the given block index, if any. */
    public Optional<DisplayHandle> displayFor(int blockIndex) {
        return createdOrder.stream().filter(h -> created.get(h).blockIndex() == blockIndex).findFirst();
    }

    public List<String> updates(DisplayHandle handle) {
        return new ArrayList<>(updates.getOrDefault(handle, List.of()));
    }

    public String lastText(DisplayHandle handle) {
        List<String> texts = updates(handle);
        return texts.isEmpty() ? null : texts.get(texts.size() - 1);
    }

    public List<DisplayHandle> shown() {
        return List.copyOf(shown);
    }

    public List<DisplayHandle> closed() {
        return List.copyOf(closed);
    }

    public List<String> refining() {
        return List.copyOf(refining);
    }

    /** Parent of the given display, or null if it was never linked. */
    public DisplayHandle parentOf(DisplayHandle child) {
        return links.stream().filter(l -> l[1].equals(child)).map(l -> l[0]).findFirst().orElse(null);
    }
}
