package com.phillippitts.presetgraph.service.sink;

import com.phillippitts.presetgraph.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ResultSink} for headless use: records display lifecycles in the log.
 * Text is logged as a short preview at DEBUG only.
 */
public class LoggingResultSink implements ResultSink {

    private static final Logger LOG = LogManager.getLogger(LoggingResultSink.class);

    private final Map<DisplayHandle, DisplayRequest> open = new ConcurrentHashMap<>();

    @Override
    public DisplayHandle createDisplay(DisplayRequest request) {
        DisplayHandle handle = DisplayHandle.create();
        open.put(handle, request);
        LOG.info("Display opened: handle={}, block={}, model={}, provider={}, colorHint={}, hidden={}",
                handle.id(), request.blockIndex(), request.modelId(), request.providerId(),
                request.colorHint(), request.hidden());
        return handle;
    }

    @Override
    public void updateDisplay(DisplayHandle handle, String text) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Display {} text ({} chars): {}", handle.id(),
                    text == null ? 0 : text.length(), LogSanitizer.preview(text, LogSanitizer.DEFAULT_PREVIEW));
        }
    }

    @Override
    public void showDisplay(DisplayHandle handle) {
        LOG.debug("Display {} shown", handle.id());
    }

    @Override
    public void setRefining(DisplayHandle handle, boolean refining) {
        LOG.debug("Display {} refining={}", handle.id(), refining);
    }

    @Override
    public void closeDisplay(DisplayHandle handle) {
        if (open.remove(handle) != null) {
            LOG.info("Display closed: handle={}", handle.id());
        }
    }

    @Override
    public void link(DisplayHandle parent, DisplayHandle child) {
        LOG.debug("Display {} linked under {}", child.id(), parent.id());
    }
}
