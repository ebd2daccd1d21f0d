package com.phillippitts.presetgraph.service.sink;

import com.phillippitts.presetgraph.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Log-only speech, history and notification sinks used until the application supplies
 * real integrations. No result text reaches INFO logs.
 */
public final class LoggingSinks {

    private static final Logger LOG = LogManager.getLogger(LoggingSinks.class);

    private LoggingSinks() {}

    public static SpeechSink speech() {
        return text -> LOG.info("Speech requested ({} chars)", text.length());
    }

    public static HistorySink history() {
        return new HistorySink() {
            @Override
            public void saveText(String result, String inputText) {
                LOG.info("History: text entry ({} chars result, {} chars input)",
                        result.length(), inputText == null ? 0 : inputText.length());
            }

            @Override
            public void saveImage(byte[] imageBytes, String result) {
                LOG.info("History: image entry ({} bytes, {} chars result)", imageBytes.length, result.length());
            }
        };
    }

    public static NotificationSink notifications() {
        return (badge, preview) -> LOG.debug("Badge {}: {}", badge,
                LogSanitizer.preview(preview, LogSanitizer.DEFAULT_PREVIEW));
    }
}
