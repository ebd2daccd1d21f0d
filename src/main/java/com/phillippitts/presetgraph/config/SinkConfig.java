package com.phillippitts.presetgraph.config;

import com.phillippitts.presetgraph.service.completion.CompletionProvider;
import com.phillippitts.presetgraph.service.completion.UnconfiguredCompletionProvider;
import com.phillippitts.presetgraph.service.sink.ClipboardSink;
import com.phillippitts.presetgraph.service.sink.EditingSurface;
import com.phillippitts.presetgraph.service.sink.HistorySink;
import com.phillippitts.presetgraph.service.sink.LoggingResultSink;
import com.phillippitts.presetgraph.service.sink.LoggingSinks;
import com.phillippitts.presetgraph.service.sink.NotificationSink;
import com.phillippitts.presetgraph.service.sink.PasteSink;
import com.phillippitts.presetgraph.service.sink.RefineSurface;
import com.phillippitts.presetgraph.service.sink.ResultSink;
import com.phillippitts.presetgraph.service.sink.SpeechSink;
import com.phillippitts.presetgraph.service.sink.awt.AwtClipboardSink;
import com.phillippitts.presetgraph.service.sink.awt.RobotPasteSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default collaborators of the engine. Each is replaced by declaring a bean of the same type.
 */
@Configuration
public class SinkConfig {

    @Bean
    @ConditionalOnMissingBean
    public CompletionProvider completionProvider() {
        return new UnconfiguredCompletionProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultSink resultSink() {
        return new LoggingResultSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClipboardSink clipboardSink() {
        return new AwtClipboardSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public PasteSink pasteSink() {
        return new RobotPasteSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public EditingSurface editingSurface() {
        return EditingSurface.INACTIVE;
    }

    @Bean
    @ConditionalOnMissingBean
    public RefineSurface refineSurface() {
        return RefineSurface.INACTIVE;
    }

    @Bean
    @ConditionalOnMissingBean
    public SpeechSink speechSink() {
        return LoggingSinks.speech();
    }

    @Bean
    @ConditionalOnMissingBean
    public HistorySink historySink() {
        return LoggingSinks.history();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSink notificationSink() {
        return LoggingSinks.notifications();
    }
}
