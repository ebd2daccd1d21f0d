package com.phillippitts.presetgraph.config;

import com.phillippitts.presetgraph.config.properties.ExecutionProperties;
import com.phillippitts.presetgraph.config.properties.ProviderProperties;
import com.phillippitts.presetgraph.service.completion.ApiKeys;
import com.phillippitts.presetgraph.service.completion.CompletionProvider;
import com.phillippitts.presetgraph.service.completion.ErrorMessageFormatter;
import com.phillippitts.presetgraph.service.dispatch.SideEffectDispatcher;
import com.phillippitts.presetgraph.service.execution.GraphExecutor;
import com.phillippitts.presetgraph.service.execution.GraphExecutorBuilder;
import com.phillippitts.presetgraph.service.execution.NodeStartGate;
import com.phillippitts.presetgraph.service.execution.RunConfig;
import com.phillippitts.presetgraph.service.metrics.PipelineMetrics;
import com.phillippitts.presetgraph.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.presetgraph.service.model.InMemoryModelRegistry;
import com.phillippitts.presetgraph.service.model.ModelDescriptor;
import com.phillippitts.presetgraph.service.model.ModelRegistry;
import com.phillippitts.presetgraph.service.runner.PipelineRunRegistry;
import com.phillippitts.presetgraph.service.runner.PipelineRunner;
import com.phillippitts.presetgraph.service.runner.PipelineValidator;
import com.phillippitts.presetgraph.service.sink.ClipboardSink;
import com.phillippitts.presetgraph.service.sink.EditingSurface;
import com.phillippitts.presetgraph.service.sink.HistorySink;
import com.phillippitts.presetgraph.service.sink.NotificationSink;
import com.phillippitts.presetgraph.service.sink.PasteSink;
import com.phillippitts.presetgraph.service.sink.RefineSurface;
import com.phillippitts.presetgraph.service.sink.ResultSink;
import com.phillippitts.presetgraph.service.sink.SpeechSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the graph executor, its dispatcher and the pipeline runner from properties.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger LOG = LogManager.getLogger(ExecutionConfig.class);

    @Bean
    public ModelRegistry modelRegistry(ProviderProperties props) {
        List<ModelDescriptor> models = props.getModels().stream()
                .map(m -> new ModelDescriptor(m.getId(), m.getProvider(), m.getFullName(), m.getType(), m.isEnabled()))
                .toList();
        LOG.info("Model registry: {} model(s), default provider={}", models.size(), props.getDefaultProvider());
        return new InMemoryModelRegistry(models, props.getDefaultProvider());
    }

    @Bean
    public ErrorMessageFormatter errorMessageFormatter() {
        return new ErrorMessageFormatter(ErrorMessageFormatter.defaultMessages());
    }

    @Bean
    public PipelineMetricsPublisher pipelineMetricsPublisher(ObjectProvider<PipelineMetrics> metrics) {
        return new PipelineMetricsPublisher(metrics.getIfAvailable());
    }

    @Bean
    public SideEffectDispatcher sideEffectDispatcher(@Qualifier("sideEffectExecutor") Executor sideEffectExecutor,
                                                     ClipboardSink clipboardSink,
                                                     PasteSink pasteSink,
                                                     EditingSurface editingSurface,
                                                     RefineSurface refineSurface,
                                                     SpeechSink speechSink,
                                                     NotificationSink notificationSink,
                                                     HistorySink historySink,
                                                     ApplicationEventPublisher publisher,
                                                     ExecutionProperties props) {
        return new SideEffectDispatcher(sideEffectExecutor, clipboardSink, pasteSink, editingSurface, refineSurface,
                speechSink, notificationSink, historySink, publisher,
                props.getPasteSettleDelayMs(), props.getSpeakDelayMs());
    }

    @Bean
    public GraphExecutor graphExecutor(CompletionProvider completionProvider,
                                       ResultSink resultSink,
                                       SideEffectDispatcher sideEffectDispatcher,
                                       ErrorMessageFormatter errorMessageFormatter,
                                       ApplicationEventPublisher publisher,
                                       PipelineMetricsPublisher pipelineMetricsPublisher,
                                       @Qualifier("branchExecutor") Executor branchExecutor,
                                       ExecutionProperties props) {
        return GraphExecutorBuilder.builder()
                .completionProvider(completionProvider)
                .resultSink(resultSink)
                .sideEffects(sideEffectDispatcher)
                .errorFormatter(errorMessageFormatter)
                .publisher(publisher)
                .metrics(pipelineMetricsPublisher)
                .branchExecutor(branchExecutor)
                .startGate(new NodeStartGate(props.getMaxConcurrentNodeStarts(), props.getNodeStartTimeoutMs()))
                .maxRetries(props.getMaxRetries())
                .branchStaggerMs(props.getBranchStaggerMs())
                .build();
    }

    @Bean
    public PipelineValidator pipelineValidator() {
        return new PipelineValidator();
    }

    @Bean
    public PipelineRunner pipelineRunner(GraphExecutor graphExecutor,
                                         PipelineValidator pipelineValidator,
                                         PipelineRunRegistry pipelineRunRegistry,
                                         @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                                         ProviderProperties providerProperties,
                                         ModelRegistry modelRegistry,
                                         ApplicationEventPublisher publisher) {
        return new PipelineRunner(graphExecutor, pipelineValidator, pipelineRunRegistry, pipelineExecutor,
                () -> new RunConfig(new ApiKeys(providerProperties.getApiKeys()), providerProperties.getUiLanguage(),
                        modelRegistry, false),
                publisher);
    }
}
