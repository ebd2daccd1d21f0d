package com.phillippitts.presetgraph.service.execution;

import com.phillippitts.presetgraph.service.completion.CompletionProvider;
import com.phillippitts.presetgraph.service.completion.ErrorMessageFormatter;
import com.phillippitts.presetgraph.service.dispatch.SideEffectDispatcher;
import com.phillippitts.presetgraph.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.presetgraph.service.sink.ResultSink;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link GraphExecutor}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * GraphExecutor executor = GraphExecutorBuilder.builder()
 *     .completionProvider(provider)
 *     .resultSink(resultSink)
 *     .sideEffects(dispatcher)
 *     .errorFormatter(formatter)
 *     .publisher(publisher)
 *     .branchExecutor(branchPool)        // optional, defaults to the calling thread
 *     .startGate(new NodeStartGate(4, 2000))  // optional, defaults to unbounded
 *     .metrics(metricsPublisher)         // optional, defaults to NOOP
 *     .maxRetries(2)
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class GraphExecutorBuilder {

    // Required dependencies
    private CompletionProvider completionProvider;
    private ResultSink resultSink;
    private SideEffectDispatcher sideEffects;
    private ErrorMessageFormatter errorFormatter;
    private ApplicationEventPublisher publisher;

    // Optional dependencies
    private PipelineMetricsPublisher metricsPublisher = PipelineMetricsPublisher.NOOP;
    private Executor branchExecutor = Runnable::run;
    private NodeStartGate startGate = NodeStartGate.UNBOUNDED;
    private int maxRetries = 2;
    private long branchStaggerMs;

    private GraphExecutorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static GraphExecutorBuilder builder() {
        return new GraphExecutorBuilder();
    }

    public GraphExecutorBuilder completionProvider(CompletionProvider completionProvider) {
        this.completionProvider = completionProvider;
        return this;
    }

    public GraphExecutorBuilder resultSink(ResultSink resultSink) {
        this.resultSink = resultSink;
        return this;
    }

    public GraphExecutorBuilder sideEffects(SideEffectDispatcher sideEffects) {
        this.sideEffects = sideEffects;
        return this;
    }

    public GraphExecutorBuilder errorFormatter(ErrorMessageFormatter errorFormatter) {
        this.errorFormatter = errorFormatter;
        return this;
    }

    public GraphExecutorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @param metricsPublisher metrics publisher (optional, NOOP if not set)
     */
    public GraphExecutorBuilder metrics(PipelineMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    /**
     * @param branchExecutor executor for parallel branches (optional, runs on the calling thread if not set)
     */
    public GraphExecutorBuilder branchExecutor(Executor branchExecutor) {
        this.branchExecutor = branchExecutor;
        return this;
    }

    public GraphExecutorBuilder startGate(NodeStartGate startGate) {
        this.startGate = startGate;
        return this;
    }

    public GraphExecutorBuilder maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    /**
     * @param branchStaggerMs extra start delay per branch ordinal, 0 to disable
     */
    public GraphExecutorBuilder branchStaggerMs(long branchStaggerMs) {
        this.branchStaggerMs = branchStaggerMs;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public GraphExecutor build() {
        Objects.requireNonNull(completionProvider, "completionProvider is required");
        Objects.requireNonNull(resultSink, "resultSink is required");
        Objects.requireNonNull(sideEffects, "sideEffects is required");
        Objects.requireNonNull(errorFormatter, "errorFormatter is required");
        Objects.requireNonNull(publisher, "publisher is required");
        return new GraphExecutor(completionProvider, resultSink, sideEffects, errorFormatter, publisher,
                metricsPublisher == null ? PipelineMetricsPublisher.NOOP : metricsPublisher,
                branchExecutor == null ? Runnable::run : branchExecutor,
                startGate == null ? NodeStartGate.UNBOUNDED : startGate,
                maxRetries, branchStaggerMs);
    }
}
