package com.phillippitts.presetgraph.service.execution;

import com.phillippitts.presetgraph.domain.Block;
import com.phillippitts.presetgraph.domain.BlockKind;
import com.phillippitts.presetgraph.domain.InitialContext;
import com.phillippitts.presetgraph.domain.Pipeline;
import com.phillippitts.presetgraph.exception.MissingContextException;
import com.phillippitts.presetgraph.exception.ProviderException;
import com.phillippitts.presetgraph.service.completion.CompletionProvider;
import com.phillippitts.presetgraph.service.completion.CompletionRequest;
import com.phillippitts.presetgraph.service.completion.ErrorClassifier;
import com.phillippitts.presetgraph.service.completion.ErrorMessageFormatter;
import com.phillippitts.presetgraph.service.dispatch.SideEffectDispatcher;
import com.phillippitts.presetgraph.service.dispatch.SideEffectRequest;
import com.phillippitts.presetgraph.service.events.NodeCompletedEvent;
import com.phillippitts.presetgraph.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.presetgraph.service.model.ModelDescriptor;
import com.phillippitts.presetgraph.service.model.ModelRegistry;
import com.phillippitts.presetgraph.service.model.ModelType;
import com.phillippitts.presetgraph.service.sink.DisplayHandle;
import com.phillippitts.presetgraph.service.sink.DisplayRequest;
import com.phillippitts.presetgraph.service.sink.ResultSink;
import com.phillippitts.presetgraph.service.template.TemplateResolver;
import com.phillippitts.presetgraph.util.LogSanitizer;
import com.phillippitts.presetgraph.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Walks a preset's block graph, one node at a time.
 *
 * <p>For each node: check cancellation, resolve model and prompt, open the node's display,
 * run the completion (or pass the input through for an adapter), fire side effects and
 * history, then continue. The first downstream node runs inline on the current thread and
 * inherits the pending display; every other downstream node becomes an independent branch
 * on the branch executor, sharing the run's cancellation token.
 *
 * <p><b>Error Handling:</b>
 * <ul>
 *   <li>Provider failures are retried on fallback models when retryable, then shown as
 *       the node's localized result. The branch ends there.</li>
 *   <li>An image block without a captured image aborts its branch without user-visible text.</li>
 *   <li>Cancellation is observed at node boundaries only; a completion in flight finishes
 *       and its result is dropped.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> stateless between calls; safe to share across runs.
 *
 * @since 1.0
 */
public class GraphExecutor {

    private static final Logger LOG = LogManager.getLogger(GraphExecutor.class);

    private static final String PROVIDER_NONE = "none";

    private final CompletionProvider completionProvider;
    private final ResultSink resultSink;
    private final SideEffectDispatcher sideEffects;
    private final ErrorMessageFormatter errorFormatter;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetricsPublisher metricsPublisher;
    private final Executor branchExecutor;
    private final NodeStartGate startGate;
    private final int maxRetries;
    private final long branchStaggerMs;

    /**
     * Prefer {@link GraphExecutorBuilder}.
     *
     * @throws NullPointerException if any collaborator is null
     */
    public GraphExecutor(CompletionProvider completionProvider,
                         ResultSink resultSink,
                         SideEffectDispatcher sideEffects,
                         ErrorMessageFormatter errorFormatter,
                         ApplicationEventPublisher publisher,
                         PipelineMetricsPublisher metricsPublisher,
                         Executor branchExecutor,
                         NodeStartGate startGate,
                         int maxRetries,
                         long branchStaggerMs) {
        this.completionProvider = Objects.requireNonNull(completionProvider, "completionProvider must not be null");
        this.resultSink = Objects.requireNonNull(resultSink, "resultSink must not be null");
        this.sideEffects = Objects.requireNonNull(sideEffects, "sideEffects must not be null");
        this.errorFormatter = Objects.requireNonNull(errorFormatter, "errorFormatter must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metricsPublisher = Objects.requireNonNull(metricsPublisher, "metricsPublisher must not be null");
        this.branchExecutor = Objects.requireNonNull(branchExecutor, "branchExecutor must not be null");
        this.startGate = Objects.requireNonNull(startGate, "startGate must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.branchStaggerMs = Math.max(0, branchStaggerMs);
    }

    /**
     * Runs node {@code nodeIndex} and, recursively, everything downstream of it.
     *
     * @param run           run id, cancellation token and run configuration
     * @param pipeline      cloned pipeline of the run
     * @param nodeIndex     node to run; an index past the last block ends the chain
     * @param inputText     output of the upstream node (or the captured text for the root)
     * @param context       captured payload visible to this node
     * @param parentDisplay display of the nearest visible upstream node, or null
     * @param pending       inherited "processing" display, owned by this call
     */
    public void runNode(RunContext run,
                        Pipeline pipeline,
                        int nodeIndex,
                        String inputText,
                        InitialContext context,
                        DisplayHandle parentDisplay,
                        PendingHandle pending) {
        Objects.requireNonNull(run, "run must not be null");
        Objects.requireNonNull(pipeline, "pipeline must not be null");
        Objects.requireNonNull(pending, "pending must not be null");

        if (run.isCancelled()) {
            LOG.debug("Run {} cancelled before block {}", run.runId(), nodeIndex);
            pending.closeWith(resultSink);
            return;
        }
        if (!pipeline.contains(nodeIndex)) {
            LOG.debug("Run {}: block {} is past the end of the chain", run.runId(), nodeIndex);
            pending.closeWith(resultSink);
            return;
        }

        Block block = pipeline.block(nodeIndex);
        String input = inputText == null ? "" : inputText;
        InitialContext ctx = context == null ? InitialContext.none() : context;
        long startTime = System.nanoTime();

        NodeRunState state = startNode(run, pipeline, block, ctx, parentDisplay, pending);
        NodeResult result;
        try {
            result = execute(run, pipeline, state, input, ctx, startTime);
        } catch (MissingContextException e) {
            LOG.error("Aborting branch of run {} at block {}: {}", run.runId(), e.getBlockId(), e.getMessage());
            state.closeDisplay(resultSink);
            pending.closeWith(resultSink);
            metricsPublisher.recordFailure(kindTag(block), providerOf(state.model()),
                    System.nanoTime() - startTime, "missing_context");
            publishCompleted(run, pipeline, block, NodeCompletedEvent.Outcome.MISSING_CONTEXT,
                    state.model() == null ? "" : state.model().id(), 0, startTime);
            return;
        }

        if (run.isCancelled()) {
            LOG.debug("Run {} cancelled while block {} was executing; result discarded", run.runId(), nodeIndex);
            state.closeIfNeverShown(resultSink);
            pending.closeWith(resultSink);
            publishCompleted(run, pipeline, block, NodeCompletedEvent.Outcome.CANCELLED,
                    result.modelId(), result.retries(), startTime);
            return;
        }

        if (!result.errored()) {
            SideEffectRequest effects = new SideEffectRequest(run.runId(), block, result.text(), ctx,
                    run.config().disableAutoPaste());
            sideEffects.dispatch(effects);
            sideEffects.saveHistory(effects, input);
        }
        publishCompleted(run, pipeline, block,
                result.errored() ? NodeCompletedEvent.Outcome.ERRORED : NodeCompletedEvent.Outcome.SUCCESS,
                result.modelId(), result.retries(), startTime);

        if (run.isCancelled()) {
            pending.closeWith(resultSink);
            return;
        }

        // Adapters always continue: image presets carry their data in the context, not the text
        if (!result.hasText() && !block.isInputAdapter()) {
            LOG.debug("Run {}: block {} produced no text, branch ends", run.runId(), nodeIndex);
            pending.closeWith(resultSink);
            return;
        }

        List<Integer> downstream = pipeline.downstreamOf(nodeIndex);
        if (downstream.isEmpty()) {
            pending.closeWith(resultSink);
            return;
        }

        InitialContext nextContext = block.isInputAdapter() ? ctx : InitialContext.none();
        DisplayHandle nextParent = state.hasDisplay() ? state.display() : parentDisplay;

        for (int ordinal = 1; ordinal < downstream.size(); ordinal++) {
            spawnBranch(run, pipeline, downstream.get(ordinal), ordinal, result.text(), nextContext, nextParent);
        }
        runNode(run, pipeline, downstream.get(0), result.text(), nextContext, nextParent, pending.transfer());
    }

    private NodeRunState startNode(RunContext run, Pipeline pipeline, Block block, InitialContext ctx,
                                   DisplayHandle parentDisplay, PendingHandle pending) {
        boolean entered = startGate.enter();
        if (!entered) {
            LOG.warn("Node start gate busy; starting block {} of run {} without a permit",
                    block.index(), run.runId());
        }
        try {
            ModelDescriptor model = block.isInputAdapter() ? null : run.config().modelRegistry().resolve(block.modelId());
            String prompt = TemplateResolver.resolve(block.promptTemplate(), block.languageVars(), block.selectedLanguage());

            DisplayHandle display = null;
            boolean deferred = false;
            if (block.showOverlay()) {
                deferred = block.kind() == BlockKind.IMAGE;
                display = resultSink.createDisplay(new DisplayRequest(
                        pipeline.presetId(),
                        run.runId(),
                        block.id(),
                        block.index(),
                        ctx,
                        model == null ? "" : model.id(),
                        model == null ? "" : model.provider(),
                        block.effectiveStreaming(),
                        prompt,
                        pipeline.visibleCountBefore(block.index()),
                        block.renderMode(),
                        deferred));
                if (parentDisplay != null) {
                    resultSink.link(parentDisplay, display);
                }
                if (!block.isInputAdapter()) {
                    resultSink.setRefining(display, true);
                }
                if (!deferred) {
                    pending.closeWith(resultSink);
                }
            }
            return new NodeRunState(block, model, prompt, display, deferred, pending);
        } finally {
            if (entered) {
                startGate.exit();
            }
        }
    }

    private NodeResult execute(RunContext run, Pipeline pipeline, NodeRunState state, String input,
                               InitialContext ctx, long startTime) {
        Block block = state.block();
        if (block.isInputAdapter()) {
            state.showText(input, resultSink, true);
            metricsPublisher.recordSuccess(kindTag(block), PROVIDER_NONE, System.nanoTime() - startTime);
            return NodeResult.success(input, null, 0);
        }
        if (block.kind() == BlockKind.IMAGE && !ctx.isImage()) {
            throw new MissingContextException(block.id(), block.index(),
                    "image block needs a captured image, run carries " + ctx.kind());
        }

        ModelRegistry registry = run.config().modelRegistry();
        ModelType type = block.kind() == BlockKind.IMAGE ? ModelType.VISION : ModelType.TEXT;
        ModelDescriptor current = state.model();
        CompletionRequest request = new CompletionRequest(
                run.config().apiKeys(),
                state.prompt(),
                current.fullName(),
                current.provider(),
                block.effectiveStreaming(),
                pipeline.isSingleImageBlock());
        List<String> failedModels = new ArrayList<>();
        int retries = 0;

        LOG.info("Run {}: block {} ({}) calling model={}, provider={}, streaming={}, prompt='{}'",
                run.runId(), block.index(), block.kind(), current.id(), current.provider(), request.streaming(),
                LogSanitizer.preview(state.prompt(), LogSanitizer.DEFAULT_PREVIEW));

        while (true) {
            try {
                String output = block.kind() == BlockKind.IMAGE
                        ? completionProvider.completeImage(request, ctx.bytes(), chunk -> state.applyChunk(chunk, resultSink))
                        : completionProvider.completeText(request, input, chunk -> state.applyChunk(chunk, resultSink));
                String text = output != null ? output : state.accumulator().current();
                state.showText(text, resultSink, true);
                long elapsed = System.nanoTime() - startTime;
                metricsPublisher.recordSuccess(kindTag(block), current.provider(), elapsed);
                LOG.info("Run {}: block {} done in {}ms ({} chars)", run.runId(), block.index(),
                        TimeUtils.nanosToMillis(elapsed), text.length());
                return NodeResult.success(text, current, retries);
            } catch (RuntimeException e) {
                if (!run.isCancelled() && retries < maxRetries && ErrorClassifier.isRetryable(e)) {
                    failedModels.add(current.id());
                    Optional<ModelDescriptor> next = registry.fallback(current.id(), failedModels, type);
                    if (next.isPresent()) {
                        retries++;
                        metricsPublisher.recordRetry(current.provider());
                        LOG.warn("Run {}: block {} model {} failed ({}); retrying with {}", run.runId(),
                                block.index(), current.id(), e.getMessage(), next.get().id());
                        current = next.get();
                        request = request.withModel(current.fullName(), current.provider());
                        state.accumulator().clear();
                        state.showText(errorFormatter.retrying(current.fullName(), run.config().uiLanguage()),
                                resultSink, false);
                        continue;
                    }
                }
                return failed(run, state, current, retries, e, startTime);
            }
        }
    }

    private NodeResult failed(RunContext run, NodeRunState state, ModelDescriptor model, int retries,
                              RuntimeException e, long startTime) {
        Block block = state.block();
        String reason;
        if (e instanceof ProviderException pe) {
            reason = "provider_error";
            LOG.warn("Run {}: block {} failed on model {} ({}): {}", run.runId(), block.index(), model.id(),
                    pe.getKind(), pe.getMessage());
        } else {
            reason = "unexpected_error";
            LOG.error("Run {}: unexpected error in block {} on model {}", run.runId(), block.index(), model.id(), e);
        }
        metricsPublisher.recordFailure(kindTag(block), model.provider(), System.nanoTime() - startTime, reason);
        if (!run.isCancelled()) {
            String message = errorFormatter.format(e, model.fullName(), run.config().uiLanguage());
            state.showText(message, resultSink, true);
        }
        return NodeResult.failed(model, retries);
    }

    private void spawnBranch(RunContext run, Pipeline pipeline, int target, int ordinal, String inputText,
                             InitialContext context, DisplayHandle parentDisplay) {
        long delayMs = branchStaggerMs * ordinal;
        LOG.debug("Run {}: spawning branch {} to block {}", run.runId(), ordinal, target);
        run.walks().branchStarted();
        try {
            branchExecutor.execute(() -> {
                try {
                    if (!TimeUtils.sleepQuietly(delayMs)) {
                        LOG.debug("Run {}: branch to block {} interrupted before start", run.runId(), target);
                        return;
                    }
                    runNode(run, pipeline, target, inputText, context, parentDisplay, PendingHandle.empty());
                } catch (RuntimeException e) {
                    LOG.error("Run {}: branch to block {} failed", run.runId(), target, e);
                } finally {
                    run.walks().walkFinished();
                }
            });
        } catch (RuntimeException e) {
            run.walks().walkFinished();
            throw e;
        }
    }

    private void publishCompleted(RunContext run, Pipeline pipeline, Block block, NodeCompletedEvent.Outcome outcome,
                                  String modelId, int retries, long startTime) {
        publisher.publishEvent(new NodeCompletedEvent(run.runId(), pipeline.presetId(), block.id(), block.index(),
                outcome, modelId, retries, TimeUtils.elapsedMillis(startTime), Instant.now()));
    }

    private static String kindTag(Block block) {
        return block.kind().name().toLowerCase(Locale.ROOT);
    }

    private static String providerOf(ModelDescriptor model) {
        return model == null ? PROVIDER_NONE : model.provider();
    }
}
