package com.phillippitts.presetgraph.service.runner;

import com.phillippitts.presetgraph.domain.InitialContext;
import com.phillippitts.presetgraph.domain.Pipeline;
import com.phillippitts.presetgraph.service.events.PipelineRunFinishedEvent;
import com.phillippitts.presetgraph.service.execution.CancellationToken;
import com.phillippitts.presetgraph.service.execution.GraphExecutor;
import com.phillippitts.presetgraph.service.execution.PendingHandle;
import com.phillippitts.presetgraph.service.execution.RunConfig;
import com.phillippitts.presetgraph.service.execution.RunContext;
import com.phillippitts.presetgraph.service.execution.WalkTracker;
import com.phillippitts.presetgraph.service.sink.DisplayHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point for running a preset.
 *
 * <p>A run validates the pipeline, captures a {@link RunConfig}, creates the run's
 * cancellation token and registers itself in the {@link PipelineRunRegistry}. The root walk
 * starts at block 0. {@link #start} runs it on the pipeline executor, {@link #run} on the
 * calling thread. The run stays registered, and cancellable, until the root walk and every
 * branch spawned from it have returned; only then is its {@link RunHandle} completed.
 *
 * <p>Log4j2 ThreadContext carries {@code runId} and {@code presetId} for the whole walk.
 */
public class PipelineRunner {

    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);

    static final String MDC_RUN_ID = "runId";
    static final String MDC_PRESET_ID = "presetId";

    private final GraphExecutor graphExecutor;
    private final PipelineValidator validator;
    private final PipelineRunRegistry registry;
    private final Executor pipelineExecutor;
    private final Supplier<RunConfig> runConfigSupplier;
    private final ApplicationEventPublisher publisher;

    public PipelineRunner(GraphExecutor graphExecutor,
                          PipelineValidator validator,
                          PipelineRunRegistry registry,
                          Executor pipelineExecutor,
                          Supplier<RunConfig> runConfigSupplier,
                          ApplicationEventPublisher publisher) {
        this.graphExecutor = Objects.requireNonNull(graphExecutor, "graphExecutor must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.pipelineExecutor = Objects.requireNonNull(pipelineExecutor, "pipelineExecutor must not be null");
        this.runConfigSupplier = Objects.requireNonNull(runConfigSupplier, "runConfigSupplier must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * Starts a run on the pipeline executor.
     *
     * @param pipeline         preset graph to run
     * @param inputText        captured text (empty for image presets)
     * @param context          captured payload
     * @param processingHandle "processing" display to close once the first result display
     *                         exists, or null
     * @return handle for cancellation and completion
     * @throws com.phillippitts.presetgraph.exception.InvalidPipelineException if validation fails
     */
    public RunHandle start(Pipeline pipeline, String inputText, InitialContext context, DisplayHandle processingHandle) {
        return start(pipeline, inputText, context, processingHandle, false);
    }

    /**
     * @param disableAutoPaste suppress every paste of this run (continuous input callers)
     */
    public RunHandle start(Pipeline pipeline, String inputText, InitialContext context,
                           DisplayHandle processingHandle, boolean disableAutoPaste) {
        Prepared prepared = prepare(pipeline, disableAutoPaste);
        pipelineExecutor.execute(() -> walk(prepared, inputText, context, processingHandle));
        return prepared.handle();
    }

    /**
     * Runs the root walk on the calling thread. Branches may still be running when this
     * returns; wait on {@link RunHandle#completion()} for the whole run.
     */
    public RunHandle run(Pipeline pipeline, String inputText, InitialContext context, DisplayHandle processingHandle) {
        Prepared prepared = prepare(pipeline, false);
        walk(prepared, inputText, context, processingHandle);
        return prepared.handle();
    }

    private Prepared prepare(Pipeline pipeline, boolean disableAutoPaste) {
        validator.validate(pipeline);
        // Pipeline is immutable; this snapshot is what every node of the run sees
        Pipeline snapshot = new Pipeline(pipeline.blocks(), pipeline.connections(), pipeline.presetId());
        RunConfig config = runConfigSupplier.get();
        if (disableAutoPaste) {
            config = config.withDisableAutoPaste(true);
        }
        CancellationToken token = new CancellationToken();
        RunHandle handle = new RunHandle(UUID.randomUUID().toString(), snapshot.presetId(), token);
        WalkTracker walks = new WalkTracker(() -> finish(handle));
        registry.register(handle);
        LOG.info("Run {} registered: preset={}, blocks={}, edges={}", handle.runId(), snapshot.presetId(),
                snapshot.size(), snapshot.connections().size());
        return new Prepared(snapshot, handle, new RunContext(handle.runId(), token, config, walks));
    }

    private void walk(Prepared prepared, String inputText, InitialContext context, DisplayHandle processingHandle) {
        RunHandle handle = prepared.handle();
        ThreadContext.put(MDC_RUN_ID, handle.runId());
        ThreadContext.put(MDC_PRESET_ID, handle.presetId());
        try {
            PendingHandle pending = processingHandle == null ? PendingHandle.empty() : PendingHandle.of(processingHandle);
            graphExecutor.runNode(prepared.context(), prepared.pipeline(), 0, inputText,
                    context == null ? InitialContext.none() : context, null, pending);
        } catch (RuntimeException e) {
            LOG.error("Run {} failed", handle.runId(), e);
        } finally {
            prepared.context().walks().walkFinished();
            ThreadContext.remove(MDC_RUN_ID);
            ThreadContext.remove(MDC_PRESET_ID);
        }
    }

    /** Runs on whichever thread returns last: the root walk or a branch. */
    private void finish(RunHandle handle) {
        registry.deregister(handle.runId());
        handle.markDone();
        Instant finishedAt = Instant.now();
        publisher.publishEvent(new PipelineRunFinishedEvent(handle.runId(), handle.presetId(),
                handle.isCancelled(), Duration.between(handle.startedAt(), finishedAt).toMillis(), finishedAt));
    }

    private record Prepared(Pipeline pipeline, RunHandle handle, RunContext context) { }
}
