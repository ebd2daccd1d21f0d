package com.phillippitts.presetgraph.config;

import com.phillippitts.presetgraph.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for pipeline runs, parallel branches and side effects.
 *
 * <p>All pools are bounded and use {@link ThreadPoolExecutor.CallerRunsPolicy}: when a pool
 * and its queue are full the submitting thread runs the task, which slows the producer
 * instead of dropping work. Sizes come from {@link ThreadPoolProperties}.
 *
 * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread (runId, presetId)
 * is copied onto the worker for the duration of the task.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs root walks started with {@code PipelineRunner.start}.
     */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor() {
        return newExecutor(threadPoolProperties.getPipeline());
    }

    /**
     * Runs fan-out branches. The first successor of a node never uses this pool.
     */
    @Bean(name = "branchExecutor")
    public Executor branchExecutor() {
        return newExecutor(threadPoolProperties.getBranch());
    }

    /**
     * Runs clipboard, paste, speech and history actions so they never block the walk.
     */
    @Bean(name = "sideEffectExecutor")
    public Executor sideEffectExecutor() {
        return newExecutor(threadPoolProperties.getSideEffect());
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    // Package-private for tests
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
