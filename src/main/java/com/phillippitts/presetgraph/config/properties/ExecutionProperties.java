package com.phillippitts.presetgraph.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for graph execution.
 *
 * <p>Properties:
 * <ul>
 *   <li>presetgraph.execution.max-retries - fallback retries per node (default: 2)</li>
 *   <li>presetgraph.execution.branch-stagger-ms - start delay per branch ordinal (default: 0)</li>
 *   <li>presetgraph.execution.max-concurrent-node-starts - node start gate size (default: 4)</li>
 *   <li>presetgraph.execution.node-start-timeout-ms - gate wait before starting anyway (default: 2000)</li>
 *   <li>presetgraph.execution.paste-settle-delay-ms - wait between copy and paste (default: 100)</li>
 *   <li>presetgraph.execution.speak-delay-ms - wait before speaking a result (default: 200)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "presetgraph.execution")
public class ExecutionProperties {

    @Min(0)
    private final int maxRetries;

    @Min(0)
    private final long branchStaggerMs;

    @Positive
    private final int maxConcurrentNodeStarts;

    @Min(0)
    private final long nodeStartTimeoutMs;

    @Min(0)
    private final long pasteSettleDelayMs;

    @Min(0)
    private final long speakDelayMs;

    @ConstructorBinding
    public ExecutionProperties(Integer maxRetries,
                               Long branchStaggerMs,
                               Integer maxConcurrentNodeStarts,
                               Long nodeStartTimeoutMs,
                               Long pasteSettleDelayMs,
                               Long speakDelayMs) {
        this.maxRetries = maxRetries == null ? 2 : maxRetries;
        this.branchStaggerMs = branchStaggerMs == null ? 0L : branchStaggerMs;
        this.maxConcurrentNodeStarts = maxConcurrentNodeStarts == null ? 4 : maxConcurrentNodeStarts;
        this.nodeStartTimeoutMs = nodeStartTimeoutMs == null ? 2000L : nodeStartTimeoutMs;
        this.pasteSettleDelayMs = pasteSettleDelayMs == null ? 100L : pasteSettleDelayMs;
        this.speakDelayMs = speakDelayMs == null ? 200L : speakDelayMs;
    }

    /**
     * Defaults for tests.
     */
    public static ExecutionProperties defaults() {
        return new ExecutionProperties(null, null, null, null, null, null);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBranchStaggerMs() {
        return branchStaggerMs;
    }

    public int getMaxConcurrentNodeStarts() {
        return maxConcurrentNodeStarts;
    }

    public long getNodeStartTimeoutMs() {
        return nodeStartTimeoutMs;
    }

    public long getPasteSettleDelayMs() {
        return pasteSettleDelayMs;
    }

    public long getSpeakDelayMs() {
        return speakDelayMs;
    }
}
