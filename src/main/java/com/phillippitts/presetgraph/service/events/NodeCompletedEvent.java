package com.phillippitts.presetgraph.service.events;

import java.time.Instant;

/**
 * Published once per node invocation that got past its start checks.
 *
 * @param runId      run identifier
 * @param presetId   preset identifier
 * @param blockId    stable block id
 * @param blockIndex block index in the pipeline
 * @param outcome    how the node ended
 * @param modelId    model that produced the result (last tried model on failure); empty for adapters
 * @param retries    number of fallback retries performed
 * @param durationMs node execution time
 * @param at         completion time
 */
public record NodeCompletedEvent(
        String runId,
        String presetId,
        String blockId,
        int blockIndex,
        Outcome outcome,
        String modelId,
        int retries,
        long durationMs,
        Instant at
) {

    public enum Outcome { SUCCESS, ERRORED, CANCELLED, MISSING_CONTEXT }
}
