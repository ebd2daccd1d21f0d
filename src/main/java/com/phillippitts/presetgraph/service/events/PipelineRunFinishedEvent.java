package com.phillippitts.presetgraph.service.events;

import java.time.Instant;

/**
 * Published when the root walk of a run returns. Parallel branches may still be running.
 */
public record PipelineRunFinishedEvent(String runId, String presetId, boolean cancelled, long durationMs, Instant at) { }
