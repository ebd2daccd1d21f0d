package com.phillippitts.presetgraph.service.events;

import java.time.Instant;

/** Published when a clipboard, paste, speech, history or notification sink call fails. */
public record SideEffectFailedEvent(String runId, String blockId, String action, String reason, Instant at) { }
