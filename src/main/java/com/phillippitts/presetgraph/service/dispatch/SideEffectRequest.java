package com.phillippitts.presetgraph.service.dispatch;

import com.phillippitts.presetgraph.domain.Block;
import com.phillippitts.presetgraph.domain.InitialContext;

import java.util.Objects;

/**
 * Input of one side-effect dispatch.
 *
 * @param runId            run identifier, for failure events
 * @param block            block whose flags drive the side effects
 * @param resultText       final node text (input text for adapters)
 * @param context          payload the node ran with
 * @param disableAutoPaste run-level switch that suppresses every paste
 */
public record SideEffectRequest(
        String runId,
        Block block,
        String resultText,
        InitialContext context,
        boolean disableAutoPaste
) {

    public SideEffectRequest {
        Objects.requireNonNull(block, "block must not be null");
        resultText = resultText == null ? "" : resultText;
        context = context == null ? InitialContext.none() : context;
    }

    public boolean hasText() {
        return !resultText.trim().isEmpty();
    }
}
