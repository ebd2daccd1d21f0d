package com.phillippitts.presetgraph.service.sink;

import com.phillippitts.presetgraph.domain.InitialContext;
import com.phillippitts.presetgraph.domain.RenderMode;

/**
 * Everything a {@link ResultSink} needs to open a display for one node.
 *
 * @param presetId   preset the run belongs to (display anchor)
 * @param runId      run (chain) identifier
 * @param blockId    stable block id
 * @param blockIndex block index in the pipeline
 * @param context    captured payload of the run as seen by this node
 * @param modelId    model shown in the display header
 * @param providerId provider of the model
 * @param streaming  whether text will arrive incrementally
 * @param prompt     resolved prompt
 * @param colorHint  number of visible blocks before this one
 * @param renderMode how the text should be rendered
 * @param hidden     true if the display must stay hidden until {@link ResultSink#showDisplay} is called
 */
public record DisplayRequest(
        String presetId,
        String runId,
        String blockId,
        int blockIndex,
        InitialContext context,
        String modelId,
        String providerId,
        boolean streaming,
        String prompt,
        int colorHint,
        RenderMode renderMode,
        boolean hidden
) { }
