package com.phillippitts.presetgraph.service.runner;

import com.phillippitts.presetgraph.domain.Block;
import com.phillippitts.presetgraph.domain.Edge;
import com.phillippitts.presetgraph.domain.Pipeline;
import com.phillippitts.presetgraph.exception.InvalidPipelineException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks run before a pipeline is executed.
 *
 * <p>Rejects: no blocks, a block whose index differs from its position, duplicate block
 * ids, negative edge endpoints, self-loops and cycles. Edges that point past the last block
 * are accepted; the executor treats them as the end of the chain.
 */
public class PipelineValidator {

    /**
     * @throws InvalidPipelineException describing the first violation found
     */
    public void validate(Pipeline pipeline) {
        if (pipeline == null) {
            throw new InvalidPipelineException("", "pipeline is null");
        }
        String presetId = pipeline.presetId();
        List<Block> blocks = pipeline.blocks();
        if (blocks.isEmpty()) {
            throw new InvalidPipelineException(presetId, "no blocks");
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (block.index() != i) {
                throw new InvalidPipelineException(presetId,
                        "block at position " + i + " has index " + block.index());
            }
            if (!ids.add(block.id())) {
                throw new InvalidPipelineException(presetId, "duplicate block id " + block.id());
            }
        }

        for (Edge edge : pipeline.connections()) {
            if (edge.from() < 0 || edge.to() < 0) {
                throw new InvalidPipelineException(presetId, "negative edge endpoint " + edge);
            }
            if (edge.from() == edge.to()) {
                throw new InvalidPipelineException(presetId, "self-loop on block " + edge.from());
            }
        }

        List<Integer> cycle = findCycle(pipeline);
        if (!cycle.isEmpty()) {
            throw new InvalidPipelineException(presetId, "cycle " + cycle);
        }
    }

    /** Returns the nodes of one cycle in walk order, or an empty list if the graph is acyclic. */
    List<Integer> findCycle(Pipeline pipeline) {
        if (pipeline.isLegacyLinear()) {
            return List.of();
        }
        int n = pipeline.size();
        // 0 = unvisited, 1 = on stack, 2 = done
        int[] state = new int[n];
        List<Integer> path = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (state[start] == 0) {
                List<Integer> cycle = visit(pipeline, start, state, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private List<Integer> visit(Pipeline pipeline, int node, int[] state, List<Integer> path) {
        state[node] = 1;
        path.add(node);
        for (int next : pipeline.downstreamOf(node)) {
            if (!pipeline.contains(next)) {
                continue;
            }
            if (state[next] == 1) {
                List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (state[next] == 0) {
                List<Integer> cycle = visit(pipeline, next, state, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        state[node] = 2;
        return List.of();
    }
}
