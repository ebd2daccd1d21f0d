package com.phillippitts.presetgraph.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only block graph of one preset.
 *
 * <p>If {@code connections} is empty the pipeline is a legacy linear chain where block
 * {@code i} flows only into {@code i + 1}. As soon as any edge is defined, flow follows the
 * explicit edges exclusively.
 *
 * @param blocks      blocks ordered by index
 * @param connections directed edges between block indices
 * @param presetId    owning preset identifier
 */
public record Pipeline(List<Block> blocks, List<Edge> connections, String presetId) {

    public Pipeline {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        connections = connections == null ? List.of() : List.copyOf(connections);
        presetId = presetId == null ? "" : presetId;
    }

    public int size() {
        return blocks.size();
    }

    public boolean contains(int index) {
        return index >= 0 && index < blocks.size();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not a block of this pipeline
     */
    public Block block(int index) {
        return blocks.get(index);
    }

    public boolean isLegacyLinear() {
        return connections.isEmpty();
    }

    /**
     * Returns the downstream block indices of {@code index} in edge declaration order.
     * Indices are not range-checked; a target past the last block is an end of chain.
     */
    public List<Integer> downstreamOf(int index) {
        if (connections.isEmpty()) {
            return index + 1 < blocks.size() ? List.of(index + 1) : List.of();
        }
        List<Integer> targets = new ArrayList<>();
        for (Edge edge : connections) {
            if (edge.from() == index) {
                targets.add(edge.to());
            }
        }
        return List.copyOf(targets);
    }

    /** Number of visible blocks strictly before {@code index}; used as the display colour hint. */
    public int visibleCountBefore(int index) {
        int count = 0;
        for (int i = 0; i < Math.min(index, blocks.size()); i++) {
            if (blocks.get(i).showOverlay()) {
                count++;
            }
        }
        return count;
    }

    /** True for the single-image-block preset, the only case that requests JSON output. */
    public boolean isSingleImageBlock() {
        return blocks.size() == 1 && blocks.get(0).kind() == BlockKind.IMAGE;
    }

    public static Builder builder(String presetId) {
        return new Builder(presetId);
    }

    /**
     * Assigns block indices in insertion order.
     */
    public static final class Builder {
        private final String presetId;
        private final List<Block> blocks = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();

        private Builder(String presetId) {
            this.presetId = Objects.requireNonNull(presetId, "presetId");
        }

        public Builder block(Block.Builder block) {
            blocks.add(block.index(blocks.size()).build());
            return this;
        }

        public Builder connect(int from, int to) {
            edges.add(new Edge(from, to));
            return this;
        }

        public Pipeline build() {
            return new Pipeline(blocks, edges, presetId);
        }
    }
}
