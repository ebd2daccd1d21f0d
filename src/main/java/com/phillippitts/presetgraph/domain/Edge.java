package com.phillippitts.presetgraph.domain;

/**
 * Directed connection between two blocks of a preset, identified by block index.
 *
 * @param from index of the upstream block
 * @param to   index of the downstream block
 */
public record Edge(int from, int to) {

    public static Edge of(int from, int to) {
        return new Edge(from, to);
    }
}
