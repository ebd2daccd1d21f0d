/**
 * Immutable preset model: blocks, edges, pipelines and the captured payload of a run.
 *
 * <p>A {@link com.phillippitts.presetgraph.domain.Pipeline} is cloned when a run starts and never
 * mutated afterwards, so the same instance can be shared by every branch of that run.
 *
 * @since 1.0
 */
package com.phillippitts.presetgraph.domain;
