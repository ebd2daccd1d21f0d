package com.phillippitts.presetgraph.service.execution;

import com.phillippitts.presetgraph.service.model.ModelDescriptor;

/**
 * Outcome of executing one node.
 *
 * @param text    result text; empty after a provider error
 * @param errored whether the completion failed
 * @param model   model that produced the result or failed last; null for adapters
 * @param retries fallback retries performed
 */
record NodeResult(String text, boolean errored, ModelDescriptor model, int retries) {

    static NodeResult success(String text, ModelDescriptor model, int retries) {
        return new NodeResult(text == null ? "" : text, false, model, retries);
    }

    static NodeResult failed(ModelDescriptor model, int retries) {
        return new NodeResult("", true, model, retries);
    }

    boolean hasText() {
        return !text.trim().isEmpty();
    }

    String modelId() {
        return model == null ? "" : model.id();
    }
}
