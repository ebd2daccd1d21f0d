package com.phillippitts.presetgraph.service.model;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Resolves block model ids to providers and picks fallback models for retries.
 */
public interface ModelRegistry {

    /**
     * Resolves a model id. Never fails: an id that is not configured resolves to a descriptor
     * served by the default provider, with the id itself as model name.
     */
    ModelDescriptor resolve(String modelId);

    /**
     * Next enabled model of {@code type}, in configuration order, that is neither
     * {@code currentId} nor one of {@code failedIds}.
     */
    Optional<ModelDescriptor> fallback(String currentId, Collection<String> failedIds, ModelType type);

    List<ModelDescriptor> models();
}
