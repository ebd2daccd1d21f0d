package com.phillippitts.presetgraph.service.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ModelRegistry} over a fixed, ordered list of models.
 *
 * <p><b>Thread Safety:</b> immutable after construction.
 */
public final class InMemoryModelRegistry implements ModelRegistry {

    private final Map<String, ModelDescriptor> byId;
    private final String defaultProvider;

    public InMemoryModelRegistry(List<ModelDescriptor> models, String defaultProvider) {
        Objects.requireNonNull(models, "models must not be null");
        Map<String, ModelDescriptor> index = new LinkedHashMap<>();
        for (ModelDescriptor m : models) {
            if (index.putIfAbsent(m.id(), m) != null) {
                throw new IllegalArgumentException("Duplicate model id: " + m.id());
            }
        }
        this.byId = Collections.unmodifiableMap(index);
        this.defaultProvider = defaultProvider == null || defaultProvider.isBlank() ? "groq" : defaultProvider;
    }

    @Override
    public ModelDescriptor resolve(String modelId) {
        String id = modelId == null ? "" : modelId;
        ModelDescriptor known = byId.get(id);
        if (known != null) {
            return known;
        }
        return new ModelDescriptor(id, defaultProvider, id, ModelType.TEXT, true);
    }

    @Override
    public Optional<ModelDescriptor> fallback(String currentId, Collection<String> failedIds, ModelType type) {
        for (ModelDescriptor m : byId.values()) {
            if (!m.enabled() || m.type() != type) {
                continue;
            }
            if (m.id().equals(currentId) || (failedIds != null && failedIds.contains(m.id()))) {
                continue;
            }
            return Optional.of(m);
        }
        return Optional.empty();
    }

    @Override
    public List<ModelDescriptor> models() {
        return List.copyOf(byId.values());
    }

    public String getDefaultProvider() {
        return defaultProvider;
    }
}
