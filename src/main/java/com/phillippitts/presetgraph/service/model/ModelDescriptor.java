package com.phillippitts.presetgraph.service.model;

import java.util.Objects;

/**
 * A model a block can reference by id.
 *
 * @param id       registry id used in block configuration
 * @param provider provider id serving the model (e.g. "groq", "google")
 * @param fullName provider-side model name sent with the request
 * @param type     input modality
 * @param enabled  disabled models are never picked as fallbacks
 */
public record ModelDescriptor(String id, String provider, String fullName, ModelType type, boolean enabled) {

    public ModelDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        fullName = fullName == null || fullName.isBlank() ? id : fullName;
        type = type == null ? ModelType.TEXT : type;
    }
}
