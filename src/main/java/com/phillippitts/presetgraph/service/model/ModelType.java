package com.phillippitts.presetgraph.service.model;

/** Input modality a model accepts. */
public enum ModelType {
    TEXT,
    VISION,
    AUDIO
}
