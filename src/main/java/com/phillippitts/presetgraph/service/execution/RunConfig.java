package com.phillippitts.presetgraph.service.execution;

import com.phillippitts.presetgraph.service.completion.ApiKeys;
import com.phillippitts.presetgraph.service.model.ModelRegistry;

import java.util.Objects;

/**
 * Configuration captured when a run starts and handed to every node of that run.
 *
 * @param apiKeys          provider keys
 * @param uiLanguage       language of user-facing error and status texts
 * @param modelRegistry    resolves block model ids
 * @param disableAutoPaste suppresses every paste of the run
 */
public record RunConfig(ApiKeys apiKeys, String uiLanguage, ModelRegistry modelRegistry, boolean disableAutoPaste) {

    public RunConfig {
        Objects.requireNonNull(modelRegistry, "modelRegistry must not be null");
        apiKeys = apiKeys == null ? ApiKeys.none() : apiKeys;
        uiLanguage = uiLanguage == null || uiLanguage.isBlank() ? "en" : uiLanguage;
    }

    public RunConfig withDisableAutoPaste(boolean disable) {
        return new RunConfig(apiKeys, uiLanguage, modelRegistry, disable);
    }
}
