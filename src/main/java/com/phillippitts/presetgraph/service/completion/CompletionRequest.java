package com.phillippitts.presetgraph.service.completion;

import java.util.Objects;

/**
 * Parameters of one completion call, shared by text and image completions.
 *
 * @param apiKeys    keys of the run
 * @param prompt     resolved prompt
 * @param modelName  provider-side model name
 * @param providerId provider that serves the model
 * @param streaming  whether chunks should be delivered while generating
 * @param jsonMode   whether structured JSON output is requested
 */
public record CompletionRequest(
        ApiKeys apiKeys,
        String prompt,
        String modelName,
        String providerId,
        boolean streaming,
        boolean jsonMode
) {

    public CompletionRequest {
        Objects.requireNonNull(apiKeys, "apiKeys must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
        Objects.requireNonNull(providerId, "providerId must not be null");
        prompt = prompt == null ? "" : prompt;
    }

    /** Same request aimed at another model, used when retrying with a fallback. */
    public CompletionRequest withModel(String newModelName, String newProviderId) {
        return new CompletionRequest(apiKeys, prompt, newModelName, newProviderId, streaming, jsonMode);
    }
}
