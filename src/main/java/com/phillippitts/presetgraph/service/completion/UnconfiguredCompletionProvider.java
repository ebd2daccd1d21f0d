package com.phillippitts.presetgraph.service.completion;

import com.phillippitts.presetgraph.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Consumer;

/**
 * Placeholder used until an application declares a real {@link CompletionProvider} bean.
 * Every call fails with a missing-key error for the requested provider, which the executor
 * shows to the user like any other provider failure.
 */
public class UnconfiguredCompletionProvider implements CompletionProvider {

    private static final Logger LOG = LogManager.getLogger(UnconfiguredCompletionProvider.class);

    @Override
    public String completeText(CompletionRequest request, String inputText, Consumer<StreamChunk> onChunk) {
        throw unconfigured(request);
    }

    @Override
    public String completeImage(CompletionRequest request, byte[] imageBytes, Consumer<StreamChunk> onChunk) {
        throw unconfigured(request);
    }

    private ProviderException unconfigured(CompletionRequest request) {
        LOG.warn("No completion provider configured; rejecting call to provider={}, model={}",
                request.providerId(), request.modelName());
        return ProviderException.missingApiKey(request.providerId());
    }
}
