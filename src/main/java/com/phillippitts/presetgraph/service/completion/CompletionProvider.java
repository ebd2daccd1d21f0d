package com.phillippitts.presetgraph.service.completion;

import java.util.function.Consumer;

/**
 * Performs one text or image completion against an AI provider.
 *
 * <p>Implementations deliver chunks in generation order through {@code onChunk} (once with
 * the full text when not streaming) and return the final text. Failures are reported as
 * {@link com.phillippitts.presetgraph.exception.ProviderException}. Implementations that only
 * produce raw strings can wrap the consumer with {@link #rawChunks(Consumer)}.
 *
 * <p>There is no timeout on a call; a hung call stalls only the branch that made it.
 */
public interface CompletionProvider {

    /**
     * @param request   model, prompt and mode of the call
     * @param inputText text produced by the upstream node
     * @param onChunk   receives chunks in order
     * @return final completion text
     * @throws com.phillippitts.presetgraph.exception.ProviderException if the call fails
     */
    String completeText(CompletionRequest request, String inputText, Consumer<StreamChunk> onChunk);

    /**
     * @param request    model, prompt and mode of the call
     * @param imageBytes captured image
     * @param onChunk    receives chunks in order
     * @return final completion text
     * @throws com.phillippitts.presetgraph.exception.ProviderException if the call fails
     */
    String completeImage(CompletionRequest request, byte[] imageBytes, Consumer<StreamChunk> onChunk);

    /**
     * Adapts a typed chunk consumer to raw provider strings, decoding the wipe marker.
     */
    static Consumer<String> rawChunks(Consumer<StreamChunk> onChunk) {
        return raw -> onChunk.accept(StreamChunk.fromRaw(raw));
    }
}
