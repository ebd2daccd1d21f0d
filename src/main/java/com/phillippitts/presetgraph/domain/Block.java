package com.phillippitts.presetgraph.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable configuration of one processing step of a preset.
 *
 * <p>{@code index} is the position of the block inside its {@link Pipeline} and is what
 * {@link Edge}s refer to. {@code id} is a stable opaque identifier used for logging, events
 * and metrics so that a node can be recognised even if blocks are later reordered.
 *
 * @param id               stable opaque identifier
 * @param index            position in the owning pipeline
 * @param kind             processing kind
 * @param modelId          model registry id (ignored for input adapters)
 * @param promptTemplate   prompt with {@code {key}} placeholders
 * @param languageVars     placeholder values for the prompt template, in substitution order
 * @param selectedLanguage fallback value for {@code {language}} and {@code {language1}}
 * @param streamingEnabled whether the completion should be streamed
 * @param renderMode       display render mode
 * @param showOverlay      whether the block gets its own result display
 * @param autoCopy         copy the result to the clipboard
 * @param autoPaste        paste the copied result into the last target
 * @param autoPasteNewline append a newline when injecting pasted text
 * @param autoSpeak        speak the result
 */
public record Block(
        String id,
        int index,
        BlockKind kind,
        String modelId,
        String promptTemplate,
        Map<String, String> languageVars,
        String selectedLanguage,
        boolean streamingEnabled,
        RenderMode renderMode,
        boolean showOverlay,
        boolean autoCopy,
        boolean autoPaste,
        boolean autoPasteNewline,
        boolean autoSpeak
) {

    public Block {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        modelId = modelId == null ? "" : modelId;
        promptTemplate = promptTemplate == null ? "" : promptTemplate;
        languageVars = copyVars(languageVars);
        selectedLanguage = selectedLanguage == null ? "" : selectedLanguage;
        renderMode = renderMode == null ? RenderMode.PLAIN : renderMode;
    }

    /**
     * Insertion-ordered, unmodifiable copy; a null value becomes an empty string. Order matters
     * because substitution runs in this order.
     */
    private static Map<String, String> copyVars(Map<String, String> vars) {
        if (vars == null || vars.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : vars.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "language variable name must not be null");
            copy.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    public boolean isInputAdapter() {
        return kind == BlockKind.INPUT_ADAPTER;
    }

    /**
     * Streaming actually used for this block. Markdown output is only rendered once complete,
     * so markdown blocks never stream.
     */
    public boolean effectiveStreaming() {
        return streamingEnabled && renderMode != RenderMode.MARKDOWN;
    }

    public static Builder builder(BlockKind kind) {
        return new Builder(kind);
    }

    public static Builder inputAdapter() {
        return new Builder(BlockKind.INPUT_ADAPTER);
    }

    public static Builder text(String modelId) {
        return new Builder(BlockKind.TEXT).modelId(modelId);
    }

    public static Builder image(String modelId) {
        return new Builder(BlockKind.IMAGE).modelId(modelId).streamingEnabled(false);
    }

    /**
     * Fluent builder with the defaults of a freshly added block: visible, streaming,
     * plain rendering and no side effects.
     */
    public static final class Builder {
        private String id;
        private int index;
        private final BlockKind kind;
        private String modelId = "";
        private String promptTemplate = "";
        private final Map<String, String> languageVars = new LinkedHashMap<>();
        private String selectedLanguage = "";
        private boolean streamingEnabled = true;
        private RenderMode renderMode = RenderMode.PLAIN;
        private boolean showOverlay = true;
        private boolean autoCopy;
        private boolean autoPaste;
        private boolean autoPasteNewline;
        private boolean autoSpeak;

        private Builder(BlockKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder prompt(String promptTemplate) {
            this.promptTemplate = promptTemplate;
            return this;
        }

        public Builder languageVar(String key, String value) {
            this.languageVars.put(key, value);
            return this;
        }

        public Builder languageVars(Map<String, String> vars) {
            this.languageVars.putAll(vars);
            return this;
        }

        public Builder language(String selectedLanguage) {
            this.selectedLanguage = selectedLanguage;
            return this;
        }

        public Builder streamingEnabled(boolean streamingEnabled) {
            this.streamingEnabled = streamingEnabled;
            return this;
        }

        public Builder renderMode(RenderMode renderMode) {
            this.renderMode = renderMode;
            return this;
        }

        public Builder showOverlay(boolean showOverlay) {
            this.showOverlay = showOverlay;
            return this;
        }

        public Builder autoCopy(boolean autoCopy) {
            this.autoCopy = autoCopy;
            return this;
        }

        public Builder autoPaste(boolean autoPaste) {
            this.autoPaste = autoPaste;
            return this;
        }

        public Builder autoPasteNewline(boolean autoPasteNewline) {
            this.autoPasteNewline = autoPasteNewline;
            return this;
        }

        public Builder autoSpeak(boolean autoSpeak) {
            this.autoSpeak = autoSpeak;
            return this;
        }

        public Block build() {
            String resolvedId = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
            return new Block(resolvedId, index, kind, modelId, promptTemplate, languageVars,
                    selectedLanguage, streamingEnabled, renderMode, showOverlay, autoCopy,
                    autoPaste, autoPasteNewline, autoSpeak);
        }
    }
}
