package com.phillippitts.presetgraph.config.properties;

import com.phillippitts.presetgraph.service.model.ModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-side configuration captured into every run.
 *
 * <p>Properties:
 * <ul>
 *   <li>presetgraph.providers.ui-language - language of error and status texts (default: en)</li>
 *   <li>presetgraph.providers.default-provider - provider for unknown model ids (default: groq)</li>
 *   <li>presetgraph.providers.api-keys.&lt;provider&gt; - API key per provider id</li>
 *   <li>presetgraph.providers.models[n].* - model catalogue, in fallback order</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "presetgraph.providers")
public class ProviderProperties {

    @NotBlank
    private String uiLanguage = "en";

    @NotBlank
    private String defaultProvider = "groq";

    private Map<String, String> apiKeys = new LinkedHashMap<>();

    @Valid
    private List<ModelEntry> models = new ArrayList<>();

    public String getUiLanguage() {
        return uiLanguage;
    }

    public void setUiLanguage(String uiLanguage) {
        this.uiLanguage = uiLanguage;
    }

    public String getDefaultProvider() {
        return defaultProvider;
    }

    public void setDefaultProvider(String defaultProvider) {
        this.defaultProvider = defaultProvider;
    }

    public Map<String, String> getApiKeys() {
        return apiKeys;
    }

    public void setApiKeys(Map<String, String> apiKeys) {
        this.apiKeys = apiKeys;
    }

    public List<ModelEntry> getModels() {
        return models;
    }

    public void setModels(List<ModelEntry> models) {
        this.models = models;
    }

    /**
     * One configured model.
     */
    public static class ModelEntry {
        @NotBlank
        private String id;

        @NotBlank
        private String provider;

        /** Provider-side model name; defaults to the id. */
        private String fullName;

        private ModelType type = ModelType.TEXT;

        private boolean enabled = true;

        public ModelEntry() {
        }

        public ModelEntry(String id, String provider, String fullName, ModelType type, boolean enabled) {
            this.id = id;
            this.provider = provider;
            this.fullName = fullName;
            this.type = type;
            this.enabled = enabled;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getFullName() {
            return fullName;
        }

        public void setFullName(String fullName) {
            this.fullName = fullName;
        }

        public ModelType getType() {
            return type;
        }

        public void setType(ModelType type) {
            this.type = type;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
