package com.phillippitts.presetgraph.service.completion;

import java.util.Map;
import java.util.Optional;

/**
 * API keys per provider id, captured once per run.
 *
 * @param byProvider provider id to key; blank keys count as missing
 */
public record ApiKeys(Map<String, String> byProvider) {

    public ApiKeys {
        byProvider = byProvider == null ? Map.of() : Map.copyOf(byProvider);
    }

    public static ApiKeys none() {
        return new ApiKeys(Map.of());
    }

    public Optional<String> forProvider(String providerId) {
        String key = byProvider.get(providerId);
        return key == null || key.isBlank() ? Optional.empty() : Optional.of(key);
    }

    public boolean has(String providerId) {
        return forProvider(providerId).isPresent();
    }

    @Override
    public String toString() {
        // never print the keys themselves
        return "ApiKeys" + byProvider.keySet();
    }
}
