package com.phillippitts.presetgraph.service.completion;

import com.phillippitts.presetgraph.exception.ProviderException;
import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns provider failures into the text shown as a node's result, in the run's UI language.
 *
 * <p>Messages live in the {@code i18n/errors} bundle (en, vi, ko, ja, zh). HTTP 400, 401,
 * 403, 404, 429, 500, 502, 503 and 504 have dedicated texts; other statuses and
 * non-HTTP failures use a generic one. Unknown languages fall back to English.
 */
public class ErrorMessageFormatter {

    /** Classpath base name of the error message bundle. */
    public static final String BUNDLE = "i18n/errors";

    private static final Set<Integer> KNOWN_STATUSES = Set.of(400, 401, 403, 404, 429, 500, 502, 503, 504);

    private static final Map<String, String> PROVIDER_NAMES = Map.of(
            "groq", "Groq",
            "google", "Google Gemini",
            "openai", "OpenAI",
            "anthropic", "Anthropic");

    private final MessageSource messages;

    public ErrorMessageFormatter(MessageSource messages) {
        this.messages = Objects.requireNonNull(messages, "messages must not be null");
    }

    /**
     * Message source over {@link #BUNDLE}, UTF-8, falling back to the English base bundle
     * rather than the JVM locale.
     */
    public static MessageSource defaultMessages() {
        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBasename(BUNDLE);
        source.setDefaultEncoding("UTF-8");
        source.setFallbackToSystemLocale(false);
        return source;
    }

    /**
     * Formats any failure raised by a completion call.
     *
     * @param error     failure from the provider
     * @param modelName model that was called (may be null)
     * @param language  UI language code, e.g. "en" or "vi"
     */
    public String format(Throwable error, String modelName, String language) {
        Locale locale = toLocale(language);
        if (!(error instanceof ProviderException pe)) {
            String detail = error == null ? "" : String.valueOf(error.getMessage());
            return message("error.generic", locale, detail);
        }
        String provider = displayName(pe.getProviderId());
        switch (pe.getKind()) {
            case MISSING_API_KEY:
                return message("error.no-api-key", locale, provider);
            case INVALID_API_KEY:
                if (pe.getHttpStatus() == null) {
                    return message("error.invalid-api-key", locale, provider);
                }
                return formatHttp(pe.getHttpStatus(), provider, modelName, locale);
            default:
                if (pe.getHttpStatus() != null) {
                    return formatHttp(pe.getHttpStatus(), provider, modelName, locale);
                }
                return message("error.generic", locale, pe.getMessage());
        }
    }

    /** Notice shown in a node's display while a fallback model is tried. */
    public String retrying(String modelName, String language) {
        return message("status.retrying", toLocale(language), modelName);
    }

    String formatHttp(int status, String provider, String modelName, Locale locale) {
        String modelInfo = modelName == null || modelName.isBlank() ? provider : modelName + " (" + provider + ")";
        String model = modelName == null || modelName.isBlank() ? message("error.model.this", locale) : modelName;
        String key = KNOWN_STATUSES.contains(status) ? "error.http." + status : "error.http.other";
        return message(key, locale, String.valueOf(status), provider, modelInfo, model);
    }

    /** Human readable provider name, e.g. "google" becomes "Google Gemini". */
    public static String displayName(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return "API";
        }
        return PROVIDER_NAMES.getOrDefault(providerId, providerId);
    }

    private String message(String key, Locale locale, Object... args) {
        try {
            return messages.getMessage(key, args, locale);
        } catch (NoSuchMessageException e) {
            return messages.getMessage(key, args, Locale.ENGLISH);
        }
    }

    private static Locale toLocale(String language) {
        if (language == null || language.isBlank()) {
            return Locale.ENGLISH;
        }
        return Locale.forLanguageTag(language);
    }
}
