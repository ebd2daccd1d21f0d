package com.phillippitts.presetgraph.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProviderException} carrying request context in its message.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Rate limited
 * throw ProviderExceptionBuilder.create("Completion request rejected")
 *         .provider("groq")
 *         .httpStatus(429)
 *         .metadata("model", "llama-3.3-70b")
 *         .build();
 *
 * // Unparseable body
 * throw ProviderExceptionBuilder.create("Unexpected payload")
 *         .provider("google")
 *         .kind(ProviderException.ErrorKind.MALFORMED_RESPONSE)
 *         .cause(parseError)
 *         .durationMs(820)
 *         .build();
 * </pre>
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private ProviderException.ErrorKind kind;
    private String providerId;
    private Throwable cause;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder kind(ProviderException.ErrorKind kind) {
        this.kind = kind;
        return this;
    }

    public ProviderExceptionBuilder provider(String providerId) {
        this.providerId = providerId;
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status. Without an explicit {@link #kind}, 401 maps to
     * {@code INVALID_API_KEY} and every other status to {@code PROVIDER_HTTP_ERROR}.
     */
    public ProviderExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public ProviderExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public ProviderException build() {
        return new ProviderException(resolveKind(), buildDetailedMessage(), providerId, httpStatus, cause);
    }

    private ProviderException.ErrorKind resolveKind() {
        if (kind != null) {
            return kind;
        }
        if (httpStatus != null && httpStatus == 401) {
            return ProviderException.ErrorKind.INVALID_API_KEY;
        }
        return ProviderException.ErrorKind.PROVIDER_HTTP_ERROR;
    }

    private String buildDetailedMessage() {
        boolean hasDetails = httpStatus != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (httpStatus != null) {
            sb.append("status=").append(httpStatus);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        return sb.append(')').toString();
    }
}
