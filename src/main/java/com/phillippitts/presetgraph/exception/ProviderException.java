package com.phillippitts.presetgraph.exception;

/**
 * Thrown by a completion provider when a text or image completion fails.
 *
 * <p>The executor catches this at the node boundary and turns it into the node's
 * user-visible terminal text; it never propagates past a node.
 */
public class ProviderException extends PresetGraphException {

    /** Failure categories a provider can report. */
    public enum ErrorKind {
        MISSING_API_KEY,
        INVALID_API_KEY,
        PROVIDER_HTTP_ERROR,
        MALFORMED_RESPONSE
    }

    private final ErrorKind kind;
    private final String providerId;
    private final Integer httpStatus;

    public ProviderException(ErrorKind kind, String message, String providerId) {
        this(kind, message, providerId, null, null);
    }

    public ProviderException(ErrorKind kind, String message, String providerId, Integer httpStatus) {
        this(kind, message, providerId, httpStatus, null);
    }

    public ProviderException(ErrorKind kind, String message, String providerId,
                             Integer httpStatus, Throwable cause) {
        super(message + " (provider: " + (providerId == null ? "unknown" : providerId) + ")", cause);
        this.kind = kind == null ? ErrorKind.PROVIDER_HTTP_ERROR : kind;
        this.providerId = providerId == null ? "unknown" : providerId;
        this.httpStatus = httpStatus;
    }

    public static ProviderException missingApiKey(String providerId) {
        return new ProviderException(ErrorKind.MISSING_API_KEY, "No API key configured", providerId);
    }

    public static ProviderException invalidApiKey(String providerId) {
        return new ProviderException(ErrorKind.INVALID_API_KEY, "API key rejected", providerId, 401);
    }

    public static ProviderException httpError(String providerId, int status, String detail) {
        return new ProviderException(ErrorKind.PROVIDER_HTTP_ERROR,
                "HTTP " + status + (detail == null || detail.isBlank() ? "" : ": " + detail),
                providerId, status);
    }

    public static ProviderException malformedResponse(String providerId, String detail) {
        return new ProviderException(ErrorKind.MALFORMED_RESPONSE, "Malformed response: " + detail, providerId);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * @return HTTP status reported by the provider, or {@code null} if none applies
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
