package com.phillippitts.presetgraph.service.completion;

import com.phillippitts.presetgraph.exception.ProviderException;

import java.util.Locale;

/**
 * Decides whether a failed completion is worth retrying on a fallback model.
 *
 * <p>Rate limits (HTTP 429) and server errors (5xx) are retryable, as are failures whose
 * message mentions a rate limit, too many requests or an exceeded quota. Missing or
 * rejected API keys never are, and neither is any other HTTP status.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static boolean isRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof ProviderException pe) {
            if (pe.getKind() == ProviderException.ErrorKind.MISSING_API_KEY
                    || pe.getKind() == ProviderException.ErrorKind.INVALID_API_KEY) {
                return false;
            }
            Integer status = pe.getHttpStatus();
            if (status != null) {
                return status == 429 || (status >= 500 && status <= 599);
            }
        }
        return mentionsRateLimit(error.getMessage());
    }

    static boolean mentionsRateLimit(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit")
                || lower.contains("too many requests")
                || lower.contains("quota exceeded");
    }
}
