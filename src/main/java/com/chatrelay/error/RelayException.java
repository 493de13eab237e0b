package com.chatrelay.error;

import lombok.Getter;

/**
 * Unchecked failure carrying its own {@link ErrorCategory}.
 *
 * Everything the relay raises on purpose is one of these, so classification
 * is a field read rather than a guess. Use the static factories; the category
 * is fixed at construction.
 */
@Getter
public class RelayException extends RuntimeException {

    private final ErrorCategory category;

    /**
     * HTTP-like status that produced this failure, 0 when not applicable.
     */
    private final int statusCode;

    /**
     * Seconds the caller was asked to wait, only meaningful for {@link ErrorCategory#RATE_LIMIT}.
     */
    private final int retryAfterSeconds;

    public RelayException(ErrorCategory category, String message, Throwable cause) {
        this(category, message, cause, 0, 0);
    }

    private RelayException(
            ErrorCategory category,
            String message,
            Throwable cause,
            int statusCode,
            int retryAfterSeconds
    ) {
        super(message, cause);
        this.category = category != null ? category : ErrorCategory.INTERNAL;
        this.statusCode = statusCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RelayException api(String message, Throwable cause) {
        return new RelayException(ErrorCategory.API, message, cause);
    }

    public static RelayException config(String message) {
        return new RelayException(ErrorCategory.CONFIG, message, null);
    }

    public static RelayException protocol(String message, Throwable cause) {
        return new RelayException(ErrorCategory.PROTOCOL, message, cause);
    }

    public static RelayException validation(String message) {
        return new RelayException(ErrorCategory.VALIDATION, message, null);
    }

    public static RelayException notFound(String message) {
        return new RelayException(ErrorCategory.NOT_FOUND, message, null);
    }

    public static RelayException rateLimit(String message, int retryAfterSeconds) {
        return new RelayException(ErrorCategory.RATE_LIMIT, message, null, 429, Math.max(0, retryAfterSeconds));
    }

    public static RelayException network(String message, Throwable cause) {
        return new RelayException(ErrorCategory.NETWORK, message, cause);
    }

    public static RelayException internal(String message, Throwable cause) {
        return new RelayException(ErrorCategory.INTERNAL, message, cause);
    }

    /**
     * Builds the failure matching an HTTP-like status code returned by a remote call.
     */
    public static RelayException fromHttpStatus(int statusCode, String message) {
        ErrorCategory category = ErrorClassifier.fromHttpStatus(statusCode);
        return new RelayException(category, message, null, statusCode, 0);
    }

    @Override
    public String toString() {
        return category.label() + ": " + getMessage();
    }
}
