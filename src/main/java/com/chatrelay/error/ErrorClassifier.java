package com.chatrelay.error;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Maps failures and status codes onto {@link ErrorCategory}.
 * Both mappings are total: every input yields exactly one category.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    /**
     * Returns the category of the first {@link RelayException} in the cause chain,
     * or {@link ErrorCategory#INTERNAL} if there is none.
     *
     * @param failure any throwable, may be null
     * @return the category, never null
     */
    public static ErrorCategory classify(Throwable failure) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = failure;
        while (current != null && seen.add(current)) {
            if (current instanceof RelayException relayException) {
                return relayException.getCategory();
            }
            current = current.getCause();
        }
        return ErrorCategory.INTERNAL;
    }

    /**
     * 404 -> not_found, 429 -> rate_limit, other 4xx -> validation,
     * 5xx and above -> api, anything else -> internal.
     */
    public static ErrorCategory fromHttpStatus(int statusCode) {
        if (statusCode == 404) {
            return ErrorCategory.NOT_FOUND;
        }
        if (statusCode == 429) {
            return ErrorCategory.RATE_LIMIT;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return ErrorCategory.VALIDATION;
        }
        if (statusCode >= 500) {
            return ErrorCategory.API;
        }
        return ErrorCategory.INTERNAL;
    }

    public static boolean isCategory(Throwable failure, ErrorCategory category) {
        return failure != null && classify(failure) == category;
    }
}
