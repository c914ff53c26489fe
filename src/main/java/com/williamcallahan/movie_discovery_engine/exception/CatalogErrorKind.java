/**
 * Failure categories for calls against the movie catalog API
 *
 * @author William Callahan
 *
 * Features:
 * - Separates transient failures (retried) from fatal ones
 * - Marks credential problems as requiring user action
 * - Carries a short message suitable for showing to an end user
 */
package com.williamcallahan.movie_discovery_engine.exception;

public enum CatalogErrorKind {
    INVALID_REQUEST(false, false, "Invalid request"),
    UNAUTHORIZED(false, true, "Invalid API key"),
    RATE_LIMITED(true, false, "Too many requests. Please try again later."),
    SERVER_ERROR(true, false, "Server error. Please try again later."),
    TRANSPORT(true, false, "No internet connection"),
    DECODE(false, false, "Something went wrong. Please try again."),
    CANCELLED(false, false, "Request cancelled");

    private final boolean retryable;
    private final boolean requiresUserAction;
    private final String userMessage;

    CatalogErrorKind(boolean retryable, boolean requiresUserAction, String userMessage) {
        this.retryable = retryable;
        this.requiresUserAction = requiresUserAction;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean requiresUserAction() {
        return requiresUserAction;
    }

    public String userMessage() {
        return userMessage;
    }

    /**
     * Maps an HTTP status code to its failure category
     *
     * @param statusCode HTTP status received from the catalog API
     * @return the matching kind; any 4xx not covered elsewhere is an invalid request
     */
    public static CatalogErrorKind fromStatus(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return UNAUTHORIZED;
        }
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        return INVALID_REQUEST;
    }
}
