/**
 * Classified failure raised by the catalog API client
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.williamcallahan.movie_discovery_engine.util.AsyncUtils;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.PrematureCloseException;

import java.io.IOException;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

public class CatalogApiException extends RuntimeException {

    private final CatalogErrorKind kind;
    private final Integer statusCode;

    public CatalogApiException(CatalogErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public CatalogApiException(CatalogErrorKind kind, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public CatalogErrorKind getKind() {
        return kind;
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public boolean requiresUserAction() {
        return kind.requiresUserAction();
    }

    public String userMessage() {
        return kind.userMessage();
    }

    public static CatalogApiException unauthorized(String message) {
        return new CatalogApiException(CatalogErrorKind.UNAUTHORIZED, message);
    }

    public static CatalogApiException cancelled(String message) {
        return new CatalogApiException(CatalogErrorKind.CANCELLED, message);
    }

    /**
     * Classifies an arbitrary failure from the HTTP stack or decoder
     * CompletionException and ExecutionException wrappers are unwrapped first
     * Unknown failures are treated as fatal so they are not retried
     *
     * @param throwable failure to classify
     * @return the same instance when already classified, otherwise a new wrapping exception
     */
    public static CatalogApiException from(Throwable throwable) {
        Throwable cause = AsyncUtils.unwrap(throwable);
        if (cause instanceof CatalogApiException cae) {
            return cae;
        }
        if (cause instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return new CatalogApiException(CatalogErrorKind.fromStatus(status),
                "HTTP " + status + " from catalog API", status, wcre);
        }
        if (cause instanceof CancellationException) {
            return new CatalogApiException(CatalogErrorKind.CANCELLED, "Request cancelled", null, cause);
        }
        if (cause instanceof JsonProcessingException || cause instanceof DecodingException) {
            return new CatalogApiException(CatalogErrorKind.DECODE,
                "Failed to decode catalog response: " + cause.getMessage(), null, cause);
        }
        if (cause instanceof WebClientRequestException
                || cause instanceof PrematureCloseException
                || cause instanceof TimeoutException
                || cause instanceof IOException) {
            return new CatalogApiException(CatalogErrorKind.TRANSPORT,
                "Network error: " + cause.getMessage(), null, cause);
        }
        return new CatalogApiException(CatalogErrorKind.INVALID_REQUEST,
            "Unexpected error: " + (cause == null ? "unknown" : cause.getMessage()), null, cause);
    }

    public static boolean isCancellation(Throwable throwable) {
        Throwable cause = AsyncUtils.unwrap(throwable);
        return cause instanceof CancellationException
            || (cause instanceof CatalogApiException cae && cae.getKind() == CatalogErrorKind.CANCELLED);
    }
}
