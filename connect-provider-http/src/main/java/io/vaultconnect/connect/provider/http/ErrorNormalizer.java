/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.provider.http;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import io.vaultconnect.connect.service.ConnectException;
import io.vaultconnect.connect.service.ErrorResponse;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Reshapes whatever went wrong with an HTTP exchange into an {@link ErrorResponse}.
 */
final class ErrorNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorNormalizer.class);

    static final int SERVICE_UNAVAILABLE = 503;
    static final int GATEWAY_TIMEOUT = 504;
    static final int INTERNAL_ERROR = 500;

    private ErrorNormalizer() {
    }

    /**
     * Normalizes a non-2xx response.
     * A body that is a JSON object with an integer {@code status} and a textual {@code message} is passed through as-is.
     * Any other body is replaced by a generic message for the response's status code.
     * @param statusCode The HTTP status code of the response.
     * @param body The response body, possibly empty.
     * @return The error response.
     */
    @NonNull
    static ErrorResponse fromResponse(int statusCode, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode tree = ConnectJson.MAPPER.readTree(body);
                var statusNode = tree.get("status");
                var messageNode = tree.get("message");
                if (tree.isObject()
                        && statusNode != null && statusNode.isInt()
                        && messageNode != null && messageNode.isTextual()) {
                    return new ErrorResponse(statusNode.intValue(), messageNode.textValue());
                }
            }
            catch (JsonProcessingException e) {
                LOGGER.debug("Body of {} response is not JSON, using a generic message", statusCode, e);
            }
        }
        return new ErrorResponse(statusCode, "Request failed with status code " + statusCode);
    }

    /**
     * Normalizes a failure of the exchange itself: the server could not be reached, the request timed out,
     * or the response could not be read.
     * A {@link ConnectException} passes through unchanged.
     * @param failure The failure, possibly wrapped in a {@link CompletionException} or {@link ExecutionException}.
     * @return The error response.
     */
    @NonNull
    static ErrorResponse fromThrowable(@NonNull Throwable failure) {
        var cause = unwrap(failure);
        if (cause instanceof ConnectException connectException) {
            return connectException.errorResponse();
        }
        if (cause instanceof HttpTimeoutException) {
            return new ErrorResponse(GATEWAY_TIMEOUT, "Request to the Connect server timed out");
        }
        if (cause instanceof JsonProcessingException) {
            return new ErrorResponse(INTERNAL_ERROR, "Unable to process the Connect server response: " + cause.getMessage());
        }
        if (cause instanceof IOException || cause instanceof InterruptedException) {
            return new ErrorResponse(SERVICE_UNAVAILABLE, "Unable to reach the Connect server: " + describe(cause));
        }
        return new ErrorResponse(INTERNAL_ERROR, "Connect request failed: " + describe(cause));
    }

    /**
     * @return A {@link ConnectException} for the given failure, keeping the original failure as its cause.
     */
    @NonNull
    static ConnectException toException(@NonNull Throwable failure) {
        var cause = unwrap(failure);
        if (cause instanceof ConnectException connectException) {
            return connectException;
        }
        return new ConnectException(fromThrowable(cause), cause);
    }

    private static Throwable unwrap(Throwable failure) {
        var cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
