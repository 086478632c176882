/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.service;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown, or used to complete a stage exceptionally, whenever a Connect operation fails.
 * The {@link #errorResponse()} is the only thing callers need to inspect.
 */
public class ConnectException extends RuntimeException {

    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;

    private final transient ErrorResponse errorResponse;

    public ConnectException(@NonNull ErrorResponse errorResponse) {
        super(describe(errorResponse));
        this.errorResponse = errorResponse;
    }

    public ConnectException(@NonNull ErrorResponse errorResponse, Throwable cause) {
        super(describe(errorResponse), cause);
        this.errorResponse = errorResponse;
    }

    /**
     * Creates an exception for a request the client refuses to make, or a value it refuses to construct.
     * @param message The message.
     * @return The exception.
     */
    public static ConnectException badRequest(@NonNull String message) {
        return new ConnectException(new ErrorResponse(BAD_REQUEST, message));
    }

    public static ConnectException notFound(@NonNull String message) {
        return new ConnectException(new ErrorResponse(NOT_FOUND, message));
    }

    private static String describe(ErrorResponse errorResponse) {
        Objects.requireNonNull(errorResponse);
        return errorResponse.status() + ": " + errorResponse.message();
    }

    @NonNull
    public ErrorResponse errorResponse() {
        return errorResponse;
    }

    public int status() {
        return errorResponse.status();
    }
}
