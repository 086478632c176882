/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.service;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The one shape in which every failure reaches a caller, whether it was raised by the transport,
 * returned by the Connect server, or detected locally.
 * @param status An HTTP-style status code.
 * @param message A human-readable description of the failure.
 */
public record ErrorResponse(@JsonProperty("status") int status,
                            @JsonProperty("message") String message) {
    public ErrorResponse {
        Objects.requireNonNull(message);
    }
}
