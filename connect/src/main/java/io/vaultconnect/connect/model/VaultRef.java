/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The reference from an item to the vault holding it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VaultRef(@JsonProperty("id") String id) {
    public VaultRef {
        Objects.requireNonNull(id);
    }
}
