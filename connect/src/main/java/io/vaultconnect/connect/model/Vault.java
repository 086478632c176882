/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named container of items. Read-only for clients.
 * @param id The vault id.
 * @param name The vault name.
 * @param description The description, if any.
 * @param attributeVersion Incremented when the vault's own attributes change.
 * @param contentVersion Incremented when the vault's items change.
 * @param items The number of items in the vault.
 * @param type The type of vault.
 * @param createdAt When the vault was created.
 * @param updatedAt When the vault was last updated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Vault(@JsonProperty("id") String id,
                    @JsonProperty("name") String name,
                    @JsonProperty("description") String description,
                    @JsonProperty("attributeVersion") int attributeVersion,
                    @JsonProperty("contentVersion") int contentVersion,
                    @JsonProperty("items") int items,
                    @JsonProperty("type") VaultType type,
                    @JsonProperty("createdAt") Instant createdAt,
                    @JsonProperty("updatedAt") Instant updatedAt) {

    public Vault {
        Objects.requireNonNull(id);
    }

    public Vault withItems(int items) {
        return new Vault(id, name, description, attributeVersion, contentVersion, items, type, createdAt, updatedAt);
    }

    public VaultRef ref() {
        return new VaultRef(id);
    }
}
