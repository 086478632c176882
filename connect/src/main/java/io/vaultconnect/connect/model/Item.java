/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An item as built locally by an {@link ItemBuilder}, or as summarised by a list or search.
 * Locally built items have no id, vault, version or timestamps.
 * Summaries have those, but no fields or sections.
 * @param id The id, or null if not yet persisted.
 * @param title The title.
 * @param vault The vault holding the item, or null.
 * @param category The category.
 * @param urls The websites associated with the item.
 * @param favorite Whether the item is a favorite.
 * @param tags The tags, in insertion order.
 * @param sections The sections, in order.
 * @param fields The fields, in order.
 * @param version The server's version of the item, 0 if not yet persisted.
 * @param trashed Whether the item is in the trash.
 * @param createdAt When the item was created, or null.
 * @param updatedAt When the item was last updated, or null.
 * @param lastEditedBy Who last edited the item, or null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Item(@JsonProperty("id") String id,
                   @JsonProperty("title") String title,
                   @JsonProperty("vault") VaultRef vault,
                   @JsonProperty("category") Category category,
                   @JsonProperty("urls") List<ItemUrl> urls,
                   @JsonProperty("favorite") boolean favorite,
                   @JsonProperty("tags") Set<String> tags,
                   @JsonProperty("sections") List<Section> sections,
                   @JsonProperty("fields") List<Field> fields,
                   @JsonProperty("version") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int version,
                   @JsonProperty("trashed") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean trashed,
                   @JsonProperty("createdAt") Instant createdAt,
                   @JsonProperty("updatedAt") Instant updatedAt,
                   @JsonProperty("lastEditedBy") String lastEditedBy) {

    public Item {
        urls = urls == null ? List.of() : List.copyOf(urls);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        sections = sections == null ? List.of() : List.copyOf(sections);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ItemBuilder builder() {
        return new ItemBuilder();
    }

    public Item withVault(VaultRef vault) {
        return new Item(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }
}
