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
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An item as persisted by the server, with every field and section populated.
 * <p>To change an item, derive a copy with the {@code with*} methods and pass the copy,
 * which must hold the complete desired state, to {@code Connect.updateItem}.</p>
 * @see Item
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FullItem(@JsonProperty("id") String id,
                       @JsonProperty("title") String title,
                       @JsonProperty("vault") VaultRef vault,
                       @JsonProperty("category") Category category,
                       @JsonProperty("urls") List<ItemUrl> urls,
                       @JsonProperty("favorite") boolean favorite,
                       @JsonProperty("tags") Set<String> tags,
                       @JsonProperty("sections") List<Section> sections,
                       @JsonProperty("fields") List<Field> fields,
                       @JsonProperty("version") int version,
                       @JsonProperty("trashed") boolean trashed,
                       @JsonProperty("createdAt") Instant createdAt,
                       @JsonProperty("updatedAt") Instant updatedAt,
                       @JsonProperty("lastEditedBy") String lastEditedBy) {

    public FullItem {
        Objects.requireNonNull(id);
        urls = urls == null ? List.of() : List.copyOf(urls);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        sections = sections == null ? List.of() : List.copyOf(sections);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public FullItem withTitle(String title) {
        return new FullItem(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }

    public FullItem withTags(Set<String> tags) {
        return new FullItem(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }

    public FullItem withFavorite(boolean favorite) {
        return new FullItem(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }

    public FullItem withUrls(List<ItemUrl> urls) {
        return new FullItem(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }

    public FullItem withSections(List<Section> sections) {
        return new FullItem(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }

    public FullItem withFields(List<Field> fields) {
        return new FullItem(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }

    public FullItem withVault(VaultRef vault) {
        return new FullItem(id, title, vault, category, urls, favorite, tags, sections, fields, version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }

    /**
     * @return This item without its fields and sections, as a list or search would return it.
     */
    public Item summary() {
        return new Item(id, title, vault, category, urls, favorite, tags, List.of(), List.of(), version, trashed, createdAt, updatedAt,
                lastEditedBy);
    }
}
