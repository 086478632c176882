/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import io.vaultconnect.connect.service.ConnectException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A mutable builder for {@link Item}s, which can be turned into an immutable item using {@link #build()}.
 * <p>The builder checks what can be checked locally: that a category has been chosen, and that every field
 * is attached to a section of the same item. Everything else (whether the vault exists, whether a
 * field's value suits its type) is left to the server.</p>
 * <p>{@link #build()} takes a snapshot, so a builder can go on being used,
 * and changes made after a build do not affect the items already built.</p>
 */
public class ItemBuilder {

    /** The title of items whose title is never set. */
    public static final String DEFAULT_TITLE = "";

    private final Supplier<String> sectionIds;

    private Category category;
    private String title = DEFAULT_TITLE;
    private boolean favorite;
    private final List<Section> sections = new ArrayList<>();
    private final List<Field> fields = new ArrayList<>();
    private final List<ItemUrl> urls = new ArrayList<>();
    private final Set<String> tags = new LinkedHashSet<>();

    public ItemBuilder() {
        this(new Identifiers());
    }

    ItemBuilder(Supplier<String> sectionIds) {
        this.sectionIds = Objects.requireNonNull(sectionIds);
    }

    /**
     * Sets the category, replacing any category set before.
     */
    public ItemBuilder setCategory(@NonNull Category category) {
        this.category = Objects.requireNonNull(category);
        return this;
    }

    public ItemBuilder setTitle(@NonNull String title) {
        this.title = Objects.requireNonNull(title);
        return this;
    }

    public ItemBuilder setFavorite(boolean favorite) {
        this.favorite = favorite;
        return this;
    }

    public ItemBuilder addTag(@NonNull String tag) {
        tags.add(Objects.requireNonNull(tag));
        return this;
    }

    /**
     * Adds a url. If the url is primary, any url added before stops being primary.
     */
    public ItemBuilder addUrl(@NonNull ItemUrl url) {
        Objects.requireNonNull(url);
        if (url.primary()) {
            urls.replaceAll(ItemUrl::demoted);
        }
        urls.add(url);
        return this;
    }

    /**
     * Adds a section with a generated id.
     * @param label The label.
     * @return A handle for attaching fields to the section.
     */
    @NonNull
    public SectionHandle addSection(String label) {
        return addSection(label, sectionIds.get());
    }

    /**
     * Adds a section with the given id.
     * @param label The label.
     * @param sectionId The id, which must not be used by another section of this builder.
     * @return A handle for attaching fields to the section.
     * @throws ConnectException If another section already has the id.
     */
    @NonNull
    public SectionHandle addSection(String label, @NonNull String sectionId) {
        Objects.requireNonNull(sectionId);
        if (indexOf(sectionId) >= 0) {
            throw ConnectException.badRequest("Section '" + sectionId + "' is already defined on this item");
        }
        sections.add(new Section(sectionId, label));
        return new SectionHandle(sections.size() - 1, sectionId);
    }

    /**
     * Adds a field. A field that already refers to a section must refer to one added to this builder.
     * @throws ConnectException If the field refers to a section that this builder does not have.
     */
    public ItemBuilder addField(@NonNull Field field) {
        Objects.requireNonNull(field);
        if (field.section() != null && indexOf(field.section().id()) < 0) {
            throw undefinedSection(field.section().id());
        }
        fields.add(field);
        return this;
    }

    /**
     * Adds a field to a section.
     * @param field The field.
     * @param section A handle returned by {@link #addSection(String)} on this builder.
     * @throws ConnectException If the handle does not identify a section of this builder.
     */
    public ItemBuilder addField(@NonNull Field field, @NonNull SectionHandle section) {
        Objects.requireNonNull(field);
        Objects.requireNonNull(section);
        if (section.index() < 0
                || section.index() >= sections.size()
                || !sections.get(section.index()).id().equals(section.sectionId())) {
            throw undefinedSection(section.sectionId());
        }
        fields.add(field.withSection(new SectionRef(section.sectionId())));
        return this;
    }

    private int indexOf(String sectionId) {
        for (int i = 0; i < sections.size(); i++) {
            if (sections.get(i).id().equals(sectionId)) {
                return i;
            }
        }
        return -1;
    }

    private static ConnectException undefinedSection(String sectionId) {
        return ConnectException.badRequest("Section '" + sectionId + "' is not defined on this item");
    }

    /**
     * @return An immutable snapshot of the builder's state.
     * @throws ConnectException If no category has been set.
     */
    @NonNull
    public Item build() {
        if (category == null) {
            throw ConnectException.badRequest("Item Category must be defined.");
        }
        return new Item(null, title, null, category, urls, favorite, tags, sections, fields, 0, false, null, null, null);
    }
}
