/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A mutable builder for {@link Field}s.
 * Fields built here have no id and no section; attach them to a section with
 * {@link ItemBuilder#addField(Field, SectionHandle)}.
 */
public class FieldBuilder {

    private String label;
    private String value;
    private FieldType type = FieldType.STRING;
    private FieldPurpose purpose = FieldPurpose.NONE;
    private boolean generate;
    private GeneratorRecipe recipe;

    FieldBuilder() {
    }

    public FieldBuilder label(String label) {
        this.label = label;
        return this;
    }

    public FieldBuilder value(String value) {
        this.value = value;
        return this;
    }

    public FieldBuilder type(@NonNull FieldType type) {
        this.type = Objects.requireNonNull(type);
        return this;
    }

    public FieldBuilder purpose(@NonNull FieldPurpose purpose) {
        this.purpose = Objects.requireNonNull(purpose);
        return this;
    }

    /**
     * Ask the server to generate the value using its default recipe.
     */
    public FieldBuilder generate() {
        this.generate = true;
        return this;
    }

    /**
     * Ask the server to generate the value using the given recipe.
     * @throws io.vaultconnect.connect.service.ConnectException If the recipe is not one the server could follow.
     */
    public FieldBuilder generate(@NonNull GeneratorRecipe recipe) {
        this.recipe = Objects.requireNonNull(recipe).validate();
        this.generate = true;
        return this;
    }

    @NonNull
    public Field build() {
        return new Field(null, null, type, purpose, label, value, generate, recipe, null);
    }
}
