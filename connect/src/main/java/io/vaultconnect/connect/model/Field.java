/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single named value within an item.
 * <p>Supplying a {@code recipe} implies {@code generate}. When {@code generate} is set the server
 * generates the persisted value and the supplied {@code value}, if any, is only a hint.</p>
 * @param id Assigned by the server; null before the item is persisted.
 * @param section The section containing this field, or null.
 * @param type The type, {@link FieldType#STRING} if absent.
 * @param purpose The purpose, {@link FieldPurpose#NONE} if absent.
 * @param label The label.
 * @param value The value, or null.
 * @param generate Whether the server should generate the value.
 * @param recipe How the server should generate the value, or null for its defaults.
 * @param entropy Reported by the server for generated and concealed values; ignored on writes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Field(@JsonProperty("id") String id,
                    @JsonProperty("section") SectionRef section,
                    @JsonProperty("type") FieldType type,
                    @JsonProperty("purpose") FieldPurpose purpose,
                    @JsonProperty("label") String label,
                    @JsonProperty("value") String value,
                    @JsonProperty("generate") boolean generate,
                    @JsonProperty("recipe") GeneratorRecipe recipe,
                    @JsonProperty("entropy") Double entropy) {

    public Field {
        if (type == null) {
            type = FieldType.STRING;
        }
        if (purpose == null) {
            purpose = FieldPurpose.NONE;
        }
        generate = generate || recipe != null;
    }

    public static FieldBuilder builder() {
        return new FieldBuilder();
    }

    public Field withId(String id) {
        return new Field(id, section, type, purpose, label, value, generate, recipe, entropy);
    }

    public Field withSection(SectionRef section) {
        return new Field(id, section, type, purpose, label, value, generate, recipe, entropy);
    }

    public Field withValue(String value) {
        return new Field(id, section, type, purpose, label, value, generate, recipe, entropy);
    }
}
