/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A labelled group of fields within an item.
 * @param id Unique within the item.
 * @param label The label, which may be absent on sections created by other clients.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Section(@JsonProperty("id") String id,
                      @JsonProperty("label") String label) {
    public Section {
        Objects.requireNonNull(id);
    }

    public SectionRef ref() {
        return new SectionRef(id);
    }
}
