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
 * A website associated with an item.
 * @param label An optional label.
 * @param primary Whether this is the item's main website.
 * @param href The address.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ItemUrl(@JsonProperty("label") String label,
                      @JsonProperty("primary") boolean primary,
                      @JsonProperty("href") String href) {
    public ItemUrl {
        Objects.requireNonNull(href);
    }

    public static ItemUrl primary(String href) {
        return new ItemUrl(null, true, href);
    }

    public static ItemUrl secondary(String href) {
        return new ItemUrl(null, false, href);
    }

    ItemUrl demoted() {
        return primary ? new ItemUrl(label, false, href) : this;
    }
}
