/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.service;

import java.util.Objects;
import java.util.function.Predicate;

import io.vaultconnect.connect.model.Item;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A server-side item filter, rendered as an expression such as {@code title eq "Bank"}.
 * @param attribute The item attribute being compared. Only {@code title} is supported.
 * @param value The value the attribute must equal.
 */
public record ItemFilter(@NonNull String attribute, @NonNull String value) implements Predicate<Item> {

    static final String TITLE = "title";

    public ItemFilter {
        Objects.requireNonNull(attribute);
        Objects.requireNonNull(value);
        if (!TITLE.equals(attribute)) {
            throw new IllegalArgumentException("Unsupported filter attribute: " + attribute);
        }
    }

    public static ItemFilter titleEquals(@NonNull String title) {
        return new ItemFilter(TITLE, title);
    }

    /**
     * @return The filter expression, with backslashes and double quotes in the value escaped.
     */
    public String expression() {
        return attribute + " eq \"" + escape(value) + "\"";
    }

    static String escape(String value) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '"') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Evaluates this filter locally, for providers without a server to do it.
     */
    @Override
    public boolean test(Item item) {
        return value.equals(item.title());
    }

    @Override
    public String toString() {
        return expression();
    }
}
