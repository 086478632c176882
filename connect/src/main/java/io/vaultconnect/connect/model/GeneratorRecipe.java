/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.vaultconnect.connect.service.ConnectException;

/**
 * Parameters for a value the server should generate.
 * @param length The number of characters, between {@value #MIN_LENGTH} and {@value #MAX_LENGTH}, or null for the server's default.
 * @param characterSets The classes of character to draw from. Null means all of them; empty is rejected by {@link #validate()}.
 * @param excludeCharacters Characters that must not appear, or null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratorRecipe(@JsonProperty("length") Integer length,
                              @JsonProperty("characterSets") Set<CharacterSet> characterSets,
                              @JsonProperty("excludeCharacters") String excludeCharacters) {

    public static final int MIN_LENGTH = 1;
    public static final int MAX_LENGTH = 64;

    public GeneratorRecipe {
        if (characterSets == null) {
            characterSets = EnumSet.allOf(CharacterSet.class);
        }
        characterSets = Collections.unmodifiableSet(characterSets.isEmpty()
                ? EnumSet.noneOf(CharacterSet.class)
                : EnumSet.copyOf(characterSets));
    }

    /**
     * Recipe with the given length drawing from the given character sets.
     * @throws ConnectException If the length is out of range.
     */
    public static GeneratorRecipe of(int length, CharacterSet first, CharacterSet... rest) {
        return new GeneratorRecipe(length, EnumSet.of(first, rest), null).validate();
    }

    /**
     * Checks that the server could follow this recipe.
     * Recipes read from the server are taken as they are; recipes sent to it are checked first.
     * @return This recipe.
     * @throws ConnectException If the length is outside {@value #MIN_LENGTH}..{@value #MAX_LENGTH}
     * or no character set is allowed.
     */
    public GeneratorRecipe validate() {
        if (length != null && (length < MIN_LENGTH || length > MAX_LENGTH)) {
            throw ConnectException.badRequest("Generator recipe length must be between " + MIN_LENGTH + " and " + MAX_LENGTH
                    + ", but was " + length);
        }
        if (characterSets.isEmpty()) {
            throw ConnectException.badRequest("Generator recipe must allow at least one character set");
        }
        return this;
    }
}
