/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

/**
 * Identifies a section added to an {@link ItemBuilder}, for attaching fields to it.
 * A handle is only meaningful to the builder that returned it.
 * @param index The position of the section in the builder.
 * @param sectionId The id of the section.
 */
public record SectionHandle(int index, String sectionId) {}
