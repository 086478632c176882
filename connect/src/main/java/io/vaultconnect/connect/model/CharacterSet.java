/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

public enum CharacterSet {
    LETTERS,
    DIGITS,
    SYMBOLS
}
