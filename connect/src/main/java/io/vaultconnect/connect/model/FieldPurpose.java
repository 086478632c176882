/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Marks the role a field plays in its item.
 * {@link #PASSWORD} combined with a generator recipe asks the server to generate the value.
 */
public enum FieldPurpose {
    NONE(""),
    USERNAME("USERNAME"),
    PASSWORD("PASSWORD"),
    NOTES("NOTES");

    private final String wireValue;

    FieldPurpose(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * @param value The wire value.
     * @return The purpose with that wire value, or {@link #NONE} for null, empty and unrecognised values.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FieldPurpose fromWireValue(String value) {
        if (value != null) {
            for (FieldPurpose purpose : values()) {
                if (purpose.wireValue.equals(value)) {
                    return purpose;
                }
            }
        }
        return NONE;
    }
}
