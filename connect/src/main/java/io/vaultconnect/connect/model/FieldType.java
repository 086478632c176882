/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum FieldType {
    STRING,
    EMAIL,
    CONCEALED,
    URL,
    TOTP,
    DATE,
    MONTH_YEAR,
    MENU,
    PHONE,
    ADDRESS,
    REFERENCE,
    OTP,
    SSHKEY,
    CREDIT_CARD_TYPE,
    CREDIT_CARD_NUMBER,
    @JsonEnumDefaultValue
    UNKNOWN
}
