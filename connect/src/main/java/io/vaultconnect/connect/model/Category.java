/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * The intended use of an item. Chosen once, when the item is built.
 * Categories the client does not know are read as {@link #CUSTOM}.
 */
public enum Category {
    LOGIN,
    PASSWORD,
    API_CREDENTIAL,
    SERVER,
    DATABASE,
    CREDIT_CARD,
    MEMBERSHIP,
    PASSPORT,
    SOFTWARE_LICENSE,
    OUTDOOR_LICENSE,
    SECURE_NOTE,
    WIRELESS_ROUTER,
    BANK_ACCOUNT,
    DRIVER_LICENSE,
    IDENTITY,
    REWARD_PROGRAM,
    DOCUMENT,
    EMAIL_ACCOUNT,
    SOCIAL_SECURITY_NUMBER,
    MEDICAL_RECORD,
    SSH_KEY,
    @JsonEnumDefaultValue
    CUSTOM
}
