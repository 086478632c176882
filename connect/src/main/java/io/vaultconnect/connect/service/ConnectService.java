/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Service interface for {@link Connect} providers.
 * Implementations are discoverable via {@link java.util.ServiceLoader}.
 * @param <C> The config type
 */
public interface ConnectService<C> {

    /**
     * Builds a client from a validated config.
     * @param config The config.
     * @return The client.
     */
    @NonNull
    Connect buildConnect(@NonNull C config);
}
