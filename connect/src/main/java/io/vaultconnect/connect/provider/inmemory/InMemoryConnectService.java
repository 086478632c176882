/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.provider.inmemory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

import io.vaultconnect.connect.model.FullItem;
import io.vaultconnect.connect.model.Identifiers;
import io.vaultconnect.connect.model.Vault;
import io.vaultconnect.connect.service.ConnectService;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The service interface for {@link InMemoryConnect}, to be used only for testing.
 * You can obtain an instance via {@link ServiceLoader} or just use the factory method
 * {@link #newInstance()}.
 * An instance of this class encapsulates the vaults and items, which are shared between
 * the clients created via {@link #buildConnect(Config)}.
 * In that respect the {@link InMemoryConnect} behaves like a client of a Connect server.
 */
public class InMemoryConnectService implements ConnectService<InMemoryConnectService.Config> {

    private final Map<String, Vault> vaults = new ConcurrentHashMap<>();
    private final Map<String, Map<String, FullItem>> items = new ConcurrentHashMap<>();

    public static InMemoryConnectService newInstance() {
        return (InMemoryConnectService) ServiceLoader.load(ConnectService.class).stream()
                .filter(p -> p.type() == InMemoryConnectService.class)
                .findFirst()
                .get()
                .get();
    }

    /**
     * @param clock The source of item and vault timestamps.
     */
    public record Config(Clock clock) {
        public Config {
            Objects.requireNonNull(clock);
        }

        public Config() {
            this(Clock.systemUTC());
        }
    }

    @NonNull
    @Override
    public InMemoryConnect buildConnect(@NonNull Config config) {
        return new InMemoryConnect(vaults, items, config.clock(), new Identifiers());
    }
}
