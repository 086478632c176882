/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.provider.inmemory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vaultconnect.connect.model.Field;
import io.vaultconnect.connect.model.FullItem;
import io.vaultconnect.connect.model.Item;
import io.vaultconnect.connect.model.Vault;
import io.vaultconnect.connect.model.VaultRef;
import io.vaultconnect.connect.model.VaultType;
import io.vaultconnect.connect.service.Connect;
import io.vaultconnect.connect.service.ConnectException;
import io.vaultconnect.connect.service.ItemFilter;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A {@link Connect} that keeps vaults and items in memory, to be used only for testing.
 * It behaves like a client of a Connect server: ids, versions and timestamps are assigned
 * on write, reads of missing vaults and items fail with a 404, and every stage is
 * already complete when it is returned.
 * @see InMemoryConnectService
 */
public class InMemoryConnect implements Connect {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryConnect.class);

    static final String VAULT_NOT_FOUND = "Vault not found";
    static final String ITEM_NOT_FOUND = "Item not found";

    private final Map<String, Vault> vaults;
    private final Map<String, Map<String, FullItem>> items;
    private final Clock clock;
    private final Supplier<String> ids;

    InMemoryConnect(Map<String, Vault> vaults,
                    Map<String, Map<String, FullItem>> items,
                    Clock clock,
                    Supplier<String> ids) {
        this.vaults = Objects.requireNonNull(vaults);
        this.items = Objects.requireNonNull(items);
        this.clock = Objects.requireNonNull(clock);
        this.ids = Objects.requireNonNull(ids);
    }

    /**
     * Creates an empty vault.
     * @param name The vault's name.
     * @return The vault.
     */
    @NonNull
    public Vault createVault(@NonNull String name) {
        Objects.requireNonNull(name);
        var now = clock.instant();
        var vault = new Vault(ids.get(), name, null, 1, 1, 0, VaultType.USER_CREATED, now, now);
        items.put(vault.id(), Collections.synchronizedMap(new LinkedHashMap<>()));
        vaults.put(vault.id(), vault);
        LOGGER.debug("Created vault {} ({})", vault.id(), name);
        return vault;
    }

    @NonNull
    @Override
    public CompletionStage<List<Vault>> listVaults() {
        var result = new ArrayList<Vault>();
        for (Vault vault : vaults.values()) {
            result.add(withItemCount(vault));
        }
        return CompletableFuture.completedFuture(List.copyOf(result));
    }

    @NonNull
    @Override
    public CompletionStage<Vault> getVault(@NonNull String vaultId) {
        Objects.requireNonNull(vaultId);
        try {
            return CompletableFuture.completedFuture(withItemCount(lookupVault(vaultId)));
        }
        catch (ConnectException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @NonNull
    @Override
    public CompletionStage<List<Item>> listItems(@NonNull String vaultId) {
        Objects.requireNonNull(vaultId);
        return summaries(vaultId, item -> true);
    }

    @NonNull
    @Override
    public CompletionStage<List<Item>> listItems(@NonNull String vaultId, @NonNull ItemFilter filter) {
        Objects.requireNonNull(vaultId);
        Objects.requireNonNull(filter);
        return summaries(vaultId, filter);
    }

    private CompletionStage<List<Item>> summaries(String vaultId, Predicate<Item> filter) {
        try {
            var vaultItems = lookupItems(vaultId);
            List<Item> result = new ArrayList<>();
            synchronized (vaultItems) {
                for (FullItem item : vaultItems.values()) {
                    var summary = item.summary();
                    if (filter.test(summary)) {
                        result.add(summary);
                    }
                }
            }
            return CompletableFuture.completedFuture(List.copyOf(result));
        }
        catch (ConnectException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @NonNull
    @Override
    public CompletionStage<FullItem> getItem(@NonNull String vaultId, @NonNull String itemId) {
        Objects.requireNonNull(vaultId);
        Objects.requireNonNull(itemId);
        try {
            return CompletableFuture.completedFuture(lookupItem(vaultId, itemId));
        }
        catch (ConnectException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @NonNull
    @Override
    public CompletionStage<FullItem> createItem(@NonNull String vaultId, @NonNull Item item) {
        Objects.requireNonNull(vaultId);
        Objects.requireNonNull(item);
        try {
            if (item.id() != null) {
                throw ConnectException.badRequest("Item already has an id; use updateItem to change it");
            }
            var vaultItems = lookupItems(vaultId);
            var now = clock.instant();
            var created = new FullItem(ids.get(), item.title(), new VaultRef(vaultId), item.category(), item.urls(), item.favorite(),
                    item.tags(), item.sections(), assignFieldIds(item.fields()), 1, false, now, now, null);
            vaultItems.put(created.id(), created);
            LOGGER.debug("Created item {} in vault {}", created.id(), vaultId);
            return CompletableFuture.completedFuture(created);
        }
        catch (ConnectException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @NonNull
    @Override
    public CompletionStage<FullItem> updateItem(@NonNull String vaultId, @NonNull FullItem item) {
        Objects.requireNonNull(vaultId);
        Objects.requireNonNull(item);
        try {
            var vaultItems = lookupItems(vaultId);
            FullItem updated;
            synchronized (vaultItems) {
                var existing = vaultItems.get(item.id());
                if (existing == null) {
                    throw ConnectException.notFound(ITEM_NOT_FOUND);
                }
                updated = new FullItem(existing.id(), item.title(), new VaultRef(vaultId), item.category(), item.urls(), item.favorite(),
                        item.tags(), item.sections(), assignFieldIds(item.fields()), existing.version() + 1, item.trashed(),
                        existing.createdAt(), clock.instant(), null);
                vaultItems.put(updated.id(), updated);
            }
            return CompletableFuture.completedFuture(updated);
        }
        catch (ConnectException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @NonNull
    @Override
    public CompletionStage<Void> deleteItem(@NonNull String vaultId, @NonNull String itemId) {
        Objects.requireNonNull(vaultId);
        Objects.requireNonNull(itemId);
        try {
            if (lookupItems(vaultId).remove(itemId) == null) {
                throw ConnectException.notFound(ITEM_NOT_FOUND);
            }
            LOGGER.debug("Deleted item {} from vault {}", itemId, vaultId);
            return CompletableFuture.completedFuture(null);
        }
        catch (ConnectException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<Field> assignFieldIds(List<Field> fields) {
        var result = new ArrayList<Field>(fields.size());
        for (Field field : fields) {
            result.add(field.id() == null ? field.withId(ids.get()) : field);
        }
        return result;
    }

    private Vault lookupVault(String vaultId) {
        var vault = vaults.get(vaultId);
        if (vault == null) {
            throw ConnectException.notFound(VAULT_NOT_FOUND);
        }
        return vault;
    }

    private Map<String, FullItem> lookupItems(String vaultId) {
        lookupVault(vaultId);
        return items.get(vaultId);
    }

    private FullItem lookupItem(String vaultId, String itemId) {
        var item = lookupItems(vaultId).get(itemId);
        if (item == null) {
            throw ConnectException.notFound(ITEM_NOT_FOUND);
        }
        return item;
    }

    private Vault withItemCount(Vault vault) {
        var vaultItems = items.get(vault.id());
        return vault.withItems(vaultItems == null ? 0 : vaultItems.size());
    }
}
