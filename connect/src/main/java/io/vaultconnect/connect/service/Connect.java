/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.service;

import java.util.List;
import java.util.concurrent.CompletionStage;

import io.vaultconnect.connect.model.FullItem;
import io.vaultconnect.connect.model.Item;
import io.vaultconnect.connect.model.Vault;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Abstracts the vault and item operations of a Connect server.
 * <p>Every operation makes at most one attempt. A failed operation completes its stage exceptionally
 * with a {@link ConnectException}, whose {@link ConnectException#errorResponse() error response}
 * carries the status and message. Null identifiers are programming errors and are rejected with
 * a {@link NullPointerException} before anything is sent.</p>
 */
public interface Connect {

    /**
     * Asynchronously lists the vaults the caller's token has access to.
     * @return A completion stage for the vaults.
     */
    @NonNull
    CompletionStage<List<Vault>> listVaults();

    /**
     * Asynchronously gets the vault with the given id.
     * @param vaultId The vault id.
     * @return A completion stage for the vault.
     */
    @NonNull
    CompletionStage<Vault> getVault(@NonNull String vaultId);

    /**
     * Asynchronously lists summaries of the items in a vault.
     * Summaries do not include fields or sections.
     * @param vaultId The vault id.
     * @return A completion stage for the item summaries.
     */
    @NonNull
    CompletionStage<List<Item>> listItems(@NonNull String vaultId);

    /**
     * Asynchronously searches a vault for items matching the given filter.
     * The filter is evaluated by the server.
     * A search response that is not a list of items yields an empty list.
     * @param vaultId The vault id.
     * @param filter The filter.
     * @return A completion stage for the matching item summaries.
     */
    @NonNull
    CompletionStage<List<Item>> listItems(@NonNull String vaultId, @NonNull ItemFilter filter);

    /**
     * Asynchronously gets an item, with all its fields and sections.
     * @param vaultId The vault id.
     * @param itemId The item id.
     * @return A completion stage for the item.
     */
    @NonNull
    CompletionStage<FullItem> getItem(@NonNull String vaultId, @NonNull String itemId);

    /**
     * Asynchronously gets the single item in a vault with exactly the given title.
     * @param vaultId The vault id.
     * @param title The title.
     * @return A completion stage for the item. The stage fails with a 404 if no item has the title,
     * and with a 400 if more than one does.
     * @see TitleResolver
     */
    @NonNull
    default CompletionStage<FullItem> getItemByTitle(@NonNull String vaultId, @NonNull String title) {
        return new TitleResolver(this).resolve(vaultId, title);
    }

    /**
     * Asynchronously creates an item in a vault.
     * The given {@code vaultId} is authoritative: it replaces any vault reference embedded in the item.
     * @param vaultId The vault id.
     * @param item The item, which must not yet have an id.
     * @return A completion stage for the item as persisted by the server.
     */
    @NonNull
    CompletionStage<FullItem> createItem(@NonNull String vaultId, @NonNull Item item);

    /**
     * Asynchronously replaces an item.
     * The item must hold the complete desired state: fields, sections, urls and tags
     * that are absent from it are removed.
     * @param vaultId The vault id.
     * @param item The item.
     * @return A completion stage for the item as persisted by the server.
     */
    @NonNull
    CompletionStage<FullItem> updateItem(@NonNull String vaultId, @NonNull FullItem item);

    /**
     * Asynchronously deletes an item.
     * Deleting an item that has already been deleted fails with the server's not-found error.
     * @param vaultId The vault id.
     * @param itemId The item id.
     * @return A completion stage that completes when the server has confirmed the deletion.
     */
    @NonNull
    CompletionStage<Void> deleteItem(@NonNull String vaultId, @NonNull String itemId);
}
