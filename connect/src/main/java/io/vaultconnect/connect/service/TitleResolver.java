/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vaultconnect.connect.model.FullItem;
import io.vaultconnect.connect.model.Item;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Looks up an item by its exact title.
 * <p>The lookup is a server-side search followed by a full fetch of the single match,
 * because search results are summaries without fields or sections.
 * The two calls are not transactional: if the item is deleted in between,
 * the fetch fails with the server's not-found error.</p>
 */
public class TitleResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(TitleResolver.class);

    public static final ErrorResponse NO_ITEMS_FOUND = new ErrorResponse(ConnectException.NOT_FOUND,
            "No Items found with title");
    public static final ErrorResponse MULTIPLE_ITEMS_FOUND = new ErrorResponse(ConnectException.BAD_REQUEST,
            "Found multiple Items with given title. Provide a more specific Item title");

    private final Connect connect;

    public TitleResolver(@NonNull Connect connect) {
        this.connect = Objects.requireNonNull(connect);
    }

    @NonNull
    public CompletionStage<FullItem> resolve(@NonNull String vaultId, @NonNull String title) {
        Objects.requireNonNull(vaultId);
        Objects.requireNonNull(title);
        return connect.listItems(vaultId, ItemFilter.titleEquals(title))
                .thenCompose(matches -> fetchSingle(vaultId, title, matches));
    }

    private CompletionStage<FullItem> fetchSingle(String vaultId, String title, List<Item> matches) {
        // a provider that could not read the search result as a list reports it as empty
        if (matches == null || matches.isEmpty()) {
            return CompletableFuture.failedFuture(new ConnectException(NO_ITEMS_FOUND));
        }
        if (matches.size() > 1) {
            LOGGER.debug("{} items in vault {} have title '{}'", matches.size(), vaultId, title);
            return CompletableFuture.failedFuture(new ConnectException(MULTIPLE_ITEMS_FOUND));
        }
        var match = matches.get(0);
        if (match == null || match.id() == null) {
            LOGGER.debug("Search for title '{}' in vault {} returned a match without an id", title, vaultId);
            return CompletableFuture.failedFuture(new ConnectException(NO_ITEMS_FOUND));
        }
        return connect.getItem(vaultId, match.id());
    }
}
