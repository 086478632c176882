/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.provider.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import io.vaultconnect.connect.model.FullItem;
import io.vaultconnect.connect.model.Item;
import io.vaultconnect.connect.model.Vault;
import io.vaultconnect.connect.model.VaultRef;
import io.vaultconnect.connect.service.Connect;
import io.vaultconnect.connect.service.ConnectException;
import io.vaultconnect.connect.service.ItemFilter;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A {@link Connect} talking JSON over HTTP to a Connect server.
 * <p>Each operation sends one request. Non-2xx responses and transport failures complete the
 * returned stage exceptionally with a {@link ConnectException} built by {@link ErrorNormalizer}.
 * Nothing is retried.</p>
 * @see HttpConnectService
 */
public class HttpConnect implements Connect {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpConnect.class);

    static final String USER_AGENT = "vault-connect-java/" + version();
    private static final String APPLICATION_JSON = "application/json";

    @FunctionalInterface
    private interface BodyReader<T> {
        T read(String body) throws IOException;
    }

    private final String serverUrl;
    private final String token;
    private final Duration requestTimeout;
    private final HttpClient client;

    HttpConnect(@NonNull HttpConnectService.Config config, @NonNull HttpClient client) {
        Objects.requireNonNull(config);
        this.serverUrl = config.serverUrl();
        this.token = config.token();
        this.requestTimeout = config.requestTimeout();
        this.client = Objects.requireNonNull(client);
    }

    private static String version() {
        var version = HttpConnect.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    @NonNull
    @Override
    public CompletionStage<List<Vault>> listVaults() {
        return send(request("/v1/vaults/").GET(),
                body -> ConnectJson.MAPPER.readValue(body, ConnectJson.VAULT_LIST));
    }

    @NonNull
    @Override
    public CompletionStage<Vault> getVault(@NonNull String vaultId) {
        return send(request(vaultPath(vaultId)).GET(),
                body -> ConnectJson.MAPPER.readValue(body, Vault.class));
    }

    @NonNull
    @Override
    public CompletionStage<List<Item>> listItems(@NonNull String vaultId) {
        return send(request(vaultPath(vaultId) + "/items").GET(),
                body -> ConnectJson.MAPPER.readValue(body, ConnectJson.ITEM_LIST));
    }

    @NonNull
    @Override
    public CompletionStage<List<Item>> listItems(@NonNull String vaultId, @NonNull ItemFilter filter) {
        Objects.requireNonNull(filter);
        var path = vaultPath(vaultId) + "/items/?filter=" + encode(filter.expression());
        return send(request(path).GET(), body -> readSearchResults(filter, body));
    }

    private static List<Item> readSearchResults(ItemFilter filter, String body) throws IOException {
        JsonNode tree;
        try {
            tree = ConnectJson.MAPPER.readTree(body);
        }
        catch (JsonProcessingException e) {
            LOGGER.warn("Search for items with {} returned a body that is not JSON; treating it as no matches: {}", filter,
                    e.getOriginalMessage());
            return List.of();
        }
        if (tree == null || !tree.isArray()) {
            LOGGER.warn("Search for items with {} returned {} rather than an array; treating it as no matches", filter,
                    tree == null ? "nothing" : tree.getNodeType());
            return List.of();
        }
        return ConnectJson.MAPPER.readerFor(ConnectJson.ITEM_LIST).readValue(tree);
    }

    @NonNull
    @Override
    public CompletionStage<FullItem> getItem(@NonNull String vaultId, @NonNull String itemId) {
        return send(request(itemPath(vaultId, itemId)).GET(),
                body -> ConnectJson.MAPPER.readValue(body, FullItem.class));
    }

    @NonNull
    @Override
    public CompletionStage<FullItem> createItem(@NonNull String vaultId, @NonNull Item item) {
        var path = vaultPath(vaultId) + "/items/";
        Objects.requireNonNull(item);
        if (item.id() != null) {
            return CompletableFuture.failedFuture(
                    ConnectException.badRequest("Item already has an id; use updateItem to change it"));
        }
        return sendJson(path, "POST", item.withVault(new VaultRef(vaultId)));
    }

    @NonNull
    @Override
    public CompletionStage<FullItem> updateItem(@NonNull String vaultId, @NonNull FullItem item) {
        Objects.requireNonNull(item);
        var path = itemPath(vaultId, item.id());
        return sendJson(path, "PUT", item.withVault(new VaultRef(vaultId)));
    }

    @NonNull
    @Override
    public CompletionStage<Void> deleteItem(@NonNull String vaultId, @NonNull String itemId) {
        return send(request(itemPath(vaultId, itemId)).DELETE(), body -> null);
    }

    private CompletionStage<FullItem> sendJson(String path, String method, Object item) {
        String json;
        try {
            json = ConnectJson.MAPPER.writeValueAsString(item);
        }
        catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(ErrorNormalizer.toException(e));
        }
        var builder = request(path)
                .header("Content-Type", APPLICATION_JSON)
                .method(method, HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        return send(builder, body -> ConnectJson.MAPPER.readValue(body, FullItem.class));
    }

    private <T> CompletionStage<T> send(HttpRequest.Builder builder, BodyReader<T> reader) {
        var request = builder.build();
        LOGGER.debug("{} {}", request.method(), request.uri().getRawPath());
        CompletableFuture<HttpResponse<String>> response;
        try {
            response = client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(ErrorNormalizer.toException(e));
        }
        return response.handle((httpResponse, failure) -> {
            if (failure != null) {
                var exception = ErrorNormalizer.toException(failure);
                LOGGER.debug("{} {} failed: {}", request.method(), request.uri().getRawPath(), exception.getMessage());
                throw exception;
            }
            int statusCode = httpResponse.statusCode();
            if (statusCode < 200 || statusCode > 299) {
                var errorResponse = ErrorNormalizer.fromResponse(statusCode, httpResponse.body());
                LOGGER.debug("{} {} returned {}: {}", request.method(), request.uri().getRawPath(), statusCode,
                        errorResponse.message());
                throw new ConnectException(errorResponse);
            }
            try {
                return reader.read(httpResponse.body());
            }
            catch (IOException e) {
                throw ErrorNormalizer.toException(e);
            }
        });
    }

    private HttpRequest.Builder request(String path) {
        var builder = HttpRequest.newBuilder(URI.create(serverUrl + path))
                .header("Authorization", "Bearer " + token)
                .header("Accept", APPLICATION_JSON)
                .header("User-Agent", USER_AGENT);
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        return builder;
    }

    private static String vaultPath(String vaultId) {
        return "/v1/vaults/" + encode(Objects.requireNonNull(vaultId));
    }

    private static String itemPath(String vaultId, String itemId) {
        return vaultPath(vaultId) + "/items/" + encode(Objects.requireNonNull(itemId));
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
