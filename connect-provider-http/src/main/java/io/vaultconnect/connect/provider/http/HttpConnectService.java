/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.provider.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import io.vaultconnect.connect.service.ConnectException;
import io.vaultconnect.connect.service.ConnectService;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The service interface for {@link HttpConnect}.
 */
public class HttpConnectService implements ConnectService<HttpConnectService.Config> {

    public static final String HOST_ENV = "OP_CONNECT_HOST";
    public static final String TOKEN_ENV = "OP_CONNECT_TOKEN";
    public static final String TIMEOUT_ENV = "OP_CONNECT_TIMEOUT_MS";

    /**
     * The location of, and credentials for, a Connect server.
     * Both the url and the token are checked when the config is constructed, so a client is never built without them.
     * @param serverUrl The absolute http or https url of the server, without a trailing slash.
     * @param token The bearer token sent with every request.
     * @param requestTimeout The time allowed for each request, or null for no limit.
     */
    public record Config(@NonNull String serverUrl, @NonNull String token, Duration requestTimeout) {
        public Config {
            if (serverUrl == null || serverUrl.isBlank()) {
                throw ConnectException.badRequest("Connect server url is required");
            }
            if (token == null || token.isBlank()) {
                throw ConnectException.badRequest("Connect token is required");
            }
            serverUrl = validateUrl(serverUrl.strip());
            if (requestTimeout != null && (requestTimeout.isZero() || requestTimeout.isNegative())) {
                throw ConnectException.badRequest("Request timeout must be positive, but was " + requestTimeout);
            }
        }

        public Config(String serverUrl, String token) {
            this(serverUrl, token, null);
        }

        private static String validateUrl(String serverUrl) {
            URI uri;
            try {
                uri = new URI(serverUrl);
            }
            catch (URISyntaxException e) {
                throw ConnectException.badRequest("Connect server url is not valid: " + e.getMessage());
            }
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                throw ConnectException.badRequest("Connect server url must be an absolute http or https url: " + serverUrl);
            }
            if (uri.getHost() == null) {
                throw ConnectException.badRequest("Connect server url has no host: " + serverUrl);
            }
            var stripped = serverUrl;
            while (stripped.endsWith("/")) {
                stripped = stripped.substring(0, stripped.length() - 1);
            }
            return stripped;
        }

        /**
         * Reads a config from environment variables:
         * {@value #HOST_ENV}, {@value #TOKEN_ENV} and, optionally, {@value #TIMEOUT_ENV}.
         * @param env The environment, typically {@link System#getenv()}.
         * @return The config.
         */
        public static Config fromEnvironment(@NonNull Map<String, String> env) {
            Objects.requireNonNull(env);
            var timeout = env.get(TIMEOUT_ENV);
            return new Config(env.get(HOST_ENV), env.get(TOKEN_ENV), timeout == null ? null : parseMillis(TIMEOUT_ENV, timeout));
        }

        static Duration parseMillis(String name, String millis) {
            try {
                return Duration.ofMillis(Long.parseLong(millis.strip()));
            }
            catch (NumberFormatException e) {
                throw ConnectException.badRequest(name + " must be a number of milliseconds, but was '" + millis + "'");
            }
        }

        @Override
        public String toString() {
            return "Config[serverUrl=" + serverUrl + ", token=***, requestTimeout=" + requestTimeout + "]";
        }
    }

    @NonNull
    @Override
    public HttpConnect buildConnect(@NonNull Config config) {
        Objects.requireNonNull(config);
        return new HttpConnect(config, HttpClient.newHttpClient());
    }
}
