/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.provider.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import io.vaultconnect.connect.service.ConnectException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Loads a {@link HttpConnectService.Config} from YAML, such as:
 * <pre>{@code
 * serverUrl: http://localhost:8080
 * token: eyJhbGciOiJFUzI1NiIs...
 * requestTimeoutMs: 5000
 * }</pre>
 * The document is validated against the bundled schema {@value #SCHEMA_RESOURCE} before it is converted.
 */
public class ConnectConfigLoader {

    static final String SCHEMA_RESOURCE = "/schema/http-connect-config.yaml";

    private static final YAMLMapper MAPPER = new YAMLMapper();

    // Invariant: This is a valid draft 4 schema
    private final JsonSchema schema;

    public ConnectConfigLoader() {
        try (InputStream in = Objects.requireNonNull(ConnectConfigLoader.class.getResourceAsStream(SCHEMA_RESOURCE),
                "Missing resource " + SCHEMA_RESOURCE)) {
            JsonSchemaFactory jsonSchemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V4);
            this.schema = jsonSchemaFactory.getSchema(MAPPER.readTree(in));
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Validate and convert the given YAML document.
     * @param yaml The document.
     * @return The config.
     * @throws ConnectException If the document is not valid YAML, does not conform to the schema,
     * or holds values the config rejects.
     */
    @NonNull
    public HttpConnectService.Config load(@NonNull String yaml) {
        Objects.requireNonNull(yaml);
        JsonNode configInstance;
        try {
            configInstance = MAPPER.readTree(yaml);
        }
        catch (JsonProcessingException e) {
            throw ConnectException.badRequest("Config is not valid YAML: " + e.getOriginalMessage());
        }
        return toConfig(configInstance);
    }

    @NonNull
    public HttpConnectService.Config load(@NonNull InputStream yaml) throws IOException {
        Objects.requireNonNull(yaml);
        return toConfig(MAPPER.readTree(yaml));
    }

    private HttpConnectService.Config toConfig(JsonNode configInstance) {
        if (configInstance == null || configInstance.isMissingNode()) {
            throw ConnectException.badRequest("Config is empty");
        }
        Set<ValidationMessage> assertions = schema.validate(configInstance, executionContext -> {
            // By default since Draft 2019-09 the format keyword only generates annotations and not assertions
            executionContext.getExecutionConfig().setFormatAssertionsEnabled(true);
        });
        if (!assertions.isEmpty()) {
            throw ConnectException.badRequest("Invalid config: " + assertions.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", ", "[", "]")));
        }
        var timeout = configInstance.get("requestTimeoutMs");
        return new HttpConnectService.Config(
                configInstance.get("serverUrl").textValue(),
                configInstance.get("token").textValue(),
                timeout == null ? null : Duration.ofMillis(timeout.longValue()));
    }
}
