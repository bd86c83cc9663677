package me.golemcore.router.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.TransportSpec;
import me.golemcore.router.domain.model.TransportType;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.ProviderStorePort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stores the provider catalog as a single JSON document:
 *
 * <pre>
 * { "servers": [ { "id": ..., "connection": { "type": "stdio", ... }, ... } ] }
 * </pre>
 *
 * <p>
 * Writes go to a sibling temp file first and are moved into place, so a crash
 * mid-write never leaves a truncated catalog. Disabled providers are stored
 * with {@code "disabled": true}; the flag is omitted for enabled ones.
 */
@Component
@Slf4j
public class JsonFileProviderStore implements ProviderStorePort {

    private final ObjectMapper objectMapper;
    private final Path storePath;
    private final boolean persist;

    public JsonFileProviderStore(RouterProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getRegistry().getStorePath()), properties.getRegistry().isPersist(), objectMapper);
    }

    public JsonFileProviderStore(Path storePath, boolean persist, ObjectMapper objectMapper) {
        this.storePath = storePath.toAbsolutePath().normalize();
        this.persist = persist;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ProviderDescriptor> loadAll() {
        if (!persist) {
            return List.of();
        }
        if (!Files.exists(storePath)) {
            log.info("[Registry] Catalog file not found at {}, starting empty", storePath);
            return List.of();
        }
        try {
            StoredCatalog catalog = objectMapper.readValue(storePath.toFile(), StoredCatalog.class);
            List<ProviderDescriptor> providers = new ArrayList<>();
            if (catalog.getServers() != null) {
                for (StoredProvider stored : catalog.getServers()) {
                    if (stored.getId() == null || stored.getId().isBlank()) {
                        log.warn("[Registry] Skipping catalog entry without id");
                        continue;
                    }
                    providers.add(toDescriptor(stored));
                }
            }
            log.debug("[Registry] Loaded {} providers from {}", providers.size(), storePath);
            return providers;
        } catch (IOException e) {
            log.warn("[Registry] Could not load catalog from {}: {}", storePath, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void saveAll(List<ProviderDescriptor> providers) {
        if (!persist) {
            return;
        }
        StoredCatalog catalog = new StoredCatalog(providers.stream().map(this::toStored).toList());
        Path tempPath = storePath.resolveSibling(storePath.getFileName() + ".tmp");
        try {
            Path parent = storePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(catalog);
            Files.writeString(tempPath, json, StandardCharsets.UTF_8);
            try {
                Files.move(tempPath, storePath, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Registry] Atomic move not supported, using regular move");
                Files.move(tempPath, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Registry] Saved {} providers to {}", providers.size(), storePath);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Registry] Failed to cleanup temp file: {}", tempPath);
            }
            throw new UncheckedIOException("Failed to save provider catalog to " + storePath, e);
        }
    }

    public Path getStorePath() {
        return storePath;
    }

    private ProviderDescriptor toDescriptor(StoredProvider stored) {
        StoredConnection connection = stored.getConnection() != null ? stored.getConnection() : new StoredConnection();
        TransportType type = "sse".equalsIgnoreCase(connection.getType()) ? TransportType.SSE : TransportType.STDIO;
        TransportSpec transport = TransportSpec.builder()
                .type(type)
                .command(connection.getCommand())
                .args(connection.getArgs() != null ? new ArrayList<>(connection.getArgs()) : new ArrayList<>())
                .url(connection.getUrl())
                .build();

        return ProviderDescriptor.builder()
                .id(stored.getId())
                .name(stored.getName())
                .description(stored.getDescription())
                .path(stored.getPath())
                .transport(transport)
                .tools(stored.getTools() != null ? new ArrayList<>(stored.getTools()) : new ArrayList<>())
                .enabled(!Boolean.TRUE.equals(stored.getDisabled()))
                .config(stored.getConfig() != null ? new HashMap<>(stored.getConfig()) : new HashMap<>())
                .installCommand(stored.getInstallCommand())
                .build();
    }

    private StoredProvider toStored(ProviderDescriptor descriptor) {
        TransportSpec transport = descriptor.getTransport() != null ? descriptor.getTransport() : new TransportSpec();
        StoredConnection connection = new StoredConnection(
                transport.getType() != null ? transport.getType().name().toLowerCase(Locale.ROOT) : "stdio",
                transport.getCommand(),
                transport.getArgs() != null && !transport.getArgs().isEmpty() ? transport.getArgs() : null,
                transport.getUrl());

        return StoredProvider.builder()
                .id(descriptor.getId())
                .name(descriptor.getName())
                .description(descriptor.getDescription())
                .path(descriptor.getPath())
                .connection(connection)
                .tools(descriptor.getTools())
                .disabled(descriptor.isEnabled() ? null : Boolean.TRUE)
                .config(descriptor.getConfig() != null && !descriptor.getConfig().isEmpty()
                        ? descriptor.getConfig()
                        : null)
                .installCommand(descriptor.getInstallCommand())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StoredCatalog {
        private List<StoredProvider> servers = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class StoredProvider {
        private String id;
        private String name;
        private String description;
        private String path;
        private StoredConnection connection;
        private List<ToolDescriptor> tools;
        private Boolean disabled;
        private Map<String, String> config;
        private String installCommand;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class StoredConnection {
        private String type;
        private String command;
        private List<String> args;
        private String url;
    }
}
