package me.golemcore.router.domain.service;

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
import me.golemcore.router.domain.model.RegistryOutcome;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.TransportSpec;
import me.golemcore.router.domain.model.TransportType;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.ProviderStorePort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Mutable catalog of tool-providers and their lifecycle (enable, disable,
 * remove, install).
 *
 * <p>
 * One instance is shared by every conversation. Every mutation, install
 * included, holds the mutation lock, so a provider cannot be removed while its
 * install step runs. Catalog changes additionally take the write lock and are
 * persisted through {@link ProviderStorePort} before it is released; reads
 * take only the read lock and return copies, so listing is not blocked by a
 * long install. Insertion order is preserved for listing.
 *
 * <p>
 * Only enabled providers are offered to the query router; disabled ones stay
 * visible to management operations.
 */
@Service
@Slf4j
public class ProviderRegistry {

    private final ProviderStorePort store;
    private final RouterProperties properties;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final Map<String, ProviderDescriptor> providers = new LinkedHashMap<>();

    public ProviderRegistry(ProviderStorePort store, RouterProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    /**
     * Load the persisted catalog, then register configured default providers
     * that the store does not already know.
     */
    @PostConstruct
    public void init() {
        List<ProviderDescriptor> persisted = store.loadAll();
        lock.writeLock().lock();
        try {
            for (ProviderDescriptor descriptor : persisted) {
                providers.put(descriptor.getId(), normalize(descriptor));
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Registry] Loaded {} providers from store", persisted.size());

        RouterProperties.ProvidersProperties defaults = properties.getProviders();
        if (!defaults.isDefaultsEnabled()) {
            return;
        }
        for (RouterProperties.DefaultProviderProperties entry : defaults.getDefaults()) {
            if (entry.getId() == null || entry.getId().isBlank() || get(entry.getId()).isPresent()) {
                continue;
            }
            upsert(fromDefaults(entry));
        }
    }

    /**
     * Insert or replace by id.
     */
    public void upsert(ProviderDescriptor descriptor) {
        if (descriptor == null || descriptor.getId() == null || descriptor.getId().isBlank()) {
            throw new IllegalArgumentException("Provider descriptor must have an id");
        }
        mutationLock.lock();
        lock.writeLock().lock();
        try {
            boolean replaced = providers.put(descriptor.getId(), normalize(descriptor)) != null;
            persist();
            log.info("[Registry] {} provider: {}", replaced ? "Replaced" : "Added", descriptor.getId());
        } finally {
            lock.writeLock().unlock();
            mutationLock.unlock();
        }
    }

    public Optional<ProviderDescriptor> get(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(providerId)).map(this::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All providers, including disabled ones, in registration order.
     */
    public List<ProviderDescriptor> list() {
        lock.readLock().lock();
        try {
            return providers.values().stream().map(this::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ProviderDescriptor> listEnabled() {
        return list().stream().filter(ProviderDescriptor::isEnabled).toList();
    }

    public RegistryOutcome setEnabled(String providerId, boolean enabled) {
        mutationLock.lock();
        lock.writeLock().lock();
        try {
            ProviderDescriptor existing = providers.get(providerId);
            if (existing == null) {
                return RegistryOutcome.NOT_FOUND;
            }
            existing.setEnabled(enabled);
            persist();
            log.info("[Registry] Provider {} {}", providerId, enabled ? "enabled" : "disabled");
            return RegistryOutcome.OK;
        } finally {
            lock.writeLock().unlock();
            mutationLock.unlock();
        }
    }

    /**
     * Remove a provider. With {@code deleteFiles}, the directory containing the
     * provider's {@code path} is deleted recursively; a failed delete is logged
     * and does not keep the entry in the catalog.
     */
    public RegistryOutcome remove(String providerId, boolean deleteFiles) {
        mutationLock.lock();
        lock.writeLock().lock();
        try {
            ProviderDescriptor existing = providers.get(providerId);
            if (existing == null) {
                return RegistryOutcome.NOT_FOUND;
            }
            if (deleteFiles && existing.getPath() != null && !existing.getPath().isBlank()) {
                deleteProviderHome(existing);
            }
            providers.remove(providerId);
            persist();
            log.info("[Registry] Removed provider: {}", providerId);
            return RegistryOutcome.OK;
        } finally {
            lock.writeLock().unlock();
            mutationLock.unlock();
        }
    }

    /**
     * Run the provider's install step ({@code npm install} unless the
     * descriptor overrides it) in the provider's home directory. A missing
     * path or directory, a non-zero exit or a timeout are reported as
     * {@link RegistryOutcome#FAILED}.
     */
    public RegistryOutcome installDependencies(String providerId) {
        // held for the whole run; the catalog lock is not, so reads go on
        mutationLock.lock();
        try {
            Optional<ProviderDescriptor> found = get(providerId);
            if (found.isEmpty()) {
                return RegistryOutcome.NOT_FOUND;
            }
            ProviderDescriptor existing = found.get();
            Optional<Path> home = homeDirectory(existing);
            if (home.isEmpty() || !Files.isDirectory(home.get())) {
                log.warn("[Registry] Provider {} has no install directory", providerId);
                return RegistryOutcome.FAILED;
            }
            String command = existing.getInstallCommand() != null && !existing.getInstallCommand().isBlank()
                    ? existing.getInstallCommand()
                    : properties.getRegistry().getInstallCommand();
            return runInstall(providerId, command, home.get());
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Replace the provider's tool list with live-introspected tools. Ignored if
     * the provider was removed in the meantime.
     */
    public void updateTools(String providerId, List<ToolDescriptor> tools) {
        mutationLock.lock();
        lock.writeLock().lock();
        try {
            ProviderDescriptor existing = providers.get(providerId);
            if (existing == null) {
                return;
            }
            existing.setTools(dedupeTools(tools));
            persist();
            log.debug("[Registry] Refreshed {} tools for provider {}", existing.getTools().size(), providerId);
        } finally {
            lock.writeLock().unlock();
            mutationLock.unlock();
        }
    }

    private RegistryOutcome runInstall(String providerId, String command, Path directory) {
        int timeoutSeconds = properties.getRegistry().getInstallTimeoutSeconds();
        log.info("[Registry] Installing dependencies for {}: {} (in {})", providerId, command, directory);
        try {
            ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
            pb.directory(directory.toFile());
            pb.redirectErrorStream(true);
            Process process = pb.start();

            StringBuilder output = new StringBuilder();
            Thread drain = new Thread(() -> drainOutput(process, output), "install-output-" + providerId);
            drain.setDaemon(true);
            drain.start();

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                process.destroyForcibly();
                log.warn("[Registry] Install for {} timed out after {}s", providerId, timeoutSeconds);
                return RegistryOutcome.FAILED;
            }
            drain.join(1000);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.warn("[Registry] Install for {} failed with exit code {}: {}", providerId, exitCode,
                        output.toString().trim());
                return RegistryOutcome.FAILED;
            }
            log.info("[Registry] Installed dependencies for {}", providerId);
            return RegistryOutcome.OK;
        } catch (IOException e) {
            log.warn("[Registry] Install for {} could not start: {}", providerId, e.getMessage());
            return RegistryOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Registry] Install for {} interrupted", providerId);
            return RegistryOutcome.FAILED;
        }
    }

    private void drainOutput(Process process, StringBuilder output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[Registry] install: {}", line);
                synchronized (output) {
                    output.append(line).append('\n');
                }
            }
        } catch (IOException e) {
            log.debug("[Registry] Install output drain ended: {}", e.getMessage());
        }
    }

    private void deleteProviderHome(ProviderDescriptor provider) {
        Optional<Path> home = homeDirectory(provider);
        if (home.isEmpty() || !Files.exists(home.get())) {
            return;
        }
        Path directory = home.get();
        if (isProtectedDirectory(directory)) {
            log.warn("[Registry] Refusing to delete {} for provider {}: it holds the working directory",
                    directory, provider.getId());
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
            log.info("[Registry] Deleted provider files: {}", directory);
        } catch (IOException e) {
            log.warn("[Registry] Failed to delete provider files at {}: {}", directory, e.getMessage());
        }
    }

    /**
     * The working directory, the filesystem root and anything between them are
     * never deleted as a provider home.
     */
    static boolean isProtectedDirectory(Path directory) {
        Path target = directory.toAbsolutePath().normalize();
        Path workingDirectory = Paths.get("").toAbsolutePath().normalize();
        return target.getParent() == null || workingDirectory.startsWith(target);
    }

    private Optional<Path> homeDirectory(ProviderDescriptor provider) {
        if (provider.getPath() == null || provider.getPath().isBlank()) {
            return Optional.empty();
        }
        Path parent = Paths.get(provider.getPath()).toAbsolutePath().normalize().getParent();
        return Optional.ofNullable(parent);
    }

    private void persist() {
        try {
            store.saveAll(new ArrayList<>(providers.values()));
        } catch (RuntimeException e) {
            log.error("[Registry] Failed to persist catalog: {}", e.getMessage());
        }
    }

    private ProviderDescriptor normalize(ProviderDescriptor descriptor) {
        ProviderDescriptor copy = copy(descriptor);
        copy.setTools(dedupeTools(copy.getTools()));
        return copy;
    }

    private List<ToolDescriptor> dedupeTools(List<ToolDescriptor> tools) {
        if (tools == null) {
            return new ArrayList<>();
        }
        Set<String> seen = new HashSet<>();
        List<ToolDescriptor> unique = new ArrayList<>();
        for (ToolDescriptor tool : tools) {
            if (tool == null || tool.getName() == null) {
                continue;
            }
            if (seen.add(tool.getName())) {
                unique.add(tool);
            } else {
                log.warn("[Registry] Duplicate tool '{}' ignored", tool.getName());
            }
        }
        return unique;
    }

    private ProviderDescriptor copy(ProviderDescriptor source) {
        TransportSpec transport = source.getTransport() != null
                ? source.getTransport().toBuilder()
                        .args(source.getTransport().getArgs() != null
                                ? new ArrayList<>(source.getTransport().getArgs())
                                : new ArrayList<>())
                        .build()
                : new TransportSpec();
        return source.toBuilder()
                .transport(transport)
                .tools(source.getTools() != null ? new ArrayList<>(source.getTools()) : new ArrayList<>())
                .config(source.getConfig() != null ? new HashMap<>(source.getConfig()) : new HashMap<>())
                .build();
    }

    private ProviderDescriptor fromDefaults(RouterProperties.DefaultProviderProperties entry) {
        TransportSpec transport = entry.getUrl() != null && !entry.getUrl().isBlank()
                ? TransportSpec.sse(entry.getUrl())
                : TransportSpec.stdio(entry.getCommand(), entry.getArgs());
        if (transport.getType() == TransportType.STDIO && transport.getCommand() == null) {
            log.warn("[Registry] Default provider {} declares no command, 'node' will be used", entry.getId());
        }
        return ProviderDescriptor.builder()
                .id(entry.getId())
                .name(entry.getName() != null ? entry.getName() : entry.getId())
                .description(entry.getDescription() != null ? entry.getDescription() : "")
                .transport(transport)
                .path(entry.getPath())
                .config(entry.getConfig() != null ? new HashMap<>(entry.getConfig()) : new HashMap<>())
                .build();
    }
}
