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

import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.RegistryOutcome;
import me.golemcore.router.domain.model.ToolDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Executes provider management decisions against the registry and renders
 * their deterministic replies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderManagementService {

    private static final String NO_PROVIDERS = "No servers are currently registered.";

    private final ProviderRegistry registry;

    /**
     * Handles every management decision kind. Returns empty for decisions that
     * are not management operations.
     */
    public Optional<String> handle(Decision decision) {
        if (decision instanceof Decision.ListProviders) {
            return Optional.of(listProviders());
        }
        if (decision instanceof Decision.ProviderStatus) {
            return Optional.of(providerStatus());
        }
        if (decision instanceof Decision.SetProviderEnabled setEnabled) {
            return Optional.of(setEnabled(setEnabled.providerId(), setEnabled.enabled()));
        }
        if (decision instanceof Decision.RemoveProvider remove) {
            return Optional.of(remove(remove.providerId(), remove.deleteFiles()));
        }
        if (decision instanceof Decision.InstallProviderDependencies install) {
            return Optional.of(install(install.providerId()));
        }
        return Optional.empty();
    }

    public String listProviders() {
        List<ProviderDescriptor> providers = registry.list();
        if (providers.isEmpty()) {
            return NO_PROVIDERS;
        }

        StringBuilder sb = new StringBuilder("Available servers:\n\n");
        for (ProviderDescriptor provider : providers) {
            sb.append(provider.displayName()).append(" (ID: ").append(provider.getId()).append(") - ")
                    .append(provider.isEnabled() ? "🟢 Active" : "🔴 Disabled").append('\n');
            sb.append("Description: ").append(provider.getDescription() != null ? provider.getDescription() : "")
                    .append('\n');
            sb.append("Tools:\n");
            if (provider.getTools().isEmpty()) {
                sb.append("- (discovered on first use)\n");
            }
            for (ToolDescriptor tool : provider.getTools()) {
                sb.append("- ").append(tool.getName()).append(": ")
                        .append(tool.getDescription() != null ? tool.getDescription() : "").append('\n');
            }
            sb.append('\n');
        }

        sb.append("You can manage servers with these commands:\n");
        sb.append("- 'activate server <id>' - Enable a disabled server\n");
        sb.append("- 'deactivate server <id>' - Temporarily disable a server\n");
        sb.append("- 'remove server <id>' - Remove a server (add 'and delete files' to delete its folder)\n");
        sb.append("- 'install server <id>' - Install a server's dependencies\n");
        sb.append("- 'server status' - Check which servers are active\n");
        return sb.toString();
    }

    public String providerStatus() {
        List<ProviderDescriptor> providers = registry.list();
        if (providers.isEmpty()) {
            return NO_PROVIDERS;
        }
        List<ProviderDescriptor> active = providers.stream().filter(ProviderDescriptor::isEnabled).toList();
        List<ProviderDescriptor> disabled = providers.stream().filter(p -> !p.isEnabled()).toList();

        StringBuilder sb = new StringBuilder("Server Status:\n\n");
        sb.append("Active Servers (").append(active.size()).append("):\n");
        active.forEach(p -> appendEntry(sb, p));
        sb.append("\nDisabled Servers (").append(disabled.size()).append("):\n");
        disabled.forEach(p -> appendEntry(sb, p));
        return sb.toString();
    }

    public String setEnabled(String providerId, boolean enabled) {
        Optional<ProviderDescriptor> provider = registry.get(providerId);
        if (provider.isEmpty()) {
            return notFound(providerId);
        }
        String name = provider.get().displayName();
        if (provider.get().isEnabled() == enabled) {
            return enabled ? "Server \"" + name + "\" is already active."
                    : "Server \"" + name + "\" is already disabled.";
        }
        if (registry.setEnabled(providerId, enabled) == RegistryOutcome.NOT_FOUND) {
            return notFound(providerId);
        }
        return enabled ? "Server \"" + name + "\" has been activated and is now available for use."
                : "Server \"" + name + "\" has been deactivated and will not be used for query routing.";
    }

    public String remove(String providerId, boolean deleteFiles) {
        Optional<ProviderDescriptor> provider = registry.get(providerId);
        if (provider.isEmpty() || registry.remove(providerId, deleteFiles) == RegistryOutcome.NOT_FOUND) {
            return notFound(providerId);
        }
        String name = provider.get().displayName();
        if (deleteFiles && provider.get().getPath() != null) {
            return "Server \"" + name + "\" has been removed and its files were deleted.";
        }
        return "Server \"" + name + "\" has been removed.";
    }

    public String install(String providerId) {
        Optional<ProviderDescriptor> provider = registry.get(providerId);
        if (provider.isEmpty()) {
            return notFound(providerId);
        }
        String name = provider.get().displayName();
        return switch (registry.installDependencies(providerId)) {
        case OK -> "Dependencies for server \"" + name + "\" have been installed.";
        case NOT_FOUND -> notFound(providerId);
        case FAILED -> "Installing dependencies for server \"" + name
                + "\" failed. Check that it has a source folder and that the install command works there.";
        };
    }

    private static void appendEntry(StringBuilder sb, ProviderDescriptor provider) {
        sb.append("- ").append(provider.displayName()).append(" (ID: ").append(provider.getId()).append(")\n");
    }

    private static String notFound(String providerId) {
        return "Server with ID \"" + providerId + "\" not found. Use 'list servers' to see available servers.";
    }
}
