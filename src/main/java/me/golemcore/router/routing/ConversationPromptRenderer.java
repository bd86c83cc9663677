package me.golemcore.router.routing;

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

import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolParameter;
import me.golemcore.router.domain.model.Turn;
import me.golemcore.router.infrastructure.config.RouterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders conversation history and the provider catalog into prompt text.
 */
@Component
@RequiredArgsConstructor
public class ConversationPromptRenderer {

    private final RouterProperties properties;

    /**
     * The most recent turns, oldest first, role-prefixed. System turns are
     * left out. Empty string when there is no history.
     */
    public String renderHistory(ConversationMemory memory) {
        if (memory == null) {
            return "";
        }
        List<Turn> turns = memory.recent().stream()
                .filter(turn -> !turn.isSystem())
                .toList();
        int limit = properties.getMemory().getPromptHistoryTurns();
        if (limit > 0 && turns.size() > limit) {
            turns = turns.subList(turns.size() - limit, turns.size());
        }
        if (turns.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder("Conversation History:\n");
        for (Turn turn : turns) {
            sb.append(turn.role().label()).append(": ").append(turn.text()).append('\n');
        }
        return sb.append('\n').toString();
    }

    public String renderCatalog(List<ProviderDescriptor> providers) {
        if (providers == null || providers.isEmpty()) {
            return "(no tool providers are available)\n";
        }
        StringBuilder sb = new StringBuilder();
        for (ProviderDescriptor provider : providers) {
            sb.append("Server: ").append(provider.displayName())
                    .append(" (ID: ").append(provider.getId()).append(")\n");
            sb.append("Description: ").append(nullToEmpty(provider.getDescription())).append('\n');
            sb.append("Available tools:\n");
            if (provider.getTools().isEmpty()) {
                sb.append("- (tools are discovered when the provider is first called)\n");
            }
            for (ToolDescriptor tool : provider.getTools()) {
                sb.append("- ").append(tool.getName()).append(": ")
                        .append(nullToEmpty(tool.getDescription())).append('\n');
                if (tool.getParameters() != null && !tool.getParameters().isEmpty()) {
                    sb.append("  Parameters:\n");
                    for (ToolParameter parameter : tool.getParameters()) {
                        sb.append("    - ").append(parameter.getName())
                                .append(" (").append(parameter.getType())
                                .append(parameter.isRequired() ? ", required" : ", optional").append("): ")
                                .append(nullToEmpty(parameter.getDescription())).append('\n');
                    }
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
