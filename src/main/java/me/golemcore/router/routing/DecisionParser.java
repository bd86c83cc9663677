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

import me.golemcore.router.domain.exception.DecisionMalformedException;
import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.DecisionKind;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes the oracle's decision object into a {@link Decision}, one decode
 * method per action kind.
 *
 * <p>
 * Tool invocations are resolved against the enabled providers passed in;
 * anything that does not resolve is rejected with
 * {@link DecisionMalformedException}. Management decisions only need a target
 * id, existence is checked when they are dispatched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionParser {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Decision parse(JsonNode node, List<ProviderDescriptor> enabledProviders) {
        if (node == null || !node.isObject()) {
            throw new DecisionMalformedException("Decision is not a JSON object");
        }
        String action = text(node, "action")
                .orElseThrow(() -> new DecisionMalformedException("Decision has no action"));
        DecisionKind kind = DecisionKind.fromAction(action)
                .orElseThrow(() -> new DecisionMalformedException("Unknown action: " + action));

        text(node, "reasoning").ifPresent(reasoning -> log.debug("[Router] Oracle reasoning: {}", reasoning));

        return switch (kind) {
        case DIRECT_ANSWER -> decodeDirectAnswer(node);
        case INVOKE_TOOL -> decodeInvokeTool(node, enabledProviders);
        case LIST_PROVIDERS -> new Decision.ListProviders();
        case PROVIDER_STATUS -> new Decision.ProviderStatus();
        case ENABLE_PROVIDER -> new Decision.SetProviderEnabled(targetId(node, action), true);
        case DISABLE_PROVIDER -> new Decision.SetProviderEnabled(targetId(node, action), false);
        case REMOVE_PROVIDER -> decodeRemove(node, action);
        case INSTALL_PROVIDER_DEPS -> new Decision.InstallProviderDependencies(targetId(node, action));
        };
    }

    private Decision decodeDirectAnswer(JsonNode node) {
        String response = text(node, "response")
                .orElseThrow(() -> new DecisionMalformedException("Direct answer has no response text"));
        return new Decision.DirectAnswer(response);
    }

    private Decision decodeInvokeTool(JsonNode node, List<ProviderDescriptor> enabledProviders) {
        JsonNode tool = node.get("tool");
        if (tool == null || !tool.isObject()) {
            throw new DecisionMalformedException("Missing tool information");
        }
        String providerId = text(tool, "serverId").or(() -> text(tool, "providerId"))
                .orElseThrow(() -> new DecisionMalformedException("Tool decision has no provider id"));
        String toolName = text(tool, "name")
                .orElseThrow(() -> new DecisionMalformedException("Tool decision has no tool name"));

        ProviderDescriptor provider = enabledProviders.stream()
                .filter(p -> p.getId().equals(providerId))
                .findFirst()
                .orElseThrow(() -> new DecisionMalformedException("Provider with ID " + providerId + " not found"));

        Optional<ToolDescriptor> declared = provider.findTool(toolName);
        if (declared.isEmpty() && !provider.getTools().isEmpty()) {
            throw new DecisionMalformedException("Tool " + toolName + " not found on provider " + providerId);
        }

        Map<String, Object> arguments = decodeArguments(tool.get("parameters"));
        List<String> missing = missingParameters(declared.orElse(null), arguments, tool.get("missing_parameters"));

        return new Decision.InvokeTool(providerId, toolName, arguments, missing, text(node, "response").orElse(null));
    }

    private Decision decodeRemove(JsonNode node, String action) {
        String providerId = targetId(node, action);
        JsonNode server = node.get("server");
        boolean deleteFiles = server.has("deleteFiles") && server.get("deleteFiles").asBoolean(false);
        return new Decision.RemoveProvider(providerId, deleteFiles);
    }

    private String targetId(JsonNode node, String action) {
        JsonNode server = node.get("server");
        if (server == null || !server.isObject()) {
            throw new DecisionMalformedException("Missing server ID for " + action + " action");
        }
        return text(server, "id")
                .orElseThrow(() -> new DecisionMalformedException("Missing server ID for " + action + " action"));
    }

    private Map<String, Object> decodeArguments(JsonNode parameters) {
        if (parameters == null || parameters.isNull()) {
            return Map.of();
        }
        if (!parameters.isObject()) {
            throw new DecisionMalformedException("Tool parameters must be an object");
        }
        Map<String, Object> arguments = objectMapper.convertValue(parameters, ARGUMENTS_TYPE);
        arguments.values().removeIf(Objects::isNull);
        return arguments;
    }

    /**
     * Required parameters absent from {@code arguments}, in declaration order,
     * followed by any further names the oracle listed.
     */
    static List<String> missingParameters(ToolDescriptor tool, Map<String, Object> arguments, JsonNode reported) {
        Set<String> missing = new LinkedHashSet<>();
        if (tool != null) {
            for (String required : tool.requiredParameterNames()) {
                if (!arguments.containsKey(required)) {
                    missing.add(required);
                }
            }
        }
        if (reported != null && reported.isArray()) {
            for (JsonNode name : reported) {
                String value = name.asText("").trim();
                if (!value.isEmpty() && !arguments.containsKey(value)) {
                    missing.add(value);
                }
            }
        }
        return new ArrayList<>(missing);
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
