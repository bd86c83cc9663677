package me.golemcore.router.flow;

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
import me.golemcore.router.domain.model.FlowDescriptor;
import me.golemcore.router.domain.model.FlowState;
import me.golemcore.router.domain.service.OracleService;
import me.golemcore.router.routing.ConversationPromptRenderer;
import me.golemcore.router.routing.OracleJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a message belongs to a flow.
 *
 * <p>
 * Order of checks:
 * <ol>
 * <li>an exit phrase leaves the active flow;
 * <li>an active flow in a non-terminal stage keeps the message, without asking
 * the oracle;
 * <li>listing and status requests never start a flow;
 * <li>otherwise the oracle classifies the message against the registered
 * flows. A flow sitting in its terminal stage is continued or restarted
 * depending on that answer.
 * </ol>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FlowRouter {

    private static final Set<String> EXIT_PHRASES = Set.of("cancel", "exit flow", "stop", "exit the flow",
            "cancel flow", "stop the flow");
    private static final Set<String> RESTART_PHRASES = Set.of("start over", "restart", "restart flow");
    private static final List<String> LISTING_PHRASES = List.of("list mcp servers", "list the mcp servers",
            "list servers", "list providers", "show mcp servers", "show the mcp servers", "what mcp servers",
            "server status", "provider status", "show servers", "show providers");
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    static final String UNKNOWN_FLOW_TEMPLATE = "I couldn't find a flow with ID \"%s\". "
            + "Let me try to help you another way.";

    private final FlowRegistry flowRegistry;
    private final OracleService oracle;
    private final OracleJson oracleJson;
    private final ConversationPromptRenderer promptRenderer;
    private final ObjectMapper objectMapper;

    public FlowRoutingResult route(String userText, ConversationMemory memory, FlowState activeState) {
        String normalized = normalize(userText);

        if (activeState != null) {
            if (EXIT_PHRASES.contains(normalized)) {
                String name = flowRegistry.find(activeState.flowId())
                        .map(flow -> flow.getDescriptor().name())
                        .orElse(activeState.flowId());
                log.info("[Flow:{}] Exited by user", activeState.flowId());
                return FlowRoutingResult.exit("Okay, I've stopped the " + name + " flow. What would you like to do next?");
            }
            if (flowRegistry.find(activeState.flowId()).isEmpty()) {
                log.warn("[Flow] Active flow {} is no longer registered", activeState.flowId());
                return FlowRoutingResult.exit(String.format(UNKNOWN_FLOW_TEMPLATE, activeState.flowId()));
            }
            boolean terminal = flowRegistry.isTerminal(activeState.flowId(), activeState.stage());
            if (!terminal) {
                return FlowRoutingResult.useFlow(activeState);
            }
            if (RESTART_PHRASES.contains(normalized)) {
                return FlowRoutingResult.useFlow(FlowState.initial(activeState.flowId(), Map.of()));
            }
        }

        if (isListingRequest(normalized)) {
            return FlowRoutingResult.noFlow();
        }

        return classify(userText, memory, activeState);
    }

    private FlowRoutingResult classify(String userText, ConversationMemory memory, FlowState activeState) {
        List<FlowDescriptor> flows = flowRegistry.descriptors();
        if (flows.isEmpty()) {
            return FlowRoutingResult.noFlow();
        }

        String reply = oracle.generate(buildPrompt(userText, memory, flows, activeState));
        log.debug("[Flow] Raw routing reply: {}", reply);

        Optional<JsonNode> parsed = oracleJson.parseObject(reply);
        if (parsed.isEmpty()) {
            log.warn("[Flow] Unparseable routing reply, using regular routing");
            return FlowRoutingResult.noFlow();
        }
        JsonNode node = parsed.get();
        JsonNode shouldUseFlow = node.get("shouldUseFlow");
        if (shouldUseFlow == null || !shouldUseFlow.isBoolean() || !shouldUseFlow.asBoolean()) {
            return FlowRoutingResult.noFlow();
        }

        String flowId = node.hasNonNull("flowId") ? node.get("flowId").asText() : "";
        Optional<Flow<?, ?>> flow = flowRegistry.find(flowId);
        if (flow.isEmpty()) {
            log.warn("[Flow] Oracle chose unknown flow: {}", flowId);
            return FlowRoutingResult.direct(String.format(UNKNOWN_FLOW_TEMPLATE, flowId));
        }

        String canonicalId = flow.get().getId();
        boolean restart = node.hasNonNull("restart") && node.get("restart").asBoolean(false);
        if (activeState != null && canonicalId.equals(activeState.flowId()) && !restart) {
            return FlowRoutingResult.useFlow(activeState);
        }

        Map<String, Object> params = readParams(node.get("params"));
        log.info("[Flow:{}] Starting flow", canonicalId);
        return FlowRoutingResult.useFlow(FlowState.initial(canonicalId, params));
    }

    private Map<String, Object> readParams(JsonNode params) {
        if (params == null || !params.isObject()) {
            return Map.of();
        }
        try {
            return objectMapper.convertValue(params, PARAMS_TYPE);
        } catch (IllegalArgumentException e) {
            log.warn("[Flow] Ignoring unreadable flow params: {}", e.getMessage());
            return Map.of();
        }
    }

    static boolean isListingRequest(String normalized) {
        if (LISTING_PHRASES.stream().anyMatch(normalized::contains)) {
            return true;
        }
        return normalized.contains("list") && normalized.contains("servers")
                && (normalized.contains("app") || normalized.contains("application")
                        || normalized.contains("program"));
    }

    private String buildPrompt(String userText, ConversationMemory memory, List<FlowDescriptor> flows,
            FlowState activeState) {
        StringBuilder sb = new StringBuilder();
        sb.append("You decide whether a user's message should be handled by a specialized multi-step flow ")
                .append("or by the regular tool routing system.\n\n");
        sb.append(promptRenderer.renderHistory(memory));
        sb.append("User input: \"").append(userText).append("\"\n\n");

        sb.append("Available Flows:\n");
        for (FlowDescriptor flow : flows) {
            sb.append("Flow: ").append(flow.name()).append(" (ID: ").append(flow.id()).append(")\n");
            sb.append("Description: ").append(flow.description()).append('\n');
            if (!flow.paramShape().isEmpty()) {
                sb.append("Parameters:\n");
                flow.paramShape().forEach((name, description) -> sb.append("  - ").append(name)
                        .append(": ").append(description).append('\n'));
            }
            sb.append('\n');
        }

        if (activeState != null) {
            sb.append("The flow \"").append(activeState.flowId())
                    .append("\" has just finished in this conversation. If the user is following up on it, ")
                    .append("choose that flow with \"restart\": false. Set \"restart\": true only if the user ")
                    .append("wants to begin it again from scratch.\n\n");
        }

        sb.append("""
                IMPORTANT GUIDELINES:
                - Requests to list, show or get the status of servers/providers are NEVER flows.
                - Only choose a flow when the user clearly wants to CREATE or BUILD something new.
                - Extract any relevant parameters from the user's message into "params".

                Respond with exactly one JSON object:

                {
                  "shouldUseFlow": true | false,
                  "flowId": "flow_id_if_applicable",
                  "params": { "param1": "value1" },
                  "restart": false,
                  "reasoning": "Why this decision is appropriate."
                }
                """);
        return sb.toString();
    }

    private static String normalize(String userText) {
        if (userText == null) {
            return "";
        }
        String text = userText.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        while (!text.isEmpty() && ".!?".indexOf(text.charAt(text.length() - 1)) >= 0) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }
}
