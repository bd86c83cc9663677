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
import me.golemcore.router.domain.exception.OracleUnavailableException;
import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.service.OracleService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decision engine: asks the oracle to classify and parametrize a request, then
 * narrows the untrusted reply into a validated {@link Decision}.
 *
 * <p>
 * Parse and validation failures never escape: they turn into a clarification
 * {@link Decision.DirectAnswer}. Only {@link OracleUnavailableException}
 * propagates, since without the oracle there is nothing to route.
 *
 * @see DecisionParser
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryRouter {

    private final OracleService oracle;
    private final OracleJson oracleJson;
    private final DecisionParser decisionParser;
    private final ConversationPromptRenderer promptRenderer;

    static final String FALLBACK_TEMPLATE = "I'm having trouble understanding how to process your request: \"%s\". "
            + "Could you please rephrase or provide more details?";

    private static final String SYSTEM_PROMPT = """
            You are an intelligent assistant that decides how a user's request is handled. \
            You never execute anything yourself; you only answer with one JSON object describing the action.
            """;

    private static final String INSTRUCTIONS = """
            Based on the above, decide on the appropriate action to take. You can:

            1. DIRECT RESPONSE: Answer the user's question using your knowledge or the conversation history.
               - Use this for general knowledge questions, explanations, or when no specific tool is needed.
               - IMPORTANT: For general knowledge questions like "What is the capital of France?", \
            ALWAYS use direct_response, NOT call_tool.

            2. CALL A TOOL: Use one of the available tools to fulfill the user's request.
               - Use this when the user's request requires computation or external data.
               - List every required parameter the user did not give in "missing_parameters" \
            instead of guessing a value.

            3. MANAGE SERVERS: Perform server management operations.
               - LIST SERVERS: Show all available servers
               - SERVER STATUS: Check which servers are active/disabled
               - ACTIVATE SERVER: Enable a disabled server
               - DEACTIVATE SERVER: Temporarily disable a server
               - REMOVE SERVER: Remove a server from the registry (optionally delete files)
               - INSTALL SERVER: Install dependencies for a server

            Respond with exactly one JSON object in the following format:

            {
              "action": "direct_response" | "call_tool" | "list_servers" | "server_status" | "activate_server" \
            | "deactivate_server" | "remove_server" | "install_server",
              "response": "Your message to the user explaining the action taken.",
              "reasoning": "Explanation of why this action is appropriate.",
              "tool": {
                "serverId": "server_id",
                "name": "tool_name",
                "parameters": { "param1": "value1" },
                "missing_parameters": ["param2"]
              },
              "server": {
                "id": "server_id",
                "deleteFiles": true | false
              }
            }

            Notes:
            - The "tool" field is only required for "call_tool".
            - The "server" field is only required for "activate_server", "deactivate_server", "remove_server" \
            and "install_server".
            - For "remove_server", include "deleteFiles" to indicate whether the server files are deleted too.
            - For numeric parameters, use actual numbers (e.g., 5), not strings (e.g., "5").
            - Convert word-form numbers (like "five") to numeric values (like 5).
            - Use the conversation history to understand the context of the current request.

            Examples:

            {"action": "direct_response", "response": "The capital of France is Paris.", \
            "reasoning": "General knowledge question."}

            {"action": "call_tool", "response": "I'll calculate 5 plus 3 for you.", \
            "reasoning": "The user asks for an addition.", \
            "tool": {"serverId": "calculator", "name": "add", "parameters": {"a": 5, "b": 3}, "missing_parameters": []}}

            {"action": "remove_server", "response": "I'll remove the weather server and delete its files.", \
            "reasoning": "The user wants the weather server gone completely.", \
            "server": {"id": "weather", "deleteFiles": true}}
            """;

    /**
     * @throws OracleUnavailableException
     *             if the oracle cannot be reached
     */
    public Decision decide(String userText, ConversationMemory memory, List<ProviderDescriptor> enabledProviders) {
        String prompt = buildPrompt(userText, memory, enabledProviders);
        String reply = oracle.generate(SYSTEM_PROMPT, prompt);
        log.debug("[Router] Raw decision reply: {}", reply);

        Optional<JsonNode> node = oracleJson.parseObject(reply);
        if (node.isEmpty()) {
            log.warn("[Router] No JSON object in oracle reply, falling back to clarification");
            return fallback(userText, oracleJson.salvageString(reply, "response"));
        }
        try {
            Decision decision = decisionParser.parse(node.get(), enabledProviders);
            log.info("[Router] Decision: {}", decision.kind().action());
            return decision;
        } catch (DecisionMalformedException e) {
            log.warn("[Router] Falling back to clarification: {}", e.getMessage());
            return fallback(userText, Optional.empty());
        }
    }

    String buildPrompt(String userText, ConversationMemory memory, List<ProviderDescriptor> enabledProviders) {
        return promptRenderer.renderHistory(memory)
                + "User input: \"" + userText + "\"\n\n"
                + "Available Tools:\n"
                + promptRenderer.renderCatalog(enabledProviders)
                + "\n"
                + INSTRUCTIONS;
    }

    private Decision fallback(String userText, Optional<String> salvaged) {
        String text = String.format(FALLBACK_TEMPLATE, userText);
        if (salvaged.isPresent()) {
            text = text + "\n\n" + salvaged.get();
        }
        return new Decision.DirectAnswer(text);
    }
}
