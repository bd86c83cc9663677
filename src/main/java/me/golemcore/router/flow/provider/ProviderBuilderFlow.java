package me.golemcore.router.flow.provider;

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

import me.golemcore.router.domain.exception.RouterException;
import me.golemcore.router.domain.model.FlowDescriptor;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolResult;
import me.golemcore.router.domain.model.TransportSpec;
import me.golemcore.router.domain.service.OracleService;
import me.golemcore.router.domain.service.ProviderRegistry;
import me.golemcore.router.domain.service.ToolExecutionService;
import me.golemcore.router.flow.Flow;
import me.golemcore.router.flow.FlowContext;
import me.golemcore.router.flow.FlowStep;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.routing.ConversationPromptRenderer;
import me.golemcore.router.routing.OracleJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Guided creation of a new tool-provider through conversation.
 *
 * <pre>
 * intro -> gathering_requirements -> code_generation -> save_code -> register_server -> complete
 * </pre>
 *
 * <p>
 * Stage advancement is driven by explicit JSON signals from the oracle
 * ({@code {"advance": true}}); the keyword heuristics are only consulted when
 * no signal can be read. Files are written through the filesystem provider
 * like any other tool call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderBuilderFlow implements Flow<ProviderBuilderStage, ProviderBuilderParams> {

    public static final String FLOW_ID = "provider_builder";

    private static final FlowDescriptor DESCRIPTOR = new FlowDescriptor(
            FLOW_ID,
            "Server Builder",
            "Create a new MCP tool-provider (server) through conversation: gather requirements, "
                    + "generate the code, save it and register it",
            orderedShape(
                    "serverType", "Type of server to create",
                    "serverName", "Name for the new server"),
            List.of("server_builder"));

    private static final List<String> ADVANCE_KEYWORDS = List.of("generate the code", "create the server",
            "write the code");
    private static final List<String> SAVE_KEYWORDS = List.of("save", "write to file", "create file");
    private static final List<String> AFFIRMATIVE_KEYWORDS = List.of("yes", "yeah", "yep", "sure", "ok",
            "okay", "register", "go ahead", "please do", "do it");
    private static final String DEFAULT_NAME = "custom-server";
    private static final String SDK_VERSION = "^1.7.0";
    private static final String ZOD_VERSION = "^3.24.2";

    private static final String CODE_TEMPLATE = """
            import { McpServer } from "@modelcontextprotocol/sdk/server/mcp.js";
            import { StdioServerTransport } from "@modelcontextprotocol/sdk/server/stdio.js";
            import { z } from "zod";

            const server = new McpServer({ name: "<server-name>", version: "1.0.0" });

            server.tool(
              "<tool_name>",
              "<what the tool does>",
              { a: z.number().describe("<parameter description>") },
              async ({ a }) => ({ content: [{ type: "text", text: String(a) }] })
            );

            const transport = new StdioServerTransport();
            await server.connect(transport);
            """;

    private final OracleService oracle;
    private final OracleJson oracleJson;
    private final ConversationPromptRenderer promptRenderer;
    private final ToolExecutionService toolExecutionService;
    private final ProviderRegistry providerRegistry;
    private final RouterProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public FlowDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Class<ProviderBuilderStage> getStageType() {
        return ProviderBuilderStage.class;
    }

    @Override
    public Class<ProviderBuilderParams> getParamsType() {
        return ProviderBuilderParams.class;
    }

    @Override
    public ProviderBuilderStage getInitialStage() {
        return ProviderBuilderStage.INTRO;
    }

    @Override
    public FlowStep<ProviderBuilderStage, ProviderBuilderParams> execute(ProviderBuilderStage stage,
            ProviderBuilderParams params, FlowContext context) {
        return switch (stage) {
        case INTRO -> intro(params, context);
        case GATHERING_REQUIREMENTS -> gatherRequirements(params, context);
        case CODE_GENERATION -> generateCode(params, context);
        case SAVE_CODE -> saveCode(params, context);
        case REGISTER_SERVER -> registerServer(params, context);
        case COMPLETE -> complete(params, context);
        };
    }

    // ==================== intro ====================

    private FlowStep<ProviderBuilderStage, ProviderBuilderParams> intro(ProviderBuilderParams params,
            FlowContext context) {
        String prompt = """
                You are an expert MCP (Model Context Protocol) server developer. The user wants to create a new \
                MCP server. They said: "%s"
                %s
                %s
                Provide a helpful response that:
                1. Acknowledges their request to build a server
                2. Asks for specific details about what tools the server should provide, \
                with their parameters and results
                3. Explains that we'll be creating a JavaScript MCP server saved to the %s folder
                4. Keeps your response conversational and helpful

                DO NOT ask what programming language they want to use.
                """.formatted(context.userText(), history(context), typeHint(params), outputDirectory());
        String reply = oracle.generate(prompt);
        return FlowStep.reply(reply, ProviderBuilderStage.GATHERING_REQUIREMENTS, params);
    }

    // ==================== gathering_requirements ====================

    private FlowStep<ProviderBuilderStage, ProviderBuilderParams> gatherRequirements(
            ProviderBuilderParams params, FlowContext context) {
        String prompt = """
                You are an expert MCP (Model Context Protocol) server developer helping the user create a \
                JavaScript MCP server.

                %s
                The user's latest input: "%s"

                Based on the conversation so far, work out the requirements for the server:
                - What tools should the server provide?
                - What parameters should each tool accept?
                - What should each tool return?

                If you need more information, ask specific questions to clarify the requirements.
                If you have enough information to write the server, summarize the requirements and say you are \
                ready to generate the code.

                Keep your response conversational. After your response, on its own line, add exactly one JSON \
                object telling whether the requirements are complete enough to generate code:
                {"advance": true} or {"advance": false}
                """.formatted(history(context), context.userText());
        String reply = oracle.generate(prompt);
        String message = oracleJson.withoutSignal(reply, "advance");

        boolean advance = oracleJson.readFlag(reply, "advance")
                .orElseGet(() -> {
                    log.debug("[Flow:{}] No advance signal, checking phrasing", FLOW_ID);
                    return containsAny(reply, ADVANCE_KEYWORDS);
                });
        if (!advance) {
            return FlowStep.reply(message, ProviderBuilderStage.GATHERING_REQUIREMENTS, params);
        }

        extractManifest(context).ifPresent(manifest -> {
            params.setManifest(manifest);
            if (params.getServerName() == null) {
                params.setServerName(GeneratedSourceInspector.safeName(manifest.getServerName()));
            }
        });
        return FlowStep.reply(message, ProviderBuilderStage.CODE_GENERATION, params);
    }

    private Optional<ProviderManifest> extractManifest(FlowContext context) {
        String prompt = """
                Based on the following conversation, extract the key details for the MCP server.
                %s
                User's latest input: "%s"

                Respond with JSON only, in this format:
                {
                  "serverName": "name of the server",
                  "serverDescription": "brief description of what the server does",
                  "tools": [
                    {
                      "name": "tool name",
                      "description": "what the tool does",
                      "parameters": [
                        {"name": "parameter name", "type": "string|number|boolean", \
                "description": "what the parameter is for", "required": true}
                      ]
                    }
                  ]
                }
                """.formatted(history(context), context.userText());
        Optional<ProviderManifest> manifest = oracleJson.parseObject(oracle.generate(prompt), ProviderManifest.class);
        if (manifest.isEmpty()) {
            log.warn("[Flow:{}] Could not extract server details, continuing without a manifest", FLOW_ID);
        }
        return manifest;
    }

    // ==================== code_generation ====================

    private FlowStep<ProviderBuilderStage, ProviderBuilderParams> generateCode(ProviderBuilderParams params,
            FlowContext context) {
        boolean saveNow = wantsToSave(context);
        if (saveNow && params.getCode() != null) {
            return FlowStep.chain("", ProviderBuilderStage.SAVE_CODE, params);
        }

        String prompt = """
                You are an expert MCP (Model Context Protocol) server developer. Based on the conversation, \
                generate the JavaScript code (ES module, runnable with node) for the MCP server.

                %s
                User's latest input: "%s"

                Server details extracted so far:
                %s

                Follow this template, using the @modelcontextprotocol/sdk and zod packages and registering every \
                tool with server.tool(name, description, schema, handler):

                ```javascript
                %s```

                Put the complete code in a single ```javascript code block and briefly explain what it does.
                If the user wants changes to earlier code, return the full updated code.
                """.formatted(history(context), context.userText(), describe(params.getManifest()), CODE_TEMPLATE);
        String reply = oracle.generate(prompt);
        oracleJson.extractCodeBlock(reply).ifPresent(params::setCode);

        if (params.getCode() == null) {
            log.warn("[Flow:{}] No code block in generated reply", FLOW_ID);
            return FlowStep.reply(reply, ProviderBuilderStage.CODE_GENERATION, params);
        }
        if (saveNow) {
            return FlowStep.chain(reply, ProviderBuilderStage.SAVE_CODE, params);
        }
        return FlowStep.reply(reply + "\n\nWhen you're happy with the code, tell me to save it.",
                ProviderBuilderStage.CODE_GENERATION, params);
    }

    private boolean wantsToSave(FlowContext context) {
        String prompt = """
                The user is reviewing generated MCP server code. Their latest message is: "%s"

                Does this message explicitly ask to save or write the code to a file now?
                Respond with JSON only: {"advance": true} or {"advance": false}
                """.formatted(context.userText());
        return oracleJson.readFlag(oracle.generate(prompt), "advance")
                .orElseGet(() -> containsAny(context.userText(), SAVE_KEYWORDS));
    }

    // ==================== save_code ====================

    private FlowStep<ProviderBuilderStage, ProviderBuilderParams> saveCode(ProviderBuilderParams params,
            FlowContext context) {
        if (params.getCode() == null) {
            recoverCode(context).ifPresent(params::setCode);
        }
        if (params.getCode() == null) {
            return FlowStep.reply("I couldn't find any server code to save yet. "
                    + "Describe the server again or ask me to regenerate the code, then tell me to save it.",
                    ProviderBuilderStage.SAVE_CODE, params);
        }
        if (params.getServerName() == null) {
            params.setServerName(suggestName(params, context));
        }

        String name = params.getServerName();
        String directory = outputDirectory() + "/" + name;
        String sourcePath = directory + "/" + name + ".js";
        ProviderManifest manifest = params.getManifest() != null ? params.getManifest()
                : ProviderManifest.builder().serverName(name).build();

        try {
            callFilesystem("create_directory", Map.of("path", directory));
            callFilesystem("write_file", Map.of("path", sourcePath, "content", params.getCode()));
            callFilesystem("write_file", Map.of("path", directory + "/package.json",
                    "content", packageJson(name, manifest)));
            callFilesystem("write_file", Map.of("path", directory + "/manifest.json",
                    "content", toJson(manifest)));
        } catch (RouterException | IllegalStateException e) {
            log.warn("[Flow:{}] Saving {} failed: {}", FLOW_ID, sourcePath, e.getMessage());
            return FlowStep.reply("I couldn't save the server files: " + e.getMessage()
                    + "\nMake sure the filesystem provider is available, then ask me to save again.",
                    ProviderBuilderStage.SAVE_CODE, params);
        }

        params.setSourcePath(sourcePath);
        ProviderDescriptor descriptor = deriveDescriptor(name, sourcePath, manifest, params.getCode());
        params.setProvider(descriptor);
        log.info("[Flow:{}] Saved provider source to {}", FLOW_ID, sourcePath);

        String tools = descriptor.getTools().isEmpty() ? "(none detected)"
                : descriptor.getTools().stream().map(ToolDescriptor::getName).collect(Collectors.joining(", "));
        String message = """
                I've saved the server to %s (with package.json and manifest.json).
                Tools: %s

                Would you like me to register it now so it can be used right away?""".formatted(sourcePath, tools);
        return FlowStep.reply(message, ProviderBuilderStage.REGISTER_SERVER, params);
    }

    private Optional<String> recoverCode(FlowContext context) {
        String prompt = """
                Extract the complete MCP server code from this conversation so it can be saved.
                %s
                Reply with only the complete code in a single ```javascript code block.
                """.formatted(history(context));
        return oracleJson.extractCodeBlock(oracle.generate(prompt));
    }

    private String suggestName(ProviderBuilderParams params, FlowContext context) {
        String prompt = """
                Suggest a short, lower-case, dash-separated name for this MCP server (for example weather-server).
                %s
                Server details:
                %s
                Respond with JSON only: {"serverName": "..."}
                """.formatted(history(context), describe(params.getManifest()));
        String reply = oracle.generate(prompt);
        String name = oracleJson.parseObject(reply)
                .map(node -> node.path("serverName").asText(null))
                .map(GeneratedSourceInspector::safeName)
                .or(() -> Optional.ofNullable(GeneratedSourceInspector.safeName(params.getServerType())))
                .orElse(DEFAULT_NAME);
        log.debug("[Flow:{}] Using server name {}", FLOW_ID, name);
        return name;
    }

    private void callFilesystem(String tool, Map<String, Object> arguments) {
        String filesystemId = properties.getFlows().getFilesystemProviderId();
        ToolResult result = toolExecutionService.execute(filesystemId, tool, arguments);
        if (!result.isSuccess()) {
            throw new IllegalStateException(tool + " failed: " + result.getError());
        }
    }

    private ProviderDescriptor deriveDescriptor(String name, String sourcePath, ProviderManifest manifest,
            String code) {
        List<ToolDescriptor> tools = GeneratedSourceInspector.inspect(code, manifest);
        if (tools.isEmpty() && manifest.getTools() != null && !manifest.getTools().isEmpty()) {
            tools = new ArrayList<>(manifest.getTools());
        }
        if (tools.isEmpty()) {
            tools = enumerateTools(code);
        }
        return ProviderDescriptor.builder()
                .id(name)
                .name(manifest.getServerName() != null ? manifest.getServerName() : name)
                .description(manifest.getServerDescription() != null ? manifest.getServerDescription()
                        : "Generated MCP server " + name)
                .transport(TransportSpec.stdio("node", List.of()))
                .path(sourcePath)
                .tools(new ArrayList<>(tools))
                .build();
    }

    private List<ToolDescriptor> enumerateTools(String code) {
        String prompt = """
                List the tools defined by this MCP server code.

                ```javascript
                %s
                ```

                Respond with JSON only: {"tools": [{"name": "...", "description": "...", \
                "parameters": [{"name": "...", "type": "...", "description": "...", "required": true}]}]}
                """.formatted(code);
        return oracleJson.parseObject(oracle.generate(prompt), ProviderManifest.class)
                .map(ProviderManifest::getTools)
                .orElseGet(() -> {
                    log.warn("[Flow:{}] Could not enumerate tools of the generated code", FLOW_ID);
                    return List.of();
                });
    }

    // ==================== register_server ====================

    private FlowStep<ProviderBuilderStage, ProviderBuilderParams> registerServer(ProviderBuilderParams params,
            FlowContext context) {
        ProviderDescriptor descriptor = params.getProvider();
        if (descriptor == null) {
            params.setRegistered(false);
            return FlowStep.reply("There is no saved server to register, so I've finished here.",
                    ProviderBuilderStage.COMPLETE, params);
        }

        String prompt = """
                The assistant asked whether to register the newly saved MCP server "%s". The user answered: "%s"

                Does the user want the server registered now?
                Respond with JSON only: {"register": true} or {"register": false}
                """.formatted(descriptor.getId(), context.userText());
        boolean register = oracleJson.readFlag(oracle.generate(prompt), "register")
                .orElseGet(() -> containsAny(context.userText(), AFFIRMATIVE_KEYWORDS));

        if (!register) {
            params.setRegistered(false);
            return FlowStep.reply("Okay, I haven't registered it. The code stays in " + params.getSourcePath()
                    + "; you can register it later by asking me to create the server again.",
                    ProviderBuilderStage.COMPLETE, params);
        }

        providerRegistry.upsert(descriptor);
        params.setRegistered(true);
        return FlowStep.reply("""
                The server "%s" is registered (ID: %s).
                Run 'install server %s' to install its npm dependencies before using it.""".formatted(
                descriptor.displayName(), descriptor.getId(), descriptor.getId()),
                ProviderBuilderStage.COMPLETE, params);
    }

    // ==================== complete ====================

    private FlowStep<ProviderBuilderStage, ProviderBuilderParams> complete(ProviderBuilderParams params,
            FlowContext context) {
        String prompt = """
                You are an expert MCP (Model Context Protocol) server developer. The server creation process \
                is complete%s.

                %s
                User's latest input: "%s"

                Respond to the user's query in the context of the server we've just created.
                If they're asking about using or modifying the server, provide helpful guidance.
                If they want to create another server, tell them to say "start over".
                """.formatted(params.getSourcePath() != null ? " (saved to " + params.getSourcePath() + ")" : "",
                history(context), context.userText());
        return FlowStep.reply(oracle.generate(prompt), ProviderBuilderStage.COMPLETE, params);
    }

    // ==================== helpers ====================

    private String history(FlowContext context) {
        return promptRenderer.renderHistory(context.memory());
    }

    private String typeHint(ProviderBuilderParams params) {
        return params.getServerType() != null ? "Requested server type: " + params.getServerType() + "\n" : "";
    }

    private String outputDirectory() {
        return properties.getFlows().getOutputDirectory();
    }

    private String describe(ProviderManifest manifest) {
        if (manifest == null) {
            return "(none yet)";
        }
        return toJson(manifest);
    }

    private String packageJson(String name, ProviderManifest manifest) {
        Map<String, Object> pkg = new LinkedHashMap<>();
        pkg.put("name", name);
        pkg.put("version", "1.0.0");
        pkg.put("description", manifest.getServerDescription() != null ? manifest.getServerDescription() : "");
        pkg.put("type", "module");
        pkg.put("main", name + ".js");
        pkg.put("dependencies", Map.of(
                "@modelcontextprotocol/sdk", SDK_VERSION,
                "zod", ZOD_VERSION));
        return toJson(pkg);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static boolean containsAny(String text, List<String> keywords) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    private static Map<String, String> orderedShape(String... entries) {
        Map<String, String> shape = new LinkedHashMap<>();
        for (int i = 0; i + 1 < entries.length; i += 2) {
            shape.put(entries[i], entries[i + 1]);
        }
        return shape;
    }
}
