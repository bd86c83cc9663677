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

import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads tool names out of generated provider source, so a descriptor can be
 * registered without starting the provider.
 *
 * <p>
 * Recognised forms: {@code server.tool("name", "description", ...)},
 * {@code server.registerTool("name", ...)} and, for low-level servers that
 * answer {@code ListToolsRequestSchema}, {@code name: "..."} entries.
 */
final class GeneratedSourceInspector {

    private static final Pattern TOOL_CALL = Pattern.compile(
            "\\.tool\\(\\s*[\"'`]([A-Za-z0-9_.-]+)[\"'`]\\s*(?:,\\s*[\"'`]([^\"'`]*)[\"'`])?");
    private static final Pattern REGISTER_TOOL = Pattern.compile(
            "\\.registerTool\\(\\s*[\"'`]([A-Za-z0-9_.-]+)[\"'`]");
    private static final Pattern LISTED_NAME = Pattern.compile("\\bname\\s*:\\s*[\"'`]([A-Za-z0-9_.-]+)[\"'`]");
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^a-z0-9-]+");

    private GeneratedSourceInspector() {
    }

    static List<ToolDescriptor> inspect(String source, ProviderManifest manifest) {
        if (source == null || source.isBlank()) {
            return List.of();
        }
        Map<String, String> found = new LinkedHashMap<>();

        Matcher m = TOOL_CALL.matcher(source);
        while (m.find()) {
            found.putIfAbsent(m.group(1), m.group(2));
        }
        m = REGISTER_TOOL.matcher(source);
        while (m.find()) {
            found.putIfAbsent(m.group(1), null);
        }
        if (found.isEmpty() && source.contains("ListToolsRequestSchema")) {
            m = LISTED_NAME.matcher(source);
            while (m.find()) {
                found.putIfAbsent(m.group(1), null);
            }
        }

        List<ToolDescriptor> tools = new ArrayList<>();
        found.forEach((name, description) -> {
            ToolDescriptor declared = manifest != null ? findTool(manifest, name) : null;
            tools.add(ToolDescriptor.builder()
                    .name(name)
                    .description(description != null ? description
                            : declared != null ? declared.getDescription() : "")
                    .parameters(declared != null && declared.getParameters() != null
                            ? new ArrayList<>(declared.getParameters())
                            : new ArrayList<ToolParameter>())
                    .build());
        });
        return tools;
    }

    /**
     * Lower-case, dash-separated name usable as directory, file and provider
     * id. Returns {@code null} when nothing usable is left.
     */
    static String safeName(String raw) {
        if (raw == null) {
            return null;
        }
        String name = raw.trim().toLowerCase(Locale.ROOT)
                .replaceAll("\\.(js|ts|mjs)$", "");
        name = UNSAFE_NAME_CHARS.matcher(name).replaceAll("-");
        name = name.replaceAll("-{2,}", "-").replaceAll("^-|-$", "");
        if (name.length() > 64) {
            name = name.substring(0, 64).replaceAll("-$", "");
        }
        return name.isEmpty() ? null : name;
    }

    private static ToolDescriptor findTool(ProviderManifest manifest, String name) {
        if (manifest.getTools() == null) {
            return null;
        }
        return manifest.getTools().stream()
                .filter(tool -> name.equals(tool.getName()))
                .findFirst()
                .orElse(null);
    }
}
