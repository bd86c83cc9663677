package me.golemcore.router.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog entry for a tool-provider. Identity key is {@link #id}; re-adding a
 * descriptor with the same id replaces it in place.
 *
 * <p>
 * {@link #path} is set for file-backed providers (for example ones produced by
 * the guided creation flow). Its parent directory is the provider's home: the
 * install step runs there and remove-with-files deletes it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderDescriptor {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private TransportSpec transport = new TransportSpec();

    @Builder.Default
    private List<ToolDescriptor> tools = new ArrayList<>();

    @Builder.Default
    private boolean enabled = true;

    private String path;

    /** Extra environment passed to a spawned provider (API keys etc.). */
    @Builder.Default
    private Map<String, String> config = new HashMap<>();

    /** Overrides the configured default install command. */
    private String installCommand;

    public Optional<ToolDescriptor> findTool(String toolName) {
        if (tools == null) {
            return Optional.empty();
        }
        return tools.stream()
                .filter(t -> t.getName().equals(toolName))
                .findFirst();
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
