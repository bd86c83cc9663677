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

import java.util.List;
import java.util.Map;

/**
 * Static description of a flow, rendered into the flow-routing prompt.
 *
 * @param paramShape
 *            parameter name to description, in declaration order
 * @param aliases
 *            alternative ids the oracle may use for this flow
 */
public record FlowDescriptor(String id, String name, String description,
        Map<String, String> paramShape, List<String> aliases) {

    public FlowDescriptor {
        paramShape = paramShape != null ? java.util.Collections.unmodifiableMap(
                new java.util.LinkedHashMap<>(paramShape)) : Map.of();
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }

    public boolean answersTo(String flowId) {
        return id.equals(flowId) || aliases.contains(flowId);
    }
}
