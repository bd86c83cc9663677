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

import me.golemcore.router.domain.model.FlowDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered flows by id. Registering a flow with an existing id replaces it.
 */
@Component
@Slf4j
public class FlowRegistry {

    private final Map<String, Flow<?, ?>> flows = new LinkedHashMap<>();

    public FlowRegistry(List<Flow<?, ?>> builtInFlows) {
        builtInFlows.forEach(this::register);
    }

    public synchronized void register(Flow<?, ?> flow) {
        boolean replaced = flows.put(flow.getId(), flow) != null;
        log.debug("[Flow] {} flow: {}", replaced ? "Replaced" : "Registered", flow.getId());
    }

    public synchronized boolean remove(String flowId) {
        return flows.remove(flowId) != null;
    }

    /**
     * Looks a flow up by id or by one of its aliases.
     */
    public synchronized Optional<Flow<?, ?>> find(String flowId) {
        if (flowId == null) {
            return Optional.empty();
        }
        Flow<?, ?> direct = flows.get(flowId);
        if (direct != null) {
            return Optional.of(direct);
        }
        return flows.values().stream()
                .filter(flow -> flow.getDescriptor().answersTo(flowId))
                .findFirst();
    }

    public synchronized List<FlowDescriptor> descriptors() {
        return flows.values().stream().map(Flow::getDescriptor).toList();
    }

    /**
     * Whether {@code stageTag} names a terminal stage of the flow. Unknown
     * flows and tags are not terminal.
     */
    public boolean isTerminal(String flowId, String stageTag) {
        return find(flowId)
                .flatMap(flow -> flow.stageFor(stageTag).map(stage -> (FlowStage<?>) stage))
                .map(FlowStage::isTerminal)
                .orElse(false);
    }
}
