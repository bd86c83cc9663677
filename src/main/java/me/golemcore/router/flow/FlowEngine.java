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

import me.golemcore.router.domain.exception.FlowNotFoundException;
import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.FlowState;
import me.golemcore.router.domain.model.FlowTurnResult;
import me.golemcore.router.infrastructure.config.RouterProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one turn of a flow: restores the typed stage and parameters from a
 * {@link FlowState}, executes the stage handler, enforces the flow's
 * transition table and returns the state for the next turn.
 *
 * <p>
 * Transitions the stage does not allow are refused (the stage is kept and a
 * warning logged). Terminal stages never change. A stage may ask for its
 * successor to run in the same turn; chaining is bounded by
 * {@code router.flows.max-chained-stages}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowEngine {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_MAP_TYPE = new TypeReference<>() {
    };

    private final FlowRegistry flowRegistry;
    private final ObjectMapper objectMapper;
    private final RouterProperties properties;

    /**
     * @throws FlowNotFoundException
     *             if no flow is registered under {@code state.flowId()}
     */
    public FlowTurnResult run(FlowState state, String userText, ConversationMemory memory) {
        Flow<?, ?> flow = flowRegistry.find(state.flowId())
                .orElseThrow(() -> new FlowNotFoundException(state.flowId()));
        return runTyped(flow, state, new FlowContext(userText, memory));
    }

    private <S extends Enum<S> & FlowStage<S>, P> FlowTurnResult runTyped(Flow<S, P> flow, FlowState state,
            FlowContext context) {
        String flowId = flow.getId();
        S stage = restoreStage(flow, state);
        P params = restoreParams(flow, state.params());

        List<String> responses = new ArrayList<>();
        int maxSteps = Math.max(1, properties.getFlows().getMaxChainedStages());

        for (int step = 0; step < maxSteps; step++) {
            FlowStep<S, P> result = flow.execute(stage, params, context);
            if (result.response() != null && !result.response().isBlank()) {
                responses.add(result.response().strip());
            }
            if (result.params() != null) {
                params = result.params();
            }

            S next = result.nextStage() != null ? result.nextStage() : stage;
            if (next != stage && (stage.isTerminal() || !stage.canTransitionTo(next))) {
                log.warn("[Flow:{}] Refused transition {} -> {}", flowId, stage.tag(), next.tag());
                next = stage;
            }
            if (next != stage) {
                log.info("[Flow:{}] {} -> {}", flowId, stage.tag(), next.tag());
            }

            boolean chain = result.continueImmediately() && next != stage;
            stage = next;
            if (!chain) {
                break;
            }
        }

        FlowState nextState = new FlowState(flowId, stage.tag(), toMap(params));
        return new FlowTurnResult(String.join("\n\n", responses), nextState, stage.isTerminal());
    }

    private <S extends Enum<S> & FlowStage<S>, P> S restoreStage(Flow<S, P> flow, FlowState state) {
        if (!state.isStarted()) {
            return flow.getInitialStage();
        }
        return flow.stageFor(state.stage()).orElseGet(() -> {
            log.warn("[Flow:{}] Unknown stage '{}', restarting at {}", flow.getId(), state.stage(),
                    flow.getInitialStage().tag());
            return flow.getInitialStage();
        });
    }

    private <P> P restoreParams(Flow<?, P> flow, Map<String, Object> values) {
        try {
            return objectMapper.convertValue(values != null ? values : Map.of(), flow.getParamsType());
        } catch (IllegalArgumentException e) {
            log.warn("[Flow:{}] Discarding unreadable parameters: {}", flow.getId(), e.getMessage());
            return objectMapper.convertValue(Map.of(), flow.getParamsType());
        }
    }

    private Map<String, Object> toMap(Object params) {
        if (params == null) {
            return Map.of();
        }
        return objectMapper.convertValue(params, PARAMS_MAP_TYPE);
    }
}
