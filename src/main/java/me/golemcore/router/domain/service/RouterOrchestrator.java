package me.golemcore.router.domain.service;

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
import me.golemcore.router.domain.exception.OracleUnavailableException;
import me.golemcore.router.domain.exception.RouterException;
import me.golemcore.router.domain.model.Conversation;
import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.FlowTurnResult;
import me.golemcore.router.domain.model.ToolResult;
import me.golemcore.router.domain.model.Turn;
import me.golemcore.router.flow.FlowEngine;
import me.golemcore.router.flow.FlowRouter;
import me.golemcore.router.flow.FlowRoutingResult;
import me.golemcore.router.routing.ManagementCommandMatcher;
import me.golemcore.router.routing.QueryRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for one user turn.
 *
 * <pre>
 * user turn -> memory
 *   -> management keyword command?  -> registry reply
 *   -> flow router                  -> flow engine (state threaded on the conversation)
 *   -> query router decision        -> direct answer | tool call | missing params | management
 * reply -> memory
 * </pre>
 *
 * <p>
 * Turns of one conversation are serialized on the {@link Conversation}
 * instance. Provider, tool and transport failures are explained through the
 * oracle; an unavailable oracle ends the turn with a fixed apology.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouterOrchestrator {

    static final String ORACLE_UNAVAILABLE_REPLY = "Sorry, I can't reach the language model right now, "
            + "so I can't process your request. Please try again in a moment.";
    static final String CANNED_ERROR_PREFIX = "Sorry, something went wrong while handling your request: ";
    static final String EMPTY_FLOW_REPLY = "Let's continue. What would you like to do next?";

    private final ConversationService conversationService;
    private final ManagementCommandMatcher managementCommandMatcher;
    private final ProviderManagementService providerManagementService;
    private final FlowRouter flowRouter;
    private final FlowEngine flowEngine;
    private final QueryRouter queryRouter;
    private final ProviderRegistry providerRegistry;
    private final ToolExecutionService toolExecutionService;
    private final ResponseFormatter responseFormatter;

    public String processTurn(String conversationId, String userText) {
        return processTurn(conversationService.getOrCreate(conversationId), userText);
    }

    public String processTurn(Conversation conversation, String userText) {
        synchronized (conversation) {
            ConversationMemory memory = conversation.getMemory();
            memory.append(Turn.user(userText));

            String reply;
            try {
                reply = route(conversation, userText);
            } catch (OracleUnavailableException e) {
                log.warn("[Orchestrator] Oracle unavailable: {}", e.getMessage());
                reply = ORACLE_UNAVAILABLE_REPLY;
            } catch (RouterException e) {
                log.warn("[Orchestrator] {} while processing turn: {}", e.getCode(), e.getMessage());
                reply = explainFailure(e.getMessage(), userText, memory);
            } catch (RuntimeException e) {
                log.error("[Orchestrator] Unexpected failure while processing turn", e);
                reply = explainFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                        userText, memory);
            }

            memory.append(Turn.assistant(reply));
            return reply;
        }
    }

    /**
     * Clears the conversation's memory and leaves any active flow.
     */
    public void reset(Conversation conversation) {
        synchronized (conversation) {
            conversation.getMemory().clear();
            conversation.clearFlowState();
            log.info("[Orchestrator] Conversation {} reset", conversation.getId());
        }
    }

    private String route(Conversation conversation, String userText) {
        Optional<Decision> command = managementCommandMatcher.match(userText);
        if (command.isPresent()) {
            log.info("[Orchestrator] Management command: {}", command.get().kind());
            return providerManagementService.handle(command.get()).orElseThrow();
        }

        FlowRoutingResult flowRouting = flowRouter.route(userText, conversation.getMemory(),
                conversation.getFlowState());
        switch (flowRouting.outcome()) {
        case USE_FLOW:
            return runFlow(conversation, flowRouting, userText);
        case EXIT_FLOW:
            conversation.clearFlowState();
            return flowRouting.directResponse();
        case DIRECT_RESPONSE:
            return flowRouting.directResponse();
        case NO_FLOW:
        default:
            break;
        }

        Decision decision = queryRouter.decide(userText, conversation.getMemory(), providerRegistry.listEnabled());
        return dispatch(decision, userText, conversation.getMemory());
    }

    private String runFlow(Conversation conversation, FlowRoutingResult flowRouting, String userText) {
        FlowTurnResult result;
        try {
            result = flowEngine.run(flowRouting.state(), userText, conversation.getMemory());
        } catch (FlowNotFoundException e) {
            conversation.clearFlowState();
            throw e;
        }
        conversation.setFlowState(result.nextState());
        if (result.terminal()) {
            log.debug("[Orchestrator] Flow {} is in its final stage", result.nextState().flowId());
        }
        return result.response() == null || result.response().isBlank() ? EMPTY_FLOW_REPLY : result.response();
    }

    private String dispatch(Decision decision, String userText, ConversationMemory memory) {
        if (decision instanceof Decision.DirectAnswer answer) {
            return answer.text();
        }
        if (decision instanceof Decision.InvokeTool invoke) {
            if (invoke.hasMissingParameters()) {
                log.info("[Orchestrator] Asking for missing parameters of {}/{}: {}", invoke.providerId(),
                        invoke.toolName(), invoke.missingParameters());
                return responseFormatter.formatMissingParameters(invoke, userText, memory);
            }
            ToolResult result = toolExecutionService.execute(invoke.providerId(), invoke.toolName(),
                    invoke.arguments());
            return responseFormatter.formatResult(result, userText, memory);
        }
        return providerManagementService.handle(decision)
                .orElseThrow(() -> new IllegalStateException("Unhandled decision: " + decision.kind()));
    }

    private String explainFailure(String message, String userText, ConversationMemory memory) {
        try {
            return responseFormatter.formatError(message, userText, memory);
        } catch (OracleUnavailableException e) {
            log.warn("[Orchestrator] Cannot format error, oracle unavailable: {}", e.getMessage());
            return CANNED_ERROR_PREFIX + message;
        }
    }
}
