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

import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.ToolResult;
import me.golemcore.router.routing.ConversationPromptRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns tool results, failures and missing-parameter decisions into
 * conversational replies through the oracle.
 *
 * <p>
 * Every method may throw
 * {@link me.golemcore.router.domain.exception.OracleUnavailableException}; the
 * orchestrator decides what to say instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseFormatter {

    private final OracleService oracle;
    private final ConversationPromptRenderer promptRenderer;
    private final ObjectMapper objectMapper;

    public String formatResult(ToolResult result, String userText, ConversationMemory memory) {
        String prompt = """
                %s
                The user asked: "%s"

                The system executed a tool and got the following result:
                %s

                Please format this result into a natural, user-friendly response.
                Focus on the most important information and present it in a clear, concise way.
                If the tool reported an error, explain it plainly and suggest what the user could try instead.
                If the user's query refers to previous parts of the conversation, make sure to acknowledge that \
                context in your response.
                """.formatted(promptRenderer.renderHistory(memory), userText, toJson(result));
        return oracle.generate(prompt);
    }

    public String formatError(String errorMessage, String userText, ConversationMemory memory) {
        String prompt = """
                %s
                The user asked: "%s"

                The system encountered an error:
                %s

                Please format this error into a helpful, user-friendly response that explains what went wrong
                and possibly suggests alternatives or next steps.
                If the user's query refers to previous parts of the conversation, make sure to acknowledge that \
                context in your response.
                """.formatted(promptRenderer.renderHistory(memory), userText, errorMessage);
        return oracle.generate(prompt);
    }

    public String formatMissingParameters(Decision.InvokeTool decision, String userText,
            ConversationMemory memory) {
        String hint = decision.message() != null && !decision.message().isBlank()
                ? "Suggested wording: " + decision.message() + "\n"
                : "";
        String prompt = """
                %s
                The user asked: "%s"

                To answer, the tool "%s" of provider "%s" should be called, but these required values are missing:
                %s
                %s
                Ask the user for the missing values in one short, natural question. Do not make up values.
                """.formatted(promptRenderer.renderHistory(memory), userText, decision.toolName(),
                decision.providerId(), String.join(", ", decision.missingParameters()), hint);
        return oracle.generate(prompt);
    }

    private String toJson(ToolResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("[Formatter] Cannot serialize tool result: {}", e.getMessage());
            return String.valueOf(result);
        }
    }
}
