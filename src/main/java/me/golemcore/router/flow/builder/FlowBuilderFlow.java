package me.golemcore.router.flow.builder;

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
import me.golemcore.router.domain.service.OracleService;
import me.golemcore.router.flow.Flow;
import me.golemcore.router.flow.FlowContext;
import me.golemcore.router.flow.FlowStep;
import me.golemcore.router.routing.ConversationPromptRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversational helper for outlining a new flow. It does not generate code;
 * it keeps a running list of the user's requirements and discusses the design.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FlowBuilderFlow implements Flow<FlowBuilderStage, FlowBuilderParams> {

    public static final String FLOW_ID = "flow_builder";

    private static final int MAX_NOTES = 20;

    private static final FlowDescriptor DESCRIPTOR = new FlowDescriptor(
            FLOW_ID,
            "Flow Builder",
            "Create new flows through conversation",
            shape(),
            List.of());

    private final OracleService oracle;
    private final ConversationPromptRenderer promptRenderer;

    @Override
    public FlowDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Class<FlowBuilderStage> getStageType() {
        return FlowBuilderStage.class;
    }

    @Override
    public Class<FlowBuilderParams> getParamsType() {
        return FlowBuilderParams.class;
    }

    @Override
    public FlowBuilderStage getInitialStage() {
        return FlowBuilderStage.INTRO;
    }

    @Override
    public FlowStep<FlowBuilderStage, FlowBuilderParams> execute(FlowBuilderStage stage,
            FlowBuilderParams params, FlowContext context) {
        return switch (stage) {
        case INTRO -> intro(params, context);
        case REQUIREMENTS -> requirements(params, context);
        };
    }

    private FlowStep<FlowBuilderStage, FlowBuilderParams> intro(FlowBuilderParams params, FlowContext context) {
        String prompt = """
                The user wants to create a new flow. They said: "%s"
                %s
                Based on this, what type of flow might they want to create? Provide a helpful response that:
                1. Acknowledges their request
                2. Suggests what kind of flow they might want to build
                3. Asks for more details about the flow's functionality
                4. Explains that you can help them create the flow

                Keep your response conversational and helpful.
                """.formatted(context.userText(),
                params.getFlowType() != null ? "Requested flow type: " + params.getFlowType() + "\n" : "");
        addNote(params, context.userText());
        return FlowStep.reply(oracle.generate(prompt), FlowBuilderStage.REQUIREMENTS, params);
    }

    private FlowStep<FlowBuilderStage, FlowBuilderParams> requirements(FlowBuilderParams params,
            FlowContext context) {
        addNote(params, context.userText());
        String prompt = """
                You are helping the user design a new multi-step conversational flow.
                %s
                Requirements collected so far:
                %s
                The user's latest input: "%s"

                Continue the design conversation: summarize the stages the flow would go through, what each stage \
                asks or does, and what information it collects. Ask about anything that is still unclear.
                Keep your response conversational and helpful.
                """.formatted(promptRenderer.renderHistory(context.memory()), bullets(params.getNotes()),
                context.userText());
        log.debug("[Flow:{}] {} requirement notes collected", FLOW_ID, params.getNotes().size());
        return FlowStep.reply(oracle.generate(prompt), FlowBuilderStage.REQUIREMENTS, params);
    }

    private static void addNote(FlowBuilderParams params, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        List<String> notes = params.getNotes() != null ? new ArrayList<>(params.getNotes()) : new ArrayList<>();
        notes.add(text.trim());
        while (notes.size() > MAX_NOTES) {
            notes.remove(0);
        }
        params.setNotes(notes);
    }

    private static String bullets(List<String> notes) {
        StringBuilder sb = new StringBuilder();
        for (String note : notes) {
            sb.append("- ").append(note).append('\n');
        }
        return sb.toString();
    }

    private static Map<String, String> shape() {
        Map<String, String> shape = new LinkedHashMap<>();
        shape.put("flowType", "Type of flow to create");
        shape.put("flowName", "Name for the new flow");
        return shape;
    }
}
