package me.golemcore.router.adapter.inbound.console;

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

import me.golemcore.router.domain.model.Conversation;
import me.golemcore.router.domain.service.ConversationService;
import me.golemcore.router.domain.service.RouterOrchestrator;
import me.golemcore.router.infrastructure.config.RouterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Interactive chat on standard input and output. {@code exit} or {@code quit}
 * ends the session, {@code reset} clears the conversation.
 */
@Component
@ConditionalOnProperty(prefix = "router.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleChatRunner implements ApplicationRunner {

    private static final String PROMPT = "> ";

    private final RouterOrchestrator orchestrator;
    private final ConversationService conversationService;
    private final RouterProperties properties;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        chat(System.in, System.out);
    }

    void chat(InputStream in, PrintStream out) throws IOException {
        Conversation conversation = conversationService.getOrCreate(properties.getConsole().getConversationId());
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

        out.println("GolemCore Router. Type 'exit' to quit, 'reset' to start a new conversation.");
        out.print(PROMPT);
        out.flush();

        String line;
        while ((line = reader.readLine()) != null) {
            String input = line.trim();
            String command = input.toLowerCase(Locale.ROOT);
            if ("exit".equals(command) || "quit".equals(command)) {
                break;
            }
            if ("reset".equals(command)) {
                orchestrator.reset(conversation);
                out.println("Conversation cleared.");
            } else if (!input.isEmpty()) {
                out.println(orchestrator.processTurn(conversation, input));
            }
            out.print(PROMPT);
            out.flush();
        }
        log.info("[Console] Session ended");
    }
}
