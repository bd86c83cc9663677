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

import me.golemcore.router.domain.model.Conversation;
import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.infrastructure.config.RouterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory holder of conversations keyed by id. Conversations are
 * independent; each one is processed a turn at a time by the orchestrator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final RouterProperties properties;
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    public Conversation getOrCreate(String conversationId) {
        return conversations.computeIfAbsent(conversationId, id -> {
            RouterProperties.MemoryProperties memory = properties.getMemory();
            log.debug("[Conversation] Created {}", id);
            return new Conversation(id, new ConversationMemory(memory.getMaxTurns(), memory.isIncludeSystemTurns()));
        });
    }

    public boolean remove(String conversationId) {
        return conversations.remove(conversationId) != null;
    }

    public int size() {
        return conversations.size();
    }
}
