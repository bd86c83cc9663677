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

import lombok.Getter;
import lombok.Setter;

/**
 * Per-conversation state: turn memory plus the flow state threaded from one
 * turn to the next. Turn processing synchronizes on the instance.
 */
@Getter
public class Conversation {

    private final String id;
    private final ConversationMemory memory;

    @Setter
    private FlowState flowState;

    public Conversation(String id, ConversationMemory memory) {
        this.id = id;
        this.memory = memory;
    }

    public boolean hasFlowState() {
        return flowState != null;
    }

    public void clearFlowState() {
        this.flowState = null;
    }
}
