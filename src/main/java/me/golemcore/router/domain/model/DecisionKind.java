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

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of actions the router can take. Each kind lists the
 * {@code action} strings accepted from the oracle.
 */
public enum DecisionKind {
    DIRECT_ANSWER("direct_answer", "direct_response", "respond_directly"),
    INVOKE_TOOL("invoke_tool", "call_tool"),
    LIST_PROVIDERS("list_providers", "list_servers"),
    PROVIDER_STATUS("provider_status", "server_status"),
    ENABLE_PROVIDER("enable_provider", "activate_server"),
    DISABLE_PROVIDER("disable_provider", "deactivate_server"),
    REMOVE_PROVIDER("remove_provider", "remove_server"),
    INSTALL_PROVIDER_DEPS("install_provider_deps", "install_server");

    private static final Map<String, DecisionKind> BY_ACTION;

    static {
        Map<String, DecisionKind> index = new java.util.HashMap<>();
        for (DecisionKind kind : values()) {
            for (String action : kind.actions) {
                index.put(action, kind);
            }
        }
        BY_ACTION = Map.copyOf(index);
    }

    private final String[] actions;

    DecisionKind(String... actions) {
        this.actions = actions;
    }

    public String action() {
        return actions[0];
    }

    public static Optional<DecisionKind> fromAction(String action) {
        if (action == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ACTION.get(action.trim().toLowerCase(Locale.ROOT)));
    }
}
