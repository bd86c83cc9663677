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
 * Validated routing decision. Produced by the query router, dispatched by the
 * orchestrator.
 */
public sealed interface Decision permits Decision.DirectAnswer, Decision.InvokeTool, Decision.ListProviders,
        Decision.ProviderStatus, Decision.SetProviderEnabled, Decision.RemoveProvider,
        Decision.InstallProviderDependencies {

    DecisionKind kind();

    record DirectAnswer(String text) implements Decision {
        @Override
        public DecisionKind kind() {
            return DecisionKind.DIRECT_ANSWER;
        }
    }

    /**
     * Tool invocation. When {@link #missingParameters()} is non-empty the tool
     * must not be executed; the user is asked for the values instead.
     */
    record InvokeTool(String providerId, String toolName, Map<String, Object> arguments,
            List<String> missingParameters, String message) implements Decision {

        public InvokeTool {
            arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
            missingParameters = missingParameters != null ? List.copyOf(missingParameters) : List.of();
        }

        public boolean hasMissingParameters() {
            return !missingParameters.isEmpty();
        }

        @Override
        public DecisionKind kind() {
            return DecisionKind.INVOKE_TOOL;
        }
    }

    record ListProviders() implements Decision {
        @Override
        public DecisionKind kind() {
            return DecisionKind.LIST_PROVIDERS;
        }
    }

    record ProviderStatus() implements Decision {
        @Override
        public DecisionKind kind() {
            return DecisionKind.PROVIDER_STATUS;
        }
    }

    record SetProviderEnabled(String providerId, boolean enabled) implements Decision {
        @Override
        public DecisionKind kind() {
            return enabled ? DecisionKind.ENABLE_PROVIDER : DecisionKind.DISABLE_PROVIDER;
        }
    }

    record RemoveProvider(String providerId, boolean deleteFiles) implements Decision {
        @Override
        public DecisionKind kind() {
            return DecisionKind.REMOVE_PROVIDER;
        }
    }

    record InstallProviderDependencies(String providerId) implements Decision {
        @Override
        public DecisionKind kind() {
            return DecisionKind.INSTALL_PROVIDER_DEPS;
        }
    }
}
