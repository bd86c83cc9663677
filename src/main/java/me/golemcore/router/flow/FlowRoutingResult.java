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

import me.golemcore.router.domain.model.FlowState;

/**
 * What the flow router decided for one user message.
 */
public record FlowRoutingResult(Outcome outcome, FlowState state, String directResponse) {

    public enum Outcome {
        /** Run the flow in {@link #state()}. */
        USE_FLOW,
        /** Not a flow request, continue with ordinary routing. */
        NO_FLOW,
        /** Answer with {@link #directResponse()} and stop. */
        DIRECT_RESPONSE,
        /** The user left the active flow; clear it and answer. */
        EXIT_FLOW
    }

    public static FlowRoutingResult useFlow(FlowState state) {
        return new FlowRoutingResult(Outcome.USE_FLOW, state, null);
    }

    public static FlowRoutingResult noFlow() {
        return new FlowRoutingResult(Outcome.NO_FLOW, null, null);
    }

    public static FlowRoutingResult direct(String response) {
        return new FlowRoutingResult(Outcome.DIRECT_RESPONSE, null, response);
    }

    public static FlowRoutingResult exit(String response) {
        return new FlowRoutingResult(Outcome.EXIT_FLOW, null, response);
    }
}
