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

import java.util.Map;

/**
 * Progress of one flow, threaded turn to turn by the caller.
 *
 * <p>
 * {@code stage} is the tag of the flow's stage enum; {@code null} means the
 * flow has not run yet and starts at its initial stage with {@code params} as
 * seed values.
 */
public record FlowState(String flowId, String stage, Map<String, Object> params) {

    public FlowState {
        params = params != null ? java.util.Collections.unmodifiableMap(new java.util.LinkedHashMap<>(params))
                : Map.of();
    }

    public static FlowState initial(String flowId, Map<String, Object> seedParams) {
        return new FlowState(flowId, null, seedParams);
    }

    public boolean isStarted() {
        return stage != null;
    }
}
