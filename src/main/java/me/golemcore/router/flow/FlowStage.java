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

/**
 * A stage of a flow's state machine. Implemented by one enum per flow.
 *
 * @param <S>
 *            the implementing enum
 */
public interface FlowStage<S extends FlowStage<S>> {

    /**
     * Stable tag stored in {@link me.golemcore.router.domain.model.FlowState}.
     */
    String tag();

    /**
     * Terminal stages are absorbing: the engine never leaves them.
     */
    boolean isTerminal();

    /**
     * Whether the machine may move from this stage to {@code next}. Staying in
     * the same stage is always allowed.
     */
    boolean canTransitionTo(S next);
}
