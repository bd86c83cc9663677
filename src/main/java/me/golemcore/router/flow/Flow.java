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

import me.golemcore.router.domain.model.FlowDescriptor;

import java.util.Arrays;
import java.util.Optional;

/**
 * A multi-turn guided task implemented as an explicit state machine over the
 * stage enum {@code S}, carrying typed parameters {@code P} from turn to turn.
 *
 * <p>
 * Implementations are stateless Spring beans: all progress lives in the
 * parameters and the stage returned from {@link #execute}. Parameters must be
 * convertible to and from a JSON object by Jackson, because the engine stores
 * them in {@link me.golemcore.router.domain.model.FlowState} between turns.
 *
 * @param <S>
 *            stage enum
 * @param <P>
 *            parameters type
 */
public interface Flow<S extends Enum<S> & FlowStage<S>, P> {

    FlowDescriptor getDescriptor();

    Class<S> getStageType();

    Class<P> getParamsType();

    S getInitialStage();

    /**
     * Run {@code stage} for the current user message. Unparseable oracle output
     * is handled inside the flow with defaults; only
     * {@link me.golemcore.router.domain.exception.OracleUnavailableException}
     * is expected to escape.
     */
    FlowStep<S, P> execute(S stage, P params, FlowContext context);

    default String getId() {
        return getDescriptor().id();
    }

    default Optional<S> stageFor(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(getStageType().getEnumConstants())
                .filter(stage -> stage.tag().equals(tag))
                .findFirst();
    }
}
