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
 * Result of running one stage.
 *
 * @param response
 *            text for the user, may be empty when the next stage runs
 *            immediately
 * @param nextStage
 *            stage to continue from
 * @param params
 *            accumulated parameters after this stage
 * @param continueImmediately
 *            run {@code nextStage} in the same turn instead of waiting for the
 *            next user message
 */
public record FlowStep<S extends Enum<S> & FlowStage<S>, P>(String response, S nextStage, P params,
        boolean continueImmediately) {

    public static <S extends Enum<S> & FlowStage<S>, P> FlowStep<S, P> reply(String response, S nextStage,
            P params) {
        return new FlowStep<>(response, nextStage, params, false);
    }

    public static <S extends Enum<S> & FlowStage<S>, P> FlowStep<S, P> chain(String response, S nextStage,
            P params) {
        return new FlowStep<>(response, nextStage, params, true);
    }
}
