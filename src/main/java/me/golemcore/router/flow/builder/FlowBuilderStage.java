package me.golemcore.router.flow.builder;

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

import me.golemcore.router.flow.FlowStage;

/**
 * Stages of the flow design conversation. {@link #REQUIREMENTS} is terminal:
 * once reached, every later turn continues the design discussion.
 */
public enum FlowBuilderStage implements FlowStage<FlowBuilderStage> {

    INTRO("intro"),
    REQUIREMENTS("requirements");

    private final String tag;

    FlowBuilderStage(String tag) {
        this.tag = tag;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public boolean isTerminal() {
        return this == REQUIREMENTS;
    }

    @Override
    public boolean canTransitionTo(FlowBuilderStage next) {
        return next == this || this == INTRO && next == REQUIREMENTS;
    }
}
