package me.golemcore.router.flow.provider;

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
 * Stages of guided provider creation, in order. Each stage may only stay put or
 * move to the stage right after it; {@link #COMPLETE} is absorbing.
 */
public enum ProviderBuilderStage implements FlowStage<ProviderBuilderStage> {

    INTRO("intro"),
    GATHERING_REQUIREMENTS("gathering_requirements"),
    CODE_GENERATION("code_generation"),
    SAVE_CODE("save_code"),
    REGISTER_SERVER("register_server"),
    COMPLETE("complete");

    private final String tag;

    ProviderBuilderStage(String tag) {
        this.tag = tag;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public boolean isTerminal() {
        return this == COMPLETE;
    }

    @Override
    public boolean canTransitionTo(ProviderBuilderStage next) {
        if (next == this) {
            return true;
        }
        return !isTerminal() && next.ordinal() == ordinal() + 1;
    }
}
