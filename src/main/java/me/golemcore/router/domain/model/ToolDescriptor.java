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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A callable operation exposed by a provider, either declared statically or
 * discovered through {@code tools/list} when a session is opened.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolDescriptor {

    private String name;
    private String description;

    @Builder.Default
    private List<ToolParameter> parameters = new ArrayList<>();

    public List<String> requiredParameterNames() {
        if (parameters == null) {
            return List.of();
        }
        return parameters.stream()
                .filter(ToolParameter::isRequired)
                .map(ToolParameter::getName)
                .toList();
    }

    public Optional<ToolParameter> findParameter(String parameterName) {
        if (parameters == null) {
            return Optional.empty();
        }
        return parameters.stream()
                .filter(p -> p.getName().equals(parameterName))
                .findFirst();
    }
}
