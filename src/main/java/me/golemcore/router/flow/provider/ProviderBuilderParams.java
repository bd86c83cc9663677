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

import me.golemcore.router.domain.model.ProviderDescriptor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data accumulated by the provider builder flow across turns.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderBuilderParams {

    /** Kind of provider the user asked for, seeded by flow routing. */
    private String serverType;

    /** Filesystem-safe provider name, also used as provider id. */
    private String serverName;

    private ProviderManifest manifest;

    /** Latest generated source. */
    private String code;

    /** Path of the saved source file, relative to the working directory. */
    private String sourcePath;

    /** Descriptor derived after saving, registered in the last step. */
    private ProviderDescriptor provider;

    private Boolean registered;
}
