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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TransportSpec {

    @Builder.Default
    private TransportType type = TransportType.STDIO;

    private String command;

    @Builder.Default
    private List<String> args = new ArrayList<>();

    private String url;

    public static TransportSpec stdio(String command, List<String> args) {
        return TransportSpec.builder()
                .type(TransportType.STDIO)
                .command(command)
                .args(args != null ? new ArrayList<>(args) : new ArrayList<>())
                .build();
    }

    public static TransportSpec sse(String url) {
        return TransportSpec.builder()
                .type(TransportType.SSE)
                .url(url)
                .build();
    }
}
