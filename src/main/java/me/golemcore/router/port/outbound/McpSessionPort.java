package me.golemcore.router.port.outbound;

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

import me.golemcore.router.domain.exception.TransportFailureException;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.ToolDescriptor;
import me.golemcore.router.domain.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Opens request-scoped sessions against tool-providers speaking the Model
 * Context Protocol.
 */
public interface McpSessionPort {

    /**
     * Open a session and complete the protocol handshake.
     *
     * @throws TransportFailureException
     *             if the provider cannot be spawned or reached, or the handshake
     *             fails or times out
     */
    McpSession open(ProviderDescriptor provider);

    /**
     * An open, initialized session. Closing it tears down the child process or
     * stream unconditionally.
     */
    interface McpSession extends AutoCloseable {

        /**
         * Introspect the live tool list ({@code tools/list}).
         */
        List<ToolDescriptor> listTools();

        /**
         * Invoke a tool ({@code tools/call}). A provider-reported error comes back
         * as a failed {@link ToolResult}; transport problems throw
         * {@link TransportFailureException}.
         */
        ToolResult callTool(String toolName, Map<String, Object> arguments);

        @Override
        void close();
    }
}
