package me.golemcore.router.adapter.outbound.mcp;

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
import me.golemcore.router.domain.model.TransportSpec;
import me.golemcore.router.infrastructure.config.RouterProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * MCP session over a spawned child process: newline-delimited JSON-RPC on
 * stdin/stdout, stderr drained to DEBUG.
 *
 * <p>
 * The child is started from the provider's transport command (default
 * {@code node}) with the provider's {@code path}, when set, prepended to the
 * arguments. Entries of the provider's {@code config} map are added to the
 * child environment.
 */
@Slf4j
public class StdioMcpSession extends AbstractMcpSession {

    static final String DEFAULT_COMMAND = "node";

    private final ProviderDescriptor provider;

    private Process process;
    private BufferedWriter writer;
    private Thread readerThread;
    private Thread stderrThread;

    public StdioMcpSession(ProviderDescriptor provider, ObjectMapper objectMapper,
            RouterProperties.McpProperties settings) {
        super(provider.getId(), objectMapper, settings);
        this.provider = provider;
    }

    static List<String> buildCommandLine(ProviderDescriptor provider) {
        TransportSpec transport = provider.getTransport();
        String command = transport != null && transport.getCommand() != null && !transport.getCommand().isBlank()
                ? transport.getCommand()
                : DEFAULT_COMMAND;

        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        if (provider.getPath() != null && !provider.getPath().isBlank()) {
            commandLine.add(provider.getPath());
        }
        if (transport != null && transport.getArgs() != null) {
            commandLine.addAll(transport.getArgs());
        }
        return commandLine;
    }

    @Override
    protected void openTransport() {
        List<String> commandLine = buildCommandLine(provider);
        log.info("[MCP:{}] Starting provider: {}", providerId, String.join(" ", commandLine));

        ProcessBuilder pb = new ProcessBuilder(commandLine);
        pb.redirectErrorStream(false);
        if (provider.getConfig() != null) {
            pb.environment().putAll(provider.getConfig());
        }

        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TransportFailureException(
                    "Cannot start provider " + providerId + " (" + commandLine.get(0) + "): " + e.getMessage(), e);
        }
        running = true;

        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        readerThread = new Thread(this::readLoop, "mcp-reader-" + providerId);
        readerThread.setDaemon(true);
        readerThread.start();

        stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + providerId);
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    protected void transmit(String json) throws IOException {
        if (writer == null) {
            throw new IOException("Provider process is not running");
        }
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                handleMessage(line);
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", providerId, e.getMessage());
            }
        } finally {
            failPending(new IOException("Provider process closed its output"));
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", providerId, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", providerId, e.getMessage());
            }
        }
    }

    @Override
    protected void shutdown() {
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", providerId, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(settings.getShutdownGraceSeconds(), TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    boolean isProcessAlive() {
        return process != null && process.isAlive();
    }
}
