package me.golemcore.agent.domain.service;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.loop.Agent;
import me.golemcore.agent.domain.loop.AgentConfig;
import me.golemcore.agent.domain.model.AgentErrorKind;
import me.golemcore.agent.domain.model.AgentException;
import me.golemcore.agent.domain.session.AgentSession;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.BackendPort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Creates agents and sessions from the bound {@link AgentProperties} and the
 * backends registered in the context.
 */
@Service
@Slf4j
public class AgentFactory {

    private final AgentProperties properties;
    private final Map<String, BackendPort> backends = new LinkedHashMap<>();
    private final ExecutorService agentExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AgentFactory(AgentProperties properties, List<BackendPort> backendPorts, ExecutorService agentExecutor,
            ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.agentExecutor = agentExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (BackendPort backend : backendPorts) {
            backends.put(backend.getBackendId(), backend);
        }
        log.info("[AgentFactory] registered backends: {}", backends.keySet());
    }

    /**
     * Configuration derived from properties. Callers may adjust it with
     * {@code toBuilder()} before creating an agent.
     */
    public AgentConfig defaultConfig() {
        AgentProperties.ModelProperties model = properties.getModel();
        AgentProperties.LoopProperties loop = properties.getLoop();
        AgentProperties.SandboxProperties sandbox = properties.getSandbox();

        AgentConfig.AgentConfigBuilder builder = AgentConfig.builder()
                .model(model.getName())
                .modelProvider(model.getProvider())
                .systemPrompt(model.getSystemPrompt())
                .showRawReasoning(model.isShowRawReasoning())
                .maxTurns(loop.getMaxTurns())
                .channelCapacity(loop.getChannelCapacity())
                .pausePollInterval(loop.getPausePollInterval())
                .shutdownTimeout(loop.getShutdownTimeout())
                .sandboxPolicy(sandbox.getPolicy())
                .approvalPolicy(sandbox.getApprovalPolicy());
        String workingDirectory = sandbox.getWorkingDirectory();
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            builder.workingDirectory(Path.of(workingDirectory));
        }
        return builder.build();
    }

    public Agent createAgent() throws AgentException {
        return createAgent(defaultConfig());
    }

    /**
     * @throws AgentException
     *             {@code CONFIG_ERROR} if the configured backend is not
     *             registered or the configuration is invalid
     */
    public Agent createAgent(AgentConfig config) throws AgentException {
        validate(config);
        BackendPort backend = findBackend(properties.getBackend())
                .orElseThrow(() -> new AgentException(AgentErrorKind.CONFIG_ERROR,
                        "Unknown backend: " + properties.getBackend() + ", available: " + backends.keySet()));
        if (!backend.isAvailable()) {
            log.warn("[AgentFactory] backend '{}' is not available", backend.getBackendId());
        }
        return new Agent(config, backend, agentExecutor);
    }

    public AgentSession createSession() throws AgentException {
        return new AgentSession(createAgent(), objectMapper, clock);
    }

    public AgentSession loadSession(Path path) throws AgentException {
        return AgentSession.load(path, createAgent(), objectMapper, clock);
    }

    public Optional<BackendPort> findBackend(String backendId) {
        return Optional.ofNullable(backends.get(backendId));
    }

    private static void validate(AgentConfig config) throws AgentException {
        if (config.getMaxTurns() <= 0) {
            throw new AgentException(AgentErrorKind.CONFIG_ERROR, "maxTurns must be positive");
        }
        if (config.getChannelCapacity() <= 0) {
            throw new AgentException(AgentErrorKind.CONFIG_ERROR, "channelCapacity must be positive");
        }
        if (config.getPausePollInterval() == null || config.getPausePollInterval().isNegative()
                || config.getPausePollInterval().isZero()) {
            throw new AgentException(AgentErrorKind.CONFIG_ERROR, "pausePollInterval must be positive");
        }
        if (config.getShutdownTimeout() == null || config.getShutdownTimeout().isNegative()) {
            throw new AgentException(AgentErrorKind.CONFIG_ERROR, "shutdownTimeout must not be negative");
        }
        if (config.getModel() == null || config.getModel().isBlank()) {
            throw new AgentException(AgentErrorKind.CONFIG_ERROR, "model must be set");
        }
    }
}
