package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agent.domain.loop.AgentConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Engine configuration bound from application.properties under the
 * {@code agent.*} prefix.
 *
 * <ul>
 * <li>{@link ModelProperties} - model selection and prompting</li>
 * <li>{@link LoopProperties} - turn limit, channel sizing, timing</li>
 * <li>{@link SandboxProperties} - working directory and tool policies</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /**
     * Backend used by {@code AgentFactory}, matched against
     * {@code BackendPort#getBackendId()}.
     */
    private String backend = "none";

    private ModelProperties model = new ModelProperties();
    private LoopProperties loop = new LoopProperties();
    private SandboxProperties sandbox = new SandboxProperties();

    @Data
    public static class ModelProperties {
        private String name = "gpt-5-mini";
        private String provider = "openai";
        private String systemPrompt;
        private boolean showRawReasoning = false;
    }

    @Data
    public static class LoopProperties {
        private int maxTurns = 100;
        private int channelCapacity = 100;
        private Duration pausePollInterval = Duration.ofMillis(100);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class SandboxProperties {
        /**
         * Defaults to the process working directory when blank.
         */
        private String workingDirectory;
        private AgentConfig.SandboxPolicy policy = AgentConfig.SandboxPolicy.WORKSPACE_WRITE;
        private AgentConfig.ApprovalPolicy approvalPolicy = AgentConfig.ApprovalPolicy.NEVER;
    }
}
