package me.golemcore.agent.domain.loop;

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

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration parameters for one agent. Model and policy fields are passed
 * through to the backend when the conversation is opened; turn limit, channel
 * capacity and timing fields control the execution loop itself.
 */
@Data
@Builder(toBuilder = true)
public class AgentConfig {

    @Builder.Default
    private String model = "gpt-5-mini";

    @Builder.Default
    private String modelProvider = "openai";

    private String systemPrompt;

    @Builder.Default
    private int maxTurns = 100;

    @Builder.Default
    private Path workingDirectory = Path.of(System.getProperty("user.dir", "."));

    @Builder.Default
    private SandboxPolicy sandboxPolicy = SandboxPolicy.WORKSPACE_WRITE;

    @Builder.Default
    private ApprovalPolicy approvalPolicy = ApprovalPolicy.NEVER;

    @Builder.Default
    private boolean showRawReasoning = false;

    @Builder.Default
    private int channelCapacity = 100;

    @Builder.Default
    private Duration pausePollInterval = Duration.ofMillis(100);

    @Builder.Default
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    public static AgentConfig defaultConfig() {
        return AgentConfig.builder().build();
    }

    /**
     * Filesystem access granted to commands run by the backend.
     */
    public enum SandboxPolicy {
        DANGER_FULL_ACCESS, READ_ONLY, WORKSPACE_WRITE
    }

    /**
     * When the backend asks for approval before running a tool.
     */
    public enum ApprovalPolicy {
        NEVER, ON_FAILURE, ON_REQUEST, UNLESS_TRUSTED
    }
}
