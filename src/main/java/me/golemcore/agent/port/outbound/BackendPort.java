package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.loop.AgentConfig;

/**
 * Port for integrating with a reasoning backend. Each agent execution opens
 * its own conversation.
 */
public interface BackendPort {

    /**
     * Returns the backend identifier (e.g., "codex", "none").
     */
    String getBackendId();

    /**
     * Opens a new conversation configured from the agent configuration.
     */
    ConversationPort openConversation(AgentConfig config) throws BackendException;

    /**
     * Checks if the backend is configured and operational.
     */
    boolean isAvailable();
}
