package me.golemcore.agent.adapter.outbound.backend;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.loop.AgentConfig;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.Operation;
import me.golemcore.agent.port.outbound.BackendException;
import me.golemcore.agent.port.outbound.BackendPort;
import me.golemcore.agent.port.outbound.ConversationPort;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * No-op backend for testing and when no real backend is configured.
 *
 * <p>
 * Conversations answer every input with a fixed placeholder message and
 * complete the turn immediately. Nothing leaves the process.
 *
 * <p>
 * Backend ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpBackendAdapter implements BackendPort {

    public static final String BACKEND_ID = "none";
    public static final String PLACEHOLDER_REPLY = "[No backend configured]";

    @Override
    public String getBackendId() {
        return BACKEND_ID;
    }

    @Override
    public ConversationPort openConversation(AgentConfig config) {
        log.warn("NoOpBackendAdapter: openConversation() called - no backend configured");
        return new NoOpConversation("noop-" + UUID.randomUUID(), config.getModel());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    static final class NoOpConversation implements ConversationPort {

        private final String conversationId;
        private final BlockingQueue<BackendEvent> events = new LinkedBlockingQueue<>();
        private volatile boolean shutdown = false;

        NoOpConversation(String conversationId, String model) {
            this.conversationId = conversationId;
            events.add(new BackendEvent.SessionConfigured(conversationId, model));
        }

        @Override
        public String getConversationId() {
            return conversationId;
        }

        @Override
        public void submit(Operation operation) throws BackendException {
            if (shutdown) {
                throw new BackendException(BackendException.Kind.AGENT_DIED, "Conversation already shut down");
            }
            if (operation instanceof Operation.Shutdown) {
                shutdown = true;
                events.add(new BackendEvent.ShutdownComplete());
                return;
            }
            events.add(new BackendEvent.AgentMessage(PLACEHOLDER_REPLY));
            events.add(new BackendEvent.TaskComplete(PLACEHOLDER_REPLY));
        }

        @Override
        public BackendEvent nextEvent() throws InterruptedException {
            return events.take();
        }
    }
}
