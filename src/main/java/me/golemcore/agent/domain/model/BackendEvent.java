package me.golemcore.agent.domain.model;

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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Event produced by the reasoning backend, in the backend's own order.
 * Backends may emit kinds this engine does not know about; those are carried
 * as {@link Other} and ignored by the translator.
 */
public interface BackendEvent {

    record SessionConfigured(String sessionId, String model) implements BackendEvent {
    }

    record AgentMessage(String message) implements BackendEvent {
    }

    record AgentMessageDelta(String delta) implements BackendEvent {
    }

    record AgentReasoning(String text) implements BackendEvent {
    }

    record McpToolCallBegin(String callId, ToolInvocation invocation) implements BackendEvent {
    }

    record McpToolCallEnd(String callId, ToolInvocation invocation, ToolCallResult result)
            implements BackendEvent {
    }

    record ExecCommandBegin(String callId, List<String> command) implements BackendEvent {
        public ExecCommandBegin {
            command = command != null ? List.copyOf(command) : List.of();
        }
    }

    record ExecCommandOutputDelta(String callId, byte[] chunk) implements BackendEvent {
    }

    record ExecCommandEnd(String callId, int exitCode) implements BackendEvent {
    }

    record TaskComplete(String lastAgentMessage) implements BackendEvent {
    }

    record PlanUpdate(String explanation, List<PlanItem> plan) implements BackendEvent {
        public PlanUpdate {
            plan = plan != null ? List.copyOf(plan) : List.of();
        }
    }

    record Error(String message) implements BackendEvent {
    }

    record TurnAborted(String reason) implements BackendEvent {
    }

    /**
     * Final event after a shutdown request; nothing follows it.
     */
    record ShutdownComplete() implements BackendEvent {
    }

    /**
     * Event kind with no counterpart in the output vocabulary.
     */
    record Other(String type) implements BackendEvent {
    }

    /**
     * A tool name plus its raw JSON arguments (may be {@code null}).
     */
    record ToolInvocation(String server, String tool, JsonNode arguments) {
    }

    /**
     * Outcome of a tool call: either content blocks or a failure message.
     */
    record ToolCallResult(List<ContentBlock> content, String errorMessage) {

        public ToolCallResult {
            content = content != null ? List.copyOf(content) : List.of();
        }

        public static ToolCallResult success(List<ContentBlock> content) {
            return new ToolCallResult(content, null);
        }

        public static ToolCallResult failure(String errorMessage) {
            return new ToolCallResult(List.of(), errorMessage);
        }

        public boolean isSuccess() {
            return errorMessage == null;
        }
    }

    /**
     * Content block of a tool result. Only {@code text} blocks carry text.
     */
    record ContentBlock(String type, String text) {

        public static ContentBlock text(String text) {
            return new ContentBlock("text", text);
        }

        public static ContentBlock image(String data) {
            return new ContentBlock("image", data);
        }

        public boolean isText() {
            return "text".equals(type);
        }
    }

    record PlanItem(String step, TodoStatus status) {
    }
}
