package me.golemcore.agent.domain.event;

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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputError;
import me.golemcore.agent.domain.model.OutputMessage;
import me.golemcore.agent.domain.model.PlanMessage;
import me.golemcore.agent.domain.model.TodoItem;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Maps backend events to the output vocabulary. Stateful only in the running
 * turn id, which counts the {@code TaskComplete} events seen so far.
 *
 * <p>
 * Command execution events are normalized into the generic tool vocabulary
 * under the tool name {@value #SHELL_TOOL}. Unknown events produce nothing.
 *
 * <p>
 * Not thread-safe: one instance belongs to one event activity.
 */
@Slf4j
public class EventTranslator {

    public static final String SHELL_TOOL = "shell";

    static final String PLAN_UPDATED_DESCRIPTION = "Plan updated via update_plan tool";
    static final String PLAN_COMPLETED_DESCRIPTION = "Plan completed via update_plan tool";

    private long currentTurnId = 0;

    public long currentTurnId() {
        return currentTurnId;
    }

    public Translation translate(BackendEvent event) {
        if (event instanceof BackendEvent.SessionConfigured) {
            return single(OutputData.start());
        }
        if (event instanceof BackendEvent.AgentMessage message) {
            return single(new OutputData.Primary(message.message()));
        }
        if (event instanceof BackendEvent.AgentMessageDelta delta) {
            return single(new OutputData.PrimaryDelta(delta.delta()));
        }
        if (event instanceof BackendEvent.AgentReasoning reasoning) {
            return single(new OutputData.Reasoning(reasoning.text()));
        }
        if (event instanceof BackendEvent.McpToolCallBegin begin) {
            return translateToolBegin(begin);
        }
        if (event instanceof BackendEvent.McpToolCallEnd end) {
            return translateToolEnd(end);
        }
        if (event instanceof BackendEvent.ExecCommandBegin exec) {
            return single(new OutputData.ToolStart(SHELL_TOOL, commandArguments(exec.command())));
        }
        if (event instanceof BackendEvent.ExecCommandOutputDelta delta) {
            return single(new OutputData.ToolOutput(SHELL_TOOL, decodeChunk(delta.chunk())));
        }
        if (event instanceof BackendEvent.ExecCommandEnd end) {
            return single(new OutputData.ToolComplete(SHELL_TOOL, "exit code: " + end.exitCode()));
        }
        if (event instanceof BackendEvent.TaskComplete) {
            Translation translation = single(OutputData.completed());
            currentTurnId++;
            return translation;
        }
        if (event instanceof BackendEvent.PlanUpdate update) {
            List<TodoItem> todos = PlanExtractor.fromPlanItems(update.plan());
            return new Translation(List.of(), PlanMessage.of(todos, currentTurnId, update.explanation()));
        }
        if (event instanceof BackendEvent.Error error) {
            return single(new OutputData.Error(OutputError.unknown(error.message())));
        }
        if (event instanceof BackendEvent.TurnAborted) {
            return single(new OutputData.Error(OutputError.interrupted()));
        }

        log.debug("[Translator] ignoring event: {}", event);
        return Translation.empty();
    }

    private Translation translateToolBegin(BackendEvent.McpToolCallBegin begin) {
        BackendEvent.ToolInvocation invocation = begin.invocation();
        PlanMessage plan = planFrom(invocation, PLAN_UPDATED_DESCRIPTION);
        OutputMessage output = OutputMessage.of(currentTurnId,
                new OutputData.ToolStart(invocation.tool(), invocation.arguments()));
        return new Translation(List.of(output), plan);
    }

    private Translation translateToolEnd(BackendEvent.McpToolCallEnd end) {
        BackendEvent.ToolInvocation invocation = end.invocation();
        BackendEvent.ToolCallResult result = end.result();

        String resultText;
        if (result != null && result.isSuccess()) {
            resultText = firstText(result.content());
        } else {
            String message = result != null ? result.errorMessage() : "no result";
            resultText = "Error: " + message;
        }

        // Derived from the arguments, not the result payload, so a failed call
        // still reports the plan it attempted.
        PlanMessage plan = planFrom(invocation, PLAN_COMPLETED_DESCRIPTION);
        OutputMessage output = OutputMessage.of(currentTurnId,
                new OutputData.ToolComplete(invocation.tool(), resultText));
        return new Translation(List.of(output), plan);
    }

    private PlanMessage planFrom(BackendEvent.ToolInvocation invocation, String description) {
        if (!PlanExtractor.isPlanTool(invocation.tool())) {
            return null;
        }
        Optional<List<TodoItem>> todos = PlanExtractor.fromArguments(invocation.arguments());
        return todos.map(items -> PlanMessage.of(items, currentTurnId, description)).orElse(null);
    }

    private Translation single(OutputData data) {
        return Translation.of(OutputMessage.of(currentTurnId, data));
    }

    private static String firstText(List<BackendEvent.ContentBlock> content) {
        if (content.isEmpty()) {
            return "";
        }
        BackendEvent.ContentBlock first = content.get(0);
        return first.isText() && first.text() != null ? first.text() : "";
    }

    private static JsonNode commandArguments(List<String> command) {
        ObjectNode arguments = JsonNodeFactory.instance.objectNode();
        ArrayNode parts = arguments.putArray("command");
        command.forEach(parts::add);
        return arguments;
    }

    /**
     * Decodes command output as UTF-8. Malformed sequences become U+FFFD.
     */
    static String decodeChunk(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return "";
        }
        return new String(chunk, StandardCharsets.UTF_8);
    }
}
