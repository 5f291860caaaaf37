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
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.TodoItem;
import me.golemcore.agent.domain.model.TodoStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses todo lists out of {@code update_plan} tool arguments and backend plan
 * updates.
 *
 * <p>
 * Expected argument shape:
 *
 * <pre>
 * {"plan": [{"step": "...", "status": "pending|in_progress|completed"}, ...]}
 * </pre>
 */
public final class PlanExtractor {

    public static final String UPDATE_PLAN_TOOL = "update_plan";

    private static final String PLAN_FIELD = "plan";
    private static final String STEP_FIELD = "step";
    private static final String STATUS_FIELD = "status";

    private PlanExtractor() {
    }

    public static boolean isPlanTool(String toolName) {
        return UPDATE_PLAN_TOOL.equals(toolName);
    }

    /**
     * Extracts the todo list from tool arguments.
     *
     * @return empty if the arguments carry no {@code plan} array; items without
     *         a textual step or status are skipped
     */
    public static Optional<List<TodoItem>> fromArguments(JsonNode arguments) {
        if (arguments == null || !arguments.isObject()) {
            return Optional.empty();
        }
        JsonNode plan = arguments.get(PLAN_FIELD);
        if (plan == null || !plan.isArray()) {
            return Optional.empty();
        }

        List<TodoItem> todos = new ArrayList<>();
        for (JsonNode item : plan) {
            JsonNode step = item.get(STEP_FIELD);
            JsonNode status = item.get(STATUS_FIELD);
            if (step == null || !step.isTextual() || status == null || !status.isTextual()) {
                continue;
            }
            todos.add(new TodoItem(step.asText(), TodoStatus.fromWire(status.asText())));
        }
        return Optional.of(todos);
    }

    public static List<TodoItem> fromPlanItems(List<BackendEvent.PlanItem> items) {
        List<TodoItem> todos = new ArrayList<>(items.size());
        for (BackendEvent.PlanItem item : items) {
            TodoStatus status = item.status() != null ? item.status() : TodoStatus.PENDING;
            todos.add(new TodoItem(item.step(), status));
        }
        return todos;
    }
}
