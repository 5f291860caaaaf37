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

import java.util.List;

/**
 * Plan update delivered on the dedicated plan channel. Each message replaces
 * the previous plan as a whole; consumers apply last-write-wins.
 */
public record PlanMessage(List<TodoItem> todos, Metadata metadata) {

    public PlanMessage {
        todos = todos != null ? List.copyOf(todos) : List.of();
    }

    public static PlanMessage of(List<TodoItem> todos, long turnId, String description) {
        return new PlanMessage(todos, new Metadata(turnId, description));
    }

    /**
     * Turn in which the plan changed and an optional human-readable reason.
     */
    public record Metadata(long turnId, String description) {
    }
}
