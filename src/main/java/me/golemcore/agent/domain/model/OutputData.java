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
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;

/**
 * Payload of an {@link OutputMessage}. Exactly one variant per message.
 *
 * <p>
 * Variants:
 * <ul>
 * <li>{@link Start} - the backend session started</li>
 * <li>{@link Primary} / {@link PrimaryDelta} - assistant text, complete or
 * streamed</li>
 * <li>{@link Detail}, {@link Reasoning} - auxiliary text</li>
 * <li>{@link ToolStart}, {@link ToolOutput}, {@link ToolComplete} - tool
 * lifecycle</li>
 * <li>{@link TodoUpdate} - inline todo list</li>
 * <li>{@link Completed}, {@link Error} - terminal for the turn</li>
 * </ul>
 */
public interface OutputData {

    /**
     * Stable lowercase name of the variant, used for type-based filtering.
     */
    String typeName();

    default boolean isTerminal() {
        return this instanceof Completed || this instanceof Error;
    }

    default boolean isError() {
        return this instanceof Error;
    }

    static OutputData start() {
        return Start.INSTANCE;
    }

    static OutputData completed() {
        return Completed.INSTANCE;
    }

    record Start() implements OutputData {
        static final Start INSTANCE = new Start();

        @Override
        public String typeName() {
            return "start";
        }
    }

    record Primary(String text) implements OutputData {
        @Override
        public String typeName() {
            return "primary";
        }
    }

    record PrimaryDelta(String text) implements OutputData {
        @Override
        public String typeName() {
            return "delta";
        }
    }

    record Detail(String text) implements OutputData {
        @Override
        public String typeName() {
            return "detail";
        }
    }

    record Reasoning(String text) implements OutputData {
        @Override
        public String typeName() {
            return "reasoning";
        }
    }

    record ToolStart(String toolName, JsonNode arguments) implements OutputData {
        public ToolStart {
            arguments = arguments != null ? arguments : NullNode.getInstance();
        }

        @Override
        public String typeName() {
            return "tool_start";
        }
    }

    record ToolOutput(String toolName, String output) implements OutputData {
        @Override
        public String typeName() {
            return "tool_output";
        }
    }

    record ToolComplete(String toolName, String result) implements OutputData {
        @Override
        public String typeName() {
            return "tool_complete";
        }
    }

    record TodoUpdate(List<TodoItem> todos) implements OutputData {
        public TodoUpdate {
            todos = todos != null ? List.copyOf(todos) : List.of();
        }

        @Override
        public String typeName() {
            return "todo_update";
        }
    }

    record Completed() implements OutputData {
        static final Completed INSTANCE = new Completed();

        @Override
        public String typeName() {
            return "completed";
        }
    }

    record Error(OutputError error) implements OutputData {
        @Override
        public String typeName() {
            return "error";
        }
    }
}
