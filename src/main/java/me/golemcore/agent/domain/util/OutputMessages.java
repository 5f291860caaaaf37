package me.golemcore.agent.domain.util;

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
import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helpers for inspecting and rendering output messages.
 */
public final class OutputMessages {

    private static final Set<String> SHELL_TOOLS = Set.of("shell", "bash");

    // CSI sequences, OSC sequences (BEL or ST terminated), and two-byte escapes
    private static final Pattern ANSI_ESCAPE = Pattern.compile(
            "\u001B\\[[0-?]*[ -/]*[@-~]"
                    + "|\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)"
                    + "|\u001B[@-Z\\\\-_]");

    private OutputMessages() {
    }

    public static String cleanAnsi(String text) {
        if (text == null || text.indexOf('\u001B') < 0) {
            return text;
        }
        return ANSI_ESCAPE.matcher(text).replaceAll("");
    }

    /**
     * Extracts the command line of a shell tool start. The {@code command}
     * argument may be a string or an array of strings, which is joined with
     * spaces.
     *
     * @return a single-element list, or empty for any other message
     */
    public static List<String> extractCommands(OutputMessage message) {
        if (!(message.data() instanceof OutputData.ToolStart start) || !SHELL_TOOLS.contains(start.toolName())) {
            return List.of();
        }
        JsonNode command = start.arguments().get("command");
        if (command == null) {
            return List.of();
        }
        if (command.isTextual()) {
            return List.of(command.asText());
        }
        if (command.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode part : command) {
                if (part.isTextual()) {
                    parts.add(part.asText());
                }
            }
            return List.of(String.join(" ", parts));
        }
        return List.of();
    }

    /**
     * Shortens long tool output to its first and last lines.
     *
     * <p>
     * With more than {@code maxLines} lines, keeps the first
     * {@code maxLines / 2} and the remaining tail, separated by an
     * {@code ... (N lines omitted) ...} marker.
     */
    public static String formatToolOutput(String output, int maxLines) {
        List<String> lines = lines(output);
        if (lines.size() <= maxLines) {
            return output;
        }

        int headCount = maxLines / 2;
        int tailCount = maxLines - headCount;
        StringBuilder result = new StringBuilder();
        for (String line : lines.subList(0, headCount)) {
            result.append(line).append('\n');
        }
        result.append("\n... (").append(lines.size() - maxLines).append(" lines omitted) ...\n\n");
        for (String line : lines.subList(lines.size() - tailCount, lines.size())) {
            result.append(line).append('\n');
        }
        return result.toString();
    }

    /**
     * Wraps text at word boundaries. Words longer than {@code width} are split.
     */
    public static List<String> wrapText(String text, int width) {
        if (text == null || text.isEmpty() || width <= 0) {
            return List.of("");
        }

        List<String> result = new ArrayList<>();
        for (String line : lines(text)) {
            if (line.length() <= width) {
                result.add(line);
                continue;
            }
            StringBuilder current = new StringBuilder();
            for (String word : line.trim().split("\\s+")) {
                if (word.isEmpty()) {
                    continue;
                }
                if (current.length() == 0) {
                    if (word.length() > width) {
                        for (int start = 0; start < word.length(); start += width) {
                            result.add(word.substring(start, Math.min(word.length(), start + width)));
                        }
                    } else {
                        current.append(word);
                    }
                } else if (current.length() + 1 + word.length() <= width) {
                    current.append(' ').append(word);
                } else {
                    result.add(current.toString());
                    current.setLength(0);
                    if (word.length() > width) {
                        for (int start = 0; start < word.length(); start += width) {
                            result.add(word.substring(start, Math.min(word.length(), start + width)));
                        }
                    } else {
                        current.append(word);
                    }
                }
            }
            if (current.length() > 0) {
                result.add(current.toString());
            }
        }
        return result.isEmpty() ? List.of("") : result;
    }

    public static boolean isToolMessage(OutputMessage message) {
        OutputData data = message.data();
        return data instanceof OutputData.ToolStart
                || data instanceof OutputData.ToolOutput
                || data instanceof OutputData.ToolComplete;
    }

    public static Optional<String> toolName(OutputMessage message) {
        OutputData data = message.data();
        if (data instanceof OutputData.ToolStart start) {
            return Optional.of(start.toolName());
        }
        if (data instanceof OutputData.ToolOutput output) {
            return Optional.of(output.toolName());
        }
        if (data instanceof OutputData.ToolComplete complete) {
            return Optional.of(complete.toolName());
        }
        return Optional.empty();
    }

    /**
     * One-line human-readable rendering, e.g. for console logs.
     */
    public static String format(OutputMessage message) {
        OutputData data = message.data();
        if (data instanceof OutputData.Primary primary) {
            return primary.text();
        }
        if (data instanceof OutputData.PrimaryDelta delta) {
            return delta.text();
        }
        if (data instanceof OutputData.ToolStart start) {
            return "Running: " + start.toolName();
        }
        if (data instanceof OutputData.ToolOutput output) {
            return output.toolName() + ": " + output.output();
        }
        if (data instanceof OutputData.ToolComplete complete) {
            return complete.toolName() + " completed";
        }
        if (data instanceof OutputData.Error error) {
            return "Error: " + error.error();
        }
        if (data instanceof OutputData.Completed) {
            return "Completed";
        }
        if (data instanceof OutputData.Start) {
            return "Starting...";
        }
        return "";
    }

    private static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                end = text.length();
            }
            String line = text.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
            start = end + 1;
        }
        return lines;
    }
}
