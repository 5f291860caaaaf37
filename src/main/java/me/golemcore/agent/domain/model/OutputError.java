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

import me.golemcore.agent.port.outbound.BackendException;

import java.util.Objects;

/**
 * Error carried by an {@code Error} output message. Errors reported as data
 * never terminate the engine by themselves.
 */
public record OutputError(OutputErrorKind kind, String message) {

    public OutputError {
        Objects.requireNonNull(kind, "kind");
    }

    public static OutputError turnLimitExceeded() {
        return new OutputError(OutputErrorKind.TURN_LIMIT_EXCEEDED, null);
    }

    public static OutputError interrupted() {
        return new OutputError(OutputErrorKind.INTERRUPTED, null);
    }

    public static OutputError toolError(String message) {
        return new OutputError(OutputErrorKind.TOOL_ERROR, message);
    }

    public static OutputError modelError(String message) {
        return new OutputError(OutputErrorKind.MODEL_ERROR, message);
    }

    public static OutputError networkError(String message) {
        return new OutputError(OutputErrorKind.NETWORK_ERROR, message);
    }

    public static OutputError authenticationError(String message) {
        return new OutputError(OutputErrorKind.AUTHENTICATION_ERROR, message);
    }

    public static OutputError configurationError(String message) {
        return new OutputError(OutputErrorKind.CONFIGURATION_ERROR, message);
    }

    public static OutputError unknown(String message) {
        return new OutputError(OutputErrorKind.UNKNOWN, message);
    }

    /**
     * Classifies a backend failure for delivery on the output stream.
     */
    public static OutputError from(BackendException e) {
        return switch (e.getKind()) {
        case INTERRUPTED -> interrupted();
        case AGENT_DIED -> unknown("Internal agent died");
        case STREAM -> networkError(e.getMessage());
        case TOOL -> toolError(e.getMessage());
        case MODEL -> modelError(e.getMessage());
        case OTHER -> unknown(e.getMessage());
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
        case TURN_LIMIT_EXCEEDED -> "Turn limit exceeded";
        case TOOL_ERROR -> "Tool error: " + message;
        case MODEL_ERROR -> "Model error: " + message;
        case NETWORK_ERROR -> "Network error: " + message;
        case AUTHENTICATION_ERROR -> "Authentication error: " + message;
        case INTERRUPTED -> "Agent was interrupted";
        case CONFIGURATION_ERROR -> "Configuration error: " + message;
        case UNKNOWN -> "Unknown error: " + message;
        };
    }
}
