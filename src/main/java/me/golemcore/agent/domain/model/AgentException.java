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

/**
 * Failure of an engine lifecycle call (start, send, join, query). Errors that
 * happen while a session runs are delivered as {@link OutputError} data
 * instead.
 */
public class AgentException extends Exception {

    private static final long serialVersionUID = 1L;

    private final AgentErrorKind kind;
    private final transient OutputError outputError;

    public AgentException(AgentErrorKind kind, String message) {
        this(kind, message, null);
    }

    public AgentException(AgentErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.outputError = null;
    }

    private AgentException(OutputError outputError) {
        super(outputError.toString());
        this.kind = AgentErrorKind.OUTPUT_ERROR;
        this.outputError = outputError;
    }

    public static AgentException alreadyRunning() {
        return new AgentException(AgentErrorKind.ALREADY_RUNNING, "Agent is already running");
    }

    public static AgentException notRunning() {
        return new AgentException(AgentErrorKind.NOT_RUNNING, "Agent is not running");
    }

    public static AgentException channelClosed() {
        return new AgentException(AgentErrorKind.CHANNEL_ERROR, "Channel is closed");
    }

    public static AgentException fromOutput(OutputError error) {
        return new AgentException(error);
    }

    public AgentErrorKind getKind() {
        return kind;
    }

    /**
     * The output error that caused this exception, when {@link #getKind()} is
     * {@link AgentErrorKind#OUTPUT_ERROR}.
     */
    public OutputError getOutputError() {
        return outputError;
    }
}
