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

/**
 * Failure reported by the reasoning backend.
 */
public class BackendException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Kind kind;

    public BackendException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Backend failure categories.
     */
    public enum Kind {
        /**
         * The operation was cancelled cooperatively.
         */
        INTERRUPTED,

        /**
         * The event stream broke (transport or network failure).
         */
        STREAM,

        /**
         * The backend agent process is gone.
         */
        AGENT_DIED,

        TOOL,

        MODEL,

        OTHER
    }
}
