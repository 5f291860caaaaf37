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

import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.Operation;

/**
 * Port for a single open conversation with the reasoning backend. The backend
 * accepts operations and produces a totally ordered event stream.
 */
public interface ConversationPort {

    /**
     * Returns the backend-assigned conversation identifier.
     */
    String getConversationId();

    /**
     * Submits a user input or a shutdown request.
     */
    void submit(Operation operation) throws BackendException;

    /**
     * Blocks until the next event is available. Safe to call repeatedly for the
     * lifetime of the conversation; must return promptly after
     * {@link Operation.Shutdown} was submitted.
     */
    BackendEvent nextEvent() throws BackendException, InterruptedException;
}
