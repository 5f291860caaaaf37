package me.golemcore.agent.domain.loop;

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

import me.golemcore.agent.domain.model.AgentErrorKind;
import me.golemcore.agent.domain.model.AgentException;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Returned by {@link Agent#execute}: the session controller plus a way to await
 * the end of the execution loop.
 */
public class ExecutionHandle {

    private final AgentController controller;
    private final Future<Void> completion;

    ExecutionHandle(AgentController controller, Future<Void> completion) {
        this.controller = controller;
        this.completion = completion;
    }

    public AgentController controller() {
        return controller;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Shorthand for {@code controller().stop()}.
     */
    public void stop() {
        controller.stop();
    }

    /**
     * Waits for the loop to finish.
     *
     * @throws AgentException
     *             the loop's own failure (e.g. {@code CONNECTION_ERROR}), or
     *             {@code INTERNAL_ERROR} if the wait was interrupted
     */
    public void join() throws AgentException {
        try {
            completion.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Interrupted while waiting for agent", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Agent execution was cancelled", e);
        }
    }

    /**
     * Waits at most {@code timeout} for the loop to finish.
     *
     * @return {@code true} if the loop finished, {@code false} on timeout
     */
    public boolean join(Duration timeout) throws AgentException {
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Interrupted while waiting for agent", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Agent execution was cancelled", e);
        }
    }

    private static AgentException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof AgentException agentException) {
            return agentException;
        }
        return new AgentException(AgentErrorKind.INTERNAL_ERROR, "Agent execution failed: " + cause, cause);
    }
}
