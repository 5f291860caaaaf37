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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.AgentErrorKind;
import me.golemcore.agent.domain.model.AgentException;
import me.golemcore.agent.domain.model.SessionPhase;

import java.time.Duration;

/**
 * Control surface of one agent session. Owns the shared session state (phase,
 * stop flag, turn counter) behind a single monitor so every transition is one
 * atomic step.
 *
 * <p>
 * Phases:
 * <ul>
 * <li>INITIALIZED -&gt; RUNNING when the execution loop starts, or PAUSED if a
 * pause was requested before the start</li>
 * <li>RUNNING &lt;-&gt; PAUSED via {@link #pause()} / {@link #resume()}</li>
 * <li>STOPPED via {@link #stop()} or input exhaustion, ERRORED on an
 * unrecoverable backend failure; both are terminal</li>
 * </ul>
 *
 * <p>
 * All public methods are safe to call from any thread.
 */
@Slf4j
public class AgentController {

    private final Object lock = new Object();

    private SessionPhase phase = SessionPhase.INITIALIZED;
    private boolean stopRequested = false;
    private boolean started = false;
    private long turnCount = 0;

    public SessionPhase phase() {
        synchronized (lock) {
            return phase;
        }
    }

    public long turnCount() {
        synchronized (lock) {
            return turnCount;
        }
    }

    public boolean isStopRequested() {
        synchronized (lock) {
            return stopRequested;
        }
    }

    /**
     * Requests cooperative cancellation. The loop observes the flag at its next
     * check point. Calling it again has no further effect.
     */
    public void stop() {
        synchronized (lock) {
            if (stopRequested && phase.isTerminal()) {
                return;
            }
            stopRequested = true;
            if (phase != SessionPhase.ERRORED) {
                phase = SessionPhase.STOPPED;
            }
            lock.notifyAll();
        }
        log.info("[Controller] stop requested");
    }

    /**
     * Requests a pause. New inputs are held back until {@link #resume()}. Has no
     * effect once the session is stopped or errored.
     */
    public void pause() {
        synchronized (lock) {
            if (phase.isTerminal()) {
                log.debug("[Controller] pause ignored in phase {}", phase);
                return;
            }
            phase = SessionPhase.PAUSED;
        }
        log.info("[Controller] paused");
    }

    public void resume() {
        synchronized (lock) {
            if (phase != SessionPhase.PAUSED) {
                return;
            }
            phase = SessionPhase.RUNNING;
            lock.notifyAll();
        }
        log.info("[Controller] resumed");
    }

    /**
     * Marks the loop as started. A pause requested before the start is kept, so
     * the loop begins with its input held back.
     */
    void start() throws AgentException {
        synchronized (lock) {
            if (phase.isTerminal()) {
                throw new AgentException(AgentErrorKind.SESSION_TERMINATED,
                        "Agent session already finished in phase " + phase);
            }
            if (started) {
                throw AgentException.alreadyRunning();
            }
            started = true;
            if (phase != SessionPhase.PAUSED) {
                phase = SessionPhase.RUNNING;
            }
        }
    }

    void recordTurn() {
        synchronized (lock) {
            turnCount++;
        }
    }

    /**
     * Blocks while the session is paused. Wakes on resume or stop, and at least
     * once per {@code pollInterval}.
     *
     * @return {@code true} if the session may proceed, {@code false} if a stop
     *         was requested
     */
    boolean awaitNotPaused(Duration pollInterval) throws InterruptedException {
        long pollMillis = Math.max(1, pollInterval.toMillis());
        synchronized (lock) {
            while (phase == SessionPhase.PAUSED && !stopRequested) {
                lock.wait(pollMillis);
            }
            return !stopRequested;
        }
    }

    /**
     * Final transition once the loop has shut down. Also raises the stop flag so
     * any straggling activity exits.
     */
    void markStopped() {
        synchronized (lock) {
            stopRequested = true;
            if (phase != SessionPhase.ERRORED) {
                phase = SessionPhase.STOPPED;
            }
            lock.notifyAll();
        }
    }

    /**
     * Moves to ERRORED and requests stop so the input side winds down.
     */
    void markErrored() {
        synchronized (lock) {
            phase = SessionPhase.ERRORED;
            stopRequested = true;
            lock.notifyAll();
        }
    }
}
