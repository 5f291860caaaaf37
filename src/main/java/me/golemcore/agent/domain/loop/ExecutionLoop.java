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
import me.golemcore.agent.domain.channel.MessageChannel;
import me.golemcore.agent.domain.event.EventTranslator;
import me.golemcore.agent.domain.event.Translation;
import me.golemcore.agent.domain.model.AgentErrorKind;
import me.golemcore.agent.domain.model.AgentException;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.InputMessage;
import me.golemcore.agent.domain.model.Operation;
import me.golemcore.agent.domain.model.OutputError;
import me.golemcore.agent.domain.model.OutputMessage;
import me.golemcore.agent.domain.model.PlanMessage;
import me.golemcore.agent.port.outbound.BackendException;
import me.golemcore.agent.port.outbound.BackendPort;
import me.golemcore.agent.port.outbound.ConversationPort;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One execution of an agent session against a backend conversation.
 *
 * <p>
 * Runs two activities:
 * <ul>
 * <li><b>input activity</b> (the calling thread): pulls inputs, honours
 * pause/stop and the turn limit, submits user input to the backend</li>
 * <li><b>event activity</b> (a task on the executor): pulls backend events,
 * translates them and delivers plan and output messages</li>
 * </ul>
 *
 * <p>
 * When the input side ends (exhausted, stopped, or turn limit reached) the loop
 * asks the backend to shut down, waits for the event activity up to the
 * configured shutdown timeout, and closes the output and plan channels.
 */
@Slf4j
class ExecutionLoop implements Callable<Void> {

    private final AgentConfig config;
    private final BackendPort backend;
    private final AgentController controller;
    private final ExecutorService executor;
    private final MessageChannel<InputMessage> input;
    private final MessageChannel<PlanMessage> plan;
    private final MessageChannel<OutputMessage> output;

    private volatile boolean shutdownSubmitted = false;

    ExecutionLoop(AgentConfig config, BackendPort backend, AgentController controller, ExecutorService executor,
            MessageChannel<InputMessage> input, MessageChannel<PlanMessage> plan,
            MessageChannel<OutputMessage> output) {
        this.config = config;
        this.backend = backend;
        this.controller = controller;
        this.executor = executor;
        this.input = input;
        this.plan = plan;
        this.output = output;
    }

    @Override
    public Void call() throws AgentException {
        ConversationPort conversation;
        try {
            conversation = backend.openConversation(config);
        } catch (BackendException e) {
            log.error("[Loop] failed to open conversation on backend '{}': {}", backend.getBackendId(),
                    e.getMessage());
            controller.markErrored();
            closeOutputs();
            throw new AgentException(AgentErrorKind.CONNECTION_ERROR,
                    "Failed to open backend conversation: " + e.getMessage(), e);
        }

        log.info("[Loop] started: backend={}, conversation={}, model={}, maxTurns={}",
                backend.getBackendId(), conversation.getConversationId(), config.getModel(), config.getMaxTurns());

        Future<?> eventTask = executor.submit(() -> runEventActivity(conversation));
        try {
            runInputActivity(conversation);
        } catch (InterruptedException e) {
            log.debug("[Loop] input activity interrupted");
            Thread.currentThread().interrupt();
        } finally {
            shutdown(conversation, eventTask);
            closeOutputs();
        }

        log.info("[Loop] finished: phase={}, turns={}", controller.phase(), controller.turnCount());
        return null;
    }

    // ==================== Input activity ====================

    private void runInputActivity(ConversationPort conversation) throws InterruptedException {
        long pollMillis = pollMillis();
        while (!controller.isStopRequested()) {
            InputMessage message = input.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (message == null) {
                if (input.isExhausted()) {
                    log.debug("[Loop] input exhausted");
                    return;
                }
                continue;
            }

            if (!controller.awaitNotPaused(config.getPausePollInterval())) {
                log.debug("[Loop] stop requested, dropping pending input");
                return;
            }

            long turns = controller.turnCount();
            if (turns >= config.getMaxTurns()) {
                log.warn("[Loop] turn limit reached ({}), no more input accepted", config.getMaxTurns());
                deliver(output, OutputMessage.error(turns, OutputError.turnLimitExceeded()));
                return;
            }

            try {
                conversation.submit(Operation.userInput(message));
                log.debug("[Loop] submitted turn {}", turns);
            } catch (BackendException e) {
                log.warn("[Loop] failed to submit input for turn {}: {}", turns, e.getMessage());
                deliver(output, OutputMessage.error(turns, OutputError.from(e)));
            }
            controller.recordTurn();
        }
    }

    // ==================== Event activity ====================

    private void runEventActivity(ConversationPort conversation) {
        EventTranslator translator = new EventTranslator();
        try {
            while (!controller.isStopRequested()) {
                BackendEvent event;
                try {
                    event = conversation.nextEvent();
                } catch (BackendException e) {
                    handleEventFailure(translator, e);
                    return;
                }

                if (event instanceof BackendEvent.ShutdownComplete) {
                    log.debug("[Loop] backend shutdown complete");
                    return;
                }

                Translation translation = translator.translate(event);
                if (translation.hasPlan()) {
                    deliver(plan, translation.plan());
                }
                for (OutputMessage message : translation.outputs()) {
                    deliver(output, message);
                }
            }
        } catch (InterruptedException e) {
            log.debug("[Loop] event activity interrupted");
            Thread.currentThread().interrupt();
        }
    }

    private void handleEventFailure(EventTranslator translator, BackendException e) throws InterruptedException {
        if (shutdownSubmitted) {
            log.debug("[Loop] event stream closed after shutdown: {}", e.getMessage());
            return;
        }
        if (controller.isStopRequested() || Thread.currentThread().isInterrupted()) {
            log.debug("[Loop] event stream ended during stop: {}", e.getMessage());
            return;
        }
        log.error("[Loop] backend event stream failed ({}): {}", e.getKind(), e.getMessage());
        deliver(output, OutputMessage.error(translator.currentTurnId(), OutputError.from(e)));
        controller.markErrored();
    }

    // ==================== Shutdown ====================

    private void shutdown(ConversationPort conversation, Future<?> eventTask) {
        // a backend may answer Shutdown by closing the stream with an error
        shutdownSubmitted = true;
        try {
            conversation.submit(Operation.shutdown());
        } catch (BackendException e) {
            log.debug("[Loop] shutdown request failed: {}", e.getMessage());
        }

        try {
            eventTask.get(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Loop] event activity did not finish within {}, cancelling", config.getShutdownTimeout());
            eventTask.cancel(true);
        } catch (InterruptedException e) {
            eventTask.cancel(true);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("[Loop] event activity failed", e.getCause());
            controller.markErrored();
        }

        controller.markStopped();
    }

    private void closeOutputs() {
        output.close();
        plan.close();
    }

    /**
     * Best-effort delivery: retries in poll-sized slices until the item is
     * queued, the receiver closes its side, or a stop is requested.
     *
     * @return {@code true} if delivered
     */
    private <T> boolean deliver(MessageChannel<T> channel, T item) throws InterruptedException {
        long pollMillis = pollMillis();
        while (!controller.isStopRequested()) {
            if (channel.offer(item, pollMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
            if (channel.isClosed()) {
                log.debug("[Loop] receiver closed, dropping {}", item);
                return false;
            }
        }
        return false;
    }

    private long pollMillis() {
        return Math.max(1, config.getPausePollInterval().toMillis());
    }
}
