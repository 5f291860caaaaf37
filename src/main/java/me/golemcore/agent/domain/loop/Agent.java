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
import me.golemcore.agent.domain.model.AgentErrorKind;
import me.golemcore.agent.domain.model.AgentException;
import me.golemcore.agent.domain.model.InputMessage;
import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputError;
import me.golemcore.agent.domain.model.OutputMessage;
import me.golemcore.agent.domain.model.PlanMessage;
import me.golemcore.agent.port.outbound.BackendPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Public entry point of the engine. An agent binds a configuration, a backend
 * and an executor to one {@link AgentController}; each controller runs at most
 * one execution in its lifetime, so callers that need several runs use
 * {@link #fork()} or one of the convenience modes, which fork internally.
 */
@Slf4j
public class Agent {

    private final AgentConfig config;
    private final BackendPort backend;
    private final ExecutorService executor;
    private final AgentController controller = new AgentController();

    public Agent(AgentConfig config, BackendPort backend, ExecutorService executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public AgentConfig getConfig() {
        return config;
    }

    public AgentController getController() {
        return controller;
    }

    public ExecutorService getExecutor() {
        return executor;
    }

    /**
     * Same configuration, backend and executor with a fresh controller.
     */
    public Agent fork() {
        return new Agent(config, backend, executor);
    }

    /**
     * Starts the execution loop.
     *
     * <p>
     * The caller owns the three channels: it feeds {@code input} and closes it
     * when done, and reads {@code output} and {@code plan} until they are
     * exhausted. The loop closes both receiving channels when it ends. A closed
     * {@code plan} channel is fine for callers that do not care about plans.
     *
     * @throws AgentException
     *             {@code ALREADY_RUNNING} if this agent's session is running or
     *             paused, {@code SESSION_TERMINATED} if it already finished
     */
    public ExecutionHandle execute(MessageChannel<InputMessage> input, MessageChannel<PlanMessage> plan,
            MessageChannel<OutputMessage> output) throws AgentException {
        controller.start();
        ExecutionLoop loop = new ExecutionLoop(config, backend, controller, executor, input, plan, output);
        try {
            Future<Void> completion = executor.submit(loop);
            return new ExecutionHandle(controller, completion);
        } catch (RejectedExecutionException e) {
            controller.markErrored();
            output.close();
            plan.close();
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Executor rejected agent execution", e);
        }
    }

    /**
     * Sends one prompt and collects the primary text of the reply.
     *
     * @throws AgentException
     *             {@code OUTPUT_ERROR} carrying the error output if the turn
     *             failed
     */
    public String query(String prompt) throws AgentException {
        Agent run = fork();
        MessageChannel<InputMessage> input = newChannel();
        MessageChannel<OutputMessage> output = newChannel();
        MessageChannel<PlanMessage> plans = newChannel();
        plans.close();

        ExecutionHandle handle = run.execute(input, plans, output);
        StringBuilder response = new StringBuilder();
        OutputError failure = null;
        try {
            send(input, InputMessage.of(prompt));
            OutputMessage message;
            while ((message = output.receive()) != null) {
                OutputData data = message.data();
                if (data instanceof OutputData.Primary primary) {
                    response.append(primary.text());
                } else if (data instanceof OutputData.PrimaryDelta delta) {
                    response.append(delta.text());
                } else if (data instanceof OutputData.Error error) {
                    failure = error.error();
                    break;
                } else if (data instanceof OutputData.Completed) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Interrupted while waiting for reply", e);
        } finally {
            handle.stop();
            input.close();
            output.close();
        }

        handle.join();
        if (failure != null) {
            throw AgentException.fromOutput(failure);
        }
        return response.toString();
    }

    /**
     * Starts an execution whose outputs are pushed to {@code handler} on the
     * executor. The handler returns {@code false} to stop the session.
     */
    public InteractiveExecution interactive(OutputHandler handler) throws AgentException {
        Objects.requireNonNull(handler, "handler");
        Agent run = fork();
        MessageChannel<InputMessage> input = newChannel();
        MessageChannel<OutputMessage> output = newChannel();
        MessageChannel<PlanMessage> plans = newChannel();
        plans.close();

        ExecutionHandle handle = run.execute(input, plans, output);
        executor.submit(() -> pumpToHandler(output, handler, handle));
        return new InteractiveExecution(input, handle);
    }

    /**
     * Runs one prompt and exposes its outputs as a {@link Flux}. The flux
     * completes after the turn's terminal output once the output channel ends;
     * cancelling the subscription stops the execution.
     */
    public Flux<OutputMessage> stream(String prompt) {
        return Flux.create(sink -> {
            Agent run = fork();
            MessageChannel<InputMessage> input = newChannel();
            MessageChannel<OutputMessage> output = newChannel();
            MessageChannel<PlanMessage> plans = newChannel();
            plans.close();

            ExecutionHandle handle;
            try {
                handle = run.execute(input, plans, output);
            } catch (AgentException e) {
                sink.error(e);
                return;
            }
            sink.onDispose(() -> {
                handle.stop();
                input.close();
            });
            executor.submit(() -> pumpToSink(input, output, handle, sink, prompt));
        });
    }

    private void pumpToSink(MessageChannel<InputMessage> input, MessageChannel<OutputMessage> output,
            ExecutionHandle handle, FluxSink<OutputMessage> sink, String prompt) {
        try {
            send(input, InputMessage.of(prompt));
            OutputMessage message;
            while ((message = output.receive()) != null) {
                sink.next(message);
                if (message.data().isTerminal()) {
                    handle.stop();
                }
            }
            input.close();
            handle.join();
            sink.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.stop();
            sink.error(e);
        } catch (AgentException e) {
            handle.stop();
            sink.error(e);
        }
    }

    private void pumpToHandler(MessageChannel<OutputMessage> output, OutputHandler handler,
            ExecutionHandle handle) {
        try {
            OutputMessage message;
            while ((message = output.receive()) != null) {
                if (!handler.onOutput(message)) {
                    log.debug("[Agent] output handler requested stop");
                    handle.stop();
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.stop();
        } catch (RuntimeException e) { // NOSONAR - handler failures must not kill the executor thread
            log.error("[Agent] output handler failed, stopping session", e);
            handle.stop();
        } finally {
            output.close();
        }
    }

    private static void send(MessageChannel<InputMessage> input, InputMessage message)
            throws InterruptedException, AgentException {
        if (!input.send(message)) {
            throw AgentException.channelClosed();
        }
    }

    private <T> MessageChannel<T> newChannel() {
        return new MessageChannel<>(config.getChannelCapacity());
    }

    /**
     * Receives outputs of an interactive execution.
     */
    @FunctionalInterface
    public interface OutputHandler {

        /**
         * @return {@code false} to stop the session
         */
        boolean onOutput(OutputMessage message);
    }

    /**
     * Input side and handle of an interactive execution. Close the input
     * channel or stop the handle to end it.
     */
    public record InteractiveExecution(MessageChannel<InputMessage> input, ExecutionHandle handle) {

        public boolean send(String text) throws InterruptedException {
            return input.send(InputMessage.of(text));
        }
    }
}
