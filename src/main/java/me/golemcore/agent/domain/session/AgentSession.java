package me.golemcore.agent.domain.session;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.channel.MessageChannel;
import me.golemcore.agent.domain.loop.Agent;
import me.golemcore.agent.domain.loop.ExecutionHandle;
import me.golemcore.agent.domain.model.AgentErrorKind;
import me.golemcore.agent.domain.model.AgentException;
import me.golemcore.agent.domain.model.InputMessage;
import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;
import me.golemcore.agent.domain.model.PlanMessage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stateful conversation on top of an {@link Agent}.
 *
 * <p>
 * Records user and assistant messages in a bounded history, counts traffic,
 * tracks the latest plan and can be saved to and restored from a JSON file.
 * Each {@link #start()} runs a fresh execution forked from the wrapped agent,
 * so a stopped session can be started again.
 */
@Slf4j
public class AgentSession {

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private final Agent agent;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Instant openedAt;

    private final Object lock = new Object();
    private final SessionSnapshot snapshot;
    private final MessageHistory history;

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong toolCalls = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    private volatile PlanMessage currentPlan;
    private MessageChannel<InputMessage> input;
    private ExecutionHandle handle;

    public AgentSession(Agent agent, ObjectMapper objectMapper, Clock clock) {
        this(agent, objectMapper, clock, newSnapshot(agent, clock));
    }

    private AgentSession(Agent agent, ObjectMapper objectMapper, Clock clock, SessionSnapshot snapshot) {
        this.agent = agent;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.openedAt = clock.instant();
        this.snapshot = snapshot;
        this.history = new MessageHistory(DEFAULT_HISTORY_SIZE, clock);
        snapshot.getMessages().forEach(history::add);
    }

    private static SessionSnapshot newSnapshot(Agent agent, Clock clock) {
        Instant now = clock.instant();
        return SessionSnapshot.builder()
                .metadata(SessionMetadata.builder()
                        .sessionId(UUID.randomUUID().toString())
                        .createdAt(now)
                        .updatedAt(now)
                        .model(agent.getConfig().getModel())
                        .build())
                .build();
    }

    public String getSessionId() {
        synchronized (lock) {
            return snapshot.getMetadata().getSessionId();
        }
    }

    /**
     * {@code true} while an execution is attached and still accepts input.
     */
    public boolean isRunning() {
        synchronized (lock) {
            return handle != null && !input.isClosed();
        }
    }

    public void start() throws AgentException {
        synchronized (lock) {
            if (handle != null && !input.isClosed()) {
                throw AgentException.alreadyRunning();
            }

            Agent run = agent.fork();
            int capacity = run.getConfig().getChannelCapacity();
            MessageChannel<InputMessage> inputChannel = new MessageChannel<>(capacity);
            MessageChannel<PlanMessage> planChannel = new MessageChannel<>(capacity);
            MessageChannel<OutputMessage> outputChannel = new MessageChannel<>(capacity);

            handle = run.execute(inputChannel, planChannel, outputChannel);
            input = inputChannel;
            run.getExecutor().submit(() -> consumeOutputs(outputChannel, inputChannel));
            run.getExecutor().submit(() -> consumePlans(planChannel));
        }
        log.info("[Session] {} started", getSessionId());
    }

    /**
     * Queues a user message. Blocks while the input channel is full. A message
     * the execution rejects is taken back out of the history and not counted.
     *
     * @throws AgentException
     *             {@code NOT_RUNNING} before {@link #start()},
     *             {@code CHANNEL_ERROR} if the execution no longer accepts input
     */
    public void send(String text) throws AgentException {
        MessageChannel<InputMessage> channel;
        SerializedMessage entry;
        Instant previousUpdate;
        synchronized (lock) {
            if (input == null) {
                throw AgentException.notRunning();
            }
            channel = input;
            // recorded up front so the reply can never precede it in the history
            previousUpdate = snapshot.getMetadata().getUpdatedAt();
            entry = history.add(SerializedMessage.ROLE_USER, text);
            snapshot.getMessages().add(entry);
            snapshot.setTurnCount(snapshot.getTurnCount() + 1);
            snapshot.getMetadata().setUpdatedAt(entry.timestamp());
        }

        boolean accepted = false;
        try {
            accepted = channel.send(InputMessage.of(text));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Interrupted while sending message", e);
        } finally {
            if (!accepted) {
                discard(entry, previousUpdate);
            }
        }
        if (!accepted) {
            throw AgentException.channelClosed();
        }
        messagesSent.incrementAndGet();
    }

    private void discard(SerializedMessage entry, Instant previousUpdate) {
        synchronized (lock) {
            List<SerializedMessage> messages = snapshot.getMessages();
            int index = messages.lastIndexOf(entry);
            if (index >= 0) {
                messages.remove(index);
            }
            snapshot.setTurnCount(snapshot.getTurnCount() - 1);
            if (entry.timestamp().equals(snapshot.getMetadata().getUpdatedAt())) {
                snapshot.getMetadata().setUpdatedAt(previousUpdate);
            }
            history.replaceWith(messages);
        }
    }

    public List<SerializedMessage> getHistory() {
        return history.getAll();
    }

    public SessionMetrics getMetrics() {
        return new SessionMetrics(messagesSent.get(), messagesReceived.get(), toolCalls.get(), errors.get(),
                Duration.between(openedAt, clock.instant()));
    }

    public Optional<PlanMessage> getCurrentPlan() {
        return Optional.ofNullable(currentPlan);
    }

    public long getTurnCount() {
        synchronized (lock) {
            return snapshot.getTurnCount();
        }
    }

    public void save(Path path) throws AgentException {
        String json;
        synchronized (lock) {
            try {
                json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(copyOfSnapshot());
            } catch (IOException e) {
                throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Failed to serialize session", e);
            }
        }
        try {
            Files.writeString(path, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Failed to write session to " + path, e);
        }
        log.debug("[Session] saved {} to {}", getSessionId(), path);
    }

    /**
     * Restores a saved session around {@code agent}. History is rebuilt from the
     * file; metrics start from zero.
     */
    public static AgentSession load(Path path, Agent agent, ObjectMapper objectMapper, Clock clock)
            throws AgentException {
        SessionSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8),
                    SessionSnapshot.class);
        } catch (IOException e) {
            throw new AgentException(AgentErrorKind.INTERNAL_ERROR, "Failed to load session from " + path, e);
        }
        if (snapshot.getMessages() == null) {
            snapshot.setMessages(new ArrayList<>());
        }
        if (snapshot.getMetadata() == null) {
            snapshot.setMetadata(newSnapshot(agent, clock).getMetadata());
        }
        if (snapshot.getMetadata().getCustom() == null) {
            snapshot.getMetadata().setCustom(new HashMap<>());
        }
        return new AgentSession(agent, objectMapper, clock, snapshot);
    }

    /**
     * Stops the running execution, if any, and waits for it to wind down.
     */
    public void stop() {
        ExecutionHandle running;
        MessageChannel<InputMessage> channel;
        synchronized (lock) {
            running = handle;
            channel = input;
            handle = null;
            input = null;
        }
        if (running == null) {
            return;
        }

        running.stop();
        channel.close();
        try {
            running.join();
        } catch (AgentException e) {
            log.warn("[Session] execution ended with error: {}", e.getMessage());
        }
        log.info("[Session] {} stopped", getSessionId());
    }

    private void consumeOutputs(MessageChannel<OutputMessage> outputs, MessageChannel<InputMessage> inputs) {
        try {
            OutputMessage message;
            while ((message = outputs.receive()) != null) {
                record(message);
            }
            // the execution is over; release blocked senders and reject new ones
            inputs.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void consumePlans(MessageChannel<PlanMessage> plans) {
        try {
            PlanMessage plan;
            while ((plan = plans.receive()) != null) {
                currentPlan = plan;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void record(OutputMessage message) {
        messagesReceived.incrementAndGet();
        OutputData data = message.data();
        if (data instanceof OutputData.Primary primary) {
            synchronized (lock) {
                SerializedMessage entry = history.add(SerializedMessage.ROLE_ASSISTANT, primary.text());
                snapshot.getMessages().add(entry);
                snapshot.getMetadata().setUpdatedAt(entry.timestamp());
            }
        } else if (data instanceof OutputData.ToolStart) {
            toolCalls.incrementAndGet();
        } else if (data.isError()) {
            errors.incrementAndGet();
        }
    }

    private SessionSnapshot copyOfSnapshot() {
        SessionMetadata metadata = snapshot.getMetadata();
        return SessionSnapshot.builder()
                .messages(new ArrayList<>(snapshot.getMessages()))
                .turnCount(snapshot.getTurnCount())
                .metadata(SessionMetadata.builder()
                        .sessionId(metadata.getSessionId())
                        .createdAt(metadata.getCreatedAt())
                        .updatedAt(metadata.getUpdatedAt())
                        .model(metadata.getModel())
                        .custom(new HashMap<>(metadata.getCustom()))
                        .build())
                .build();
    }
}
