package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.Operation;
import me.golemcore.agent.port.outbound.BackendException;
import me.golemcore.agent.port.outbound.BackendPort;
import me.golemcore.agent.port.outbound.ConversationPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-memory backend for loop tests. Each submitted input is answered with the
 * events produced by the responder; a shutdown request is answered with
 * {@link BackendEvent.ShutdownComplete}.
 */
public class ScriptedBackend implements BackendPort {

    private final Function<String, List<BackendEvent>> responder;
    private final List<BackendEvent> greeting = new ArrayList<>();
    private final Queue<BackendException> submitFailures = new ConcurrentLinkedQueue<>();
    private final BlockingQueue<String> submitted = new LinkedBlockingQueue<>();
    private final List<Operation.UserInput> submittedOperations = new CopyOnWriteArrayList<>();

    private BackendException openFailure;
    private BackendException streamFailure;
    private BackendException shutdownFailure;
    private volatile ScriptedConversation conversation;

    public ScriptedBackend(Function<String, List<BackendEvent>> responder) {
        this.responder = responder;
    }

    public static ScriptedBackend replyingWith(String reply) {
        return new ScriptedBackend(text -> List.of(
                new BackendEvent.AgentMessage(reply),
                new BackendEvent.TaskComplete(reply)))
                .greeting(new BackendEvent.SessionConfigured("conv-1", "test-model"));
    }

    public ScriptedBackend greeting(BackendEvent... events) {
        greeting.addAll(List.of(events));
        return this;
    }

    public ScriptedBackend failNextSubmit(BackendException failure) {
        submitFailures.add(failure);
        return this;
    }

    public ScriptedBackend failOpen(BackendException failure) {
        this.openFailure = failure;
        return this;
    }

    /**
     * Makes the event stream fail right after the greeting.
     */
    public ScriptedBackend failStream(BackendException failure) {
        this.streamFailure = failure;
        return this;
    }

    /**
     * Answers the shutdown request by failing the event stream instead of
     * acknowledging it.
     */
    public ScriptedBackend failOnShutdown(BackendException failure) {
        this.shutdownFailure = failure;
        return this;
    }

    public String awaitSubmission(long timeoutMillis) throws InterruptedException {
        return submitted.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public List<Operation.UserInput> submittedOperations() {
        return submittedOperations;
    }

    public ScriptedConversation conversation() {
        return conversation;
    }

    @Override
    public String getBackendId() {
        return "scripted";
    }

    @Override
    public ConversationPort openConversation(AgentConfig config) throws BackendException {
        if (openFailure != null) {
            throw openFailure;
        }
        ScriptedConversation opened = new ScriptedConversation();
        greeting.forEach(opened.events::add);
        if (streamFailure != null) {
            opened.events.add(streamFailure);
        }
        conversation = opened;
        return opened;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public final class ScriptedConversation implements ConversationPort {

        private final BlockingQueue<Object> events = new LinkedBlockingQueue<>();
        private volatile boolean shutdownRequested = false;

        @Override
        public String getConversationId() {
            return "conv-1";
        }

        @Override
        public void submit(Operation operation) throws BackendException {
            if (operation instanceof Operation.Shutdown) {
                shutdownRequested = true;
                events.add(shutdownFailure != null ? shutdownFailure : new BackendEvent.ShutdownComplete());
                return;
            }
            BackendException failure = submitFailures.poll();
            if (failure != null) {
                throw failure;
            }
            Operation.UserInput input = (Operation.UserInput) operation;
            String text = ((Operation.InputItem.Text) input.items().get(0)).text();
            submittedOperations.add(input);
            submitted.add(text);
            events.addAll(responder.apply(text));
        }

        @Override
        public BackendEvent nextEvent() throws BackendException, InterruptedException {
            Object next = events.take();
            if (next instanceof BackendException failure) {
                throw failure;
            }
            return (BackendEvent) next;
        }

        public void emit(BackendEvent event) {
            events.add(event);
        }

        public boolean isShutdownRequested() {
            return shutdownRequested;
        }
    }
}
