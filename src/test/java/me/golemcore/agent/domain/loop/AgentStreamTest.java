package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;
import me.golemcore.agent.domain.processing.MessageProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentStreamTest {

    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(5);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static AgentConfig config() {
        return AgentConfig.builder()
                .pausePollInterval(Duration.ofMillis(20))
                .shutdownTimeout(Duration.ofSeconds(1))
                .build();
    }

    @Test
    void shouldStreamOutputsOfOneTurnAndComplete() {
        Agent agent = new Agent(config(), ScriptedBackend.replyingWith("4"), executor);

        StepVerifier.create(agent.stream("2+2?"))
                .expectNext(OutputMessage.of(0, OutputData.start()))
                .expectNext(OutputMessage.of(0, new OutputData.Primary("4")))
                .expectNext(OutputMessage.of(0, OutputData.completed()))
                .expectComplete()
                .verify(VERIFY_TIMEOUT);
    }

    @Test
    void shouldStopExecutionWhenSubscriptionIsCancelled() throws Exception {
        ScriptedBackend backend = new ScriptedBackend(text -> List.of(new BackendEvent.AgentMessage("thinking")))
                .greeting(new BackendEvent.SessionConfigured("conv-1", "test-model"));
        Agent agent = new Agent(config(), backend, executor);

        StepVerifier.create(agent.stream("long task"))
                .expectNext(OutputMessage.of(0, OutputData.start()))
                .expectNext(OutputMessage.of(0, new OutputData.Primary("thinking")))
                .thenCancel()
                .verify(VERIFY_TIMEOUT);

        long deadline = System.currentTimeMillis() + VERIFY_TIMEOUT.toMillis();
        while (!backend.conversation().isShutdownRequested() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(backend.conversation().isShutdownRequested());
    }

    @Test
    void shouldAggregateStreamedDeltasThroughProcessor() {
        ScriptedBackend backend = new ScriptedBackend(text -> List.of(
                new BackendEvent.AgentMessageDelta("Hel"),
                new BackendEvent.AgentMessageDelta("lo"),
                new BackendEvent.TaskComplete("Hello")));
        Agent agent = new Agent(config(), backend, executor);
        MessageProcessor processor = MessageProcessor.builder()
                .aggregateDeltas()
                .build();

        StepVerifier.create(processor.apply(agent.stream("greet")))
                .expectNext(OutputMessage.of(0, new OutputData.Primary("Hello")))
                .expectComplete()
                .verify(VERIFY_TIMEOUT);
    }
}
