package me.golemcore.agent.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.loop.AgentConfig;
import me.golemcore.agent.domain.session.SerializedMessage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentEngineConfigurationTest {

    // --- properties ---

    @Test
    void shouldProvideDefaultProperties() {
        AgentProperties properties = new AgentProperties();

        assertEquals("none", properties.getBackend());
        assertEquals("gpt-5-mini", properties.getModel().getName());
        assertEquals("openai", properties.getModel().getProvider());
        assertFalse(properties.getModel().isShowRawReasoning());
        assertEquals(100, properties.getLoop().getMaxTurns());
        assertEquals(100, properties.getLoop().getChannelCapacity());
        assertEquals(Duration.ofMillis(100), properties.getLoop().getPausePollInterval());
        assertEquals(Duration.ofSeconds(5), properties.getLoop().getShutdownTimeout());
        assertNull(properties.getSandbox().getWorkingDirectory());
        assertEquals(AgentConfig.SandboxPolicy.WORKSPACE_WRITE, properties.getSandbox().getPolicy());
        assertEquals(AgentConfig.ApprovalPolicy.NEVER, properties.getSandbox().getApprovalPolicy());
    }

    // --- beans ---

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AgentEngineConfiguration.objectMapper();
        SerializedMessage message = new SerializedMessage("user", "hi", Instant.parse("2026-02-03T04:05:06Z"));

        String json = mapper.writeValueAsString(message);

        assertTrue(json.contains("\"timestamp\":\"2026-02-03T04:05:06Z\""));
        assertEquals(message, mapper.readValue(json, SerializedMessage.class));
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        ObjectMapper mapper = AgentEngineConfiguration.objectMapper();

        SerializedMessage message = mapper.readValue(
                "{\"role\":\"user\",\"content\":\"hi\",\"timestamp\":\"2026-02-03T04:05:06Z\",\"extra\":1}",
                SerializedMessage.class);

        assertEquals("hi", message.content());
    }

    @Test
    void shouldRunTasksOnNamedDaemonThreads() throws Exception {
        ExecutorService executor = new AgentEngineConfiguration(new AgentProperties()).agentExecutor();
        try {
            Future<Thread> thread = executor.submit(Thread::currentThread);

            assertTrue(thread.get().getName().startsWith("agent-"));
            assertTrue(thread.get().isDaemon());
        } finally {
            executor.shutdownNow();
        }
    }
}
