package me.golemcore.agent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.backend.NoOpBackendAdapter;
import me.golemcore.agent.domain.loop.Agent;
import me.golemcore.agent.domain.loop.AgentConfig;
import me.golemcore.agent.domain.model.AgentErrorKind;
import me.golemcore.agent.domain.model.AgentException;
import me.golemcore.agent.domain.session.AgentSession;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.BackendPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentFactoryTest {

    private AgentProperties properties;
    private ExecutorService executor;
    private BackendPort remoteBackend;
    private AgentFactory factory;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        executor = Executors.newCachedThreadPool();
        remoteBackend = mock(BackendPort.class);
        when(remoteBackend.getBackendId()).thenReturn("remote");
        when(remoteBackend.isAvailable()).thenReturn(true);
        factory = new AgentFactory(properties, List.of(new NoOpBackendAdapter(), remoteBackend), executor,
                new ObjectMapper(), Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // --- defaultConfig ---

    @Test
    void shouldMapPropertiesOntoConfig() {
        properties.getModel().setName("o4-mini");
        properties.getModel().setProvider("azure");
        properties.getModel().setSystemPrompt("Be brief");
        properties.getModel().setShowRawReasoning(true);
        properties.getLoop().setMaxTurns(7);
        properties.getLoop().setChannelCapacity(16);
        properties.getLoop().setPausePollInterval(Duration.ofMillis(50));
        properties.getLoop().setShutdownTimeout(Duration.ofSeconds(2));
        properties.getSandbox().setWorkingDirectory("/tmp/work");
        properties.getSandbox().setPolicy(AgentConfig.SandboxPolicy.READ_ONLY);
        properties.getSandbox().setApprovalPolicy(AgentConfig.ApprovalPolicy.ON_REQUEST);

        AgentConfig config = factory.defaultConfig();

        assertEquals("o4-mini", config.getModel());
        assertEquals("azure", config.getModelProvider());
        assertEquals("Be brief", config.getSystemPrompt());
        assertTrue(config.isShowRawReasoning());
        assertEquals(7, config.getMaxTurns());
        assertEquals(16, config.getChannelCapacity());
        assertEquals(Duration.ofMillis(50), config.getPausePollInterval());
        assertEquals(Duration.ofSeconds(2), config.getShutdownTimeout());
        assertEquals(Path.of("/tmp/work"), config.getWorkingDirectory());
        assertEquals(AgentConfig.SandboxPolicy.READ_ONLY, config.getSandboxPolicy());
        assertEquals(AgentConfig.ApprovalPolicy.ON_REQUEST, config.getApprovalPolicy());
    }

    @Test
    void shouldKeepDefaultWorkingDirectoryWhenBlank() {
        properties.getSandbox().setWorkingDirectory(" ");

        AgentConfig config = factory.defaultConfig();

        assertEquals(AgentConfig.defaultConfig().getWorkingDirectory(), config.getWorkingDirectory());
    }

    // --- createAgent ---

    @Test
    void shouldCreateAgentOnConfiguredBackend() throws Exception {
        properties.setBackend("remote");

        Agent agent = factory.createAgent();

        assertNotNull(agent);
        assertSame(executor, agent.getExecutor());
        assertEquals(100, agent.getConfig().getMaxTurns());
    }

    @Test
    void shouldFallBackToNoOpBackendByDefault() throws Exception {
        Agent agent = factory.createAgent();

        assertEquals("[No backend configured]", agent.query("ping"));
    }

    @Test
    void shouldRejectUnknownBackend() {
        properties.setBackend("missing");

        AgentException exception = assertThrows(AgentException.class, () -> factory.createAgent());

        assertEquals(AgentErrorKind.CONFIG_ERROR, exception.getKind());
        assertTrue(exception.getMessage().contains("missing"));
    }

    @Test
    void shouldRejectInvalidConfig() {
        AgentConfig zeroTurns = factory.defaultConfig().toBuilder().maxTurns(0).build();
        AgentConfig noCapacity = factory.defaultConfig().toBuilder().channelCapacity(0).build();
        AgentConfig noPoll = factory.defaultConfig().toBuilder().pausePollInterval(Duration.ZERO).build();
        AgentConfig blankModel = factory.defaultConfig().toBuilder().model(" ").build();

        for (AgentConfig config : List.of(zeroTurns, noCapacity, noPoll, blankModel)) {
            AgentException exception = assertThrows(AgentException.class, () -> factory.createAgent(config));
            assertEquals(AgentErrorKind.CONFIG_ERROR, exception.getKind());
        }
    }

    // --- sessions ---

    @Test
    void shouldCreateIdleSession() throws Exception {
        AgentSession session = factory.createSession();

        assertFalse(session.isRunning());
        assertTrue(session.getHistory().isEmpty());
    }

    @Test
    void shouldFindRegisteredBackends() {
        assertTrue(factory.findBackend("none").isPresent());
        assertSame(remoteBackend, factory.findBackend("remote").orElseThrow());
        assertTrue(factory.findBackend("other").isEmpty());
    }
}
