package me.golemcore.agent.domain.model;

import me.golemcore.agent.port.outbound.BackendException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OutputErrorTest {

    // --- from ---

    @Test
    void shouldClassifyBackendFailures() {
        assertEquals(OutputError.interrupted(),
                OutputError.from(new BackendException(BackendException.Kind.INTERRUPTED, "x")));
        assertEquals(OutputError.unknown("Internal agent died"),
                OutputError.from(new BackendException(BackendException.Kind.AGENT_DIED, "gone")));
        assertEquals(OutputError.networkError("reset"),
                OutputError.from(new BackendException(BackendException.Kind.STREAM, "reset")));
        assertEquals(OutputError.toolError("bad args"),
                OutputError.from(new BackendException(BackendException.Kind.TOOL, "bad args")));
        assertEquals(OutputError.modelError("overloaded"),
                OutputError.from(new BackendException(BackendException.Kind.MODEL, "overloaded")));
        assertEquals(OutputError.unknown("boom"),
                OutputError.from(new BackendException(BackendException.Kind.OTHER, "boom")));
    }

    // --- toString ---

    @Test
    void shouldRenderHumanReadableText() {
        assertEquals("Turn limit exceeded", OutputError.turnLimitExceeded().toString());
        assertEquals("Agent was interrupted", OutputError.interrupted().toString());
        assertEquals("Tool error: x", OutputError.toolError("x").toString());
        assertEquals("Network error: reset", OutputError.networkError("reset").toString());
        assertEquals("Authentication error: expired", OutputError.authenticationError("expired").toString());
        assertEquals("Configuration error: bad", OutputError.configurationError("bad").toString());
        assertEquals("Unknown error: boom", OutputError.unknown("boom").toString());
    }

    @Test
    void shouldRequireKind() {
        assertThrows(NullPointerException.class, () -> new OutputError(null, "x"));
    }

    @Test
    void shouldCarryOutputErrorInAgentException() {
        AgentException exception = AgentException.fromOutput(OutputError.modelError("overloaded"));

        assertEquals(AgentErrorKind.OUTPUT_ERROR, exception.getKind());
        assertEquals(OutputError.modelError("overloaded"), exception.getOutputError());
    }
}
