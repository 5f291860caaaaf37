package me.golemcore.agent.domain.session;

import java.time.Duration;

/**
 * Point-in-time counters of an {@link AgentSession}.
 *
 * @param messagesSent
 *            inputs accepted by {@link AgentSession#send(String)}
 * @param messagesReceived
 *            output messages of any kind
 * @param toolCalls
 *            tool start outputs
 * @param errors
 *            error outputs
 * @param duration
 *            time since the session object was created
 */
public record SessionMetrics(long messagesSent, long messagesReceived, long toolCalls, long errors,
        Duration duration) {
}
