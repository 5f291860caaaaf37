package me.golemcore.agent.domain.session;

import java.time.Instant;

/**
 * One history entry as stored in a session file.
 */
public record SerializedMessage(String role, String content, Instant timestamp) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
}
