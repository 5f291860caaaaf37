package me.golemcore.agent.domain.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Identity and bookkeeping of a saved session. {@code custom} holds free-form
 * caller data and is written to the session file as is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetadata {

    private String sessionId;
    private Instant createdAt;
    private Instant updatedAt;
    private String model;

    @Builder.Default
    private Map<String, Object> custom = new HashMap<>();
}
