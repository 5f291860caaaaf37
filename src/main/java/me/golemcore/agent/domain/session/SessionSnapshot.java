package me.golemcore.agent.domain.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persistent state of an {@link AgentSession}, saved and loaded as JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSnapshot {

    @Builder.Default
    private List<SerializedMessage> messages = new ArrayList<>();

    private long turnCount;

    private SessionMetadata metadata;
}
