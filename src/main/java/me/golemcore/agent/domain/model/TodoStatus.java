package me.golemcore.agent.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status of a single plan item. Serialized in snake_case.
 */
public enum TodoStatus {
    @JsonProperty("pending")
    PENDING,

    @JsonProperty("in_progress")
    IN_PROGRESS,

    @JsonProperty("completed")
    COMPLETED,

    @JsonProperty("blocked")
    BLOCKED;

    /**
     * Parses a wire status. Unrecognized or missing values fall back to
     * {@link #PENDING}.
     */
    public static TodoStatus fromWire(String value) {
        if (value == null) {
            return PENDING;
        }
        return switch (value) {
        case "in_progress" -> IN_PROGRESS;
        case "completed" -> COMPLETED;
        case "blocked" -> BLOCKED;
        default -> PENDING;
        };
    }
}
