package me.golemcore.agent.domain.model;

import java.util.Objects;

/**
 * Structured output event tagged with the turn it belongs to. Turn ids are
 * non-decreasing along a stream and advance right after a {@code Completed}
 * message.
 */
public record OutputMessage(long turnId, OutputData data) {

    public OutputMessage {
        Objects.requireNonNull(data, "data");
    }

    public static OutputMessage of(long turnId, OutputData data) {
        return new OutputMessage(turnId, data);
    }

    public static OutputMessage error(long turnId, OutputError error) {
        return new OutputMessage(turnId, new OutputData.Error(error));
    }
}
