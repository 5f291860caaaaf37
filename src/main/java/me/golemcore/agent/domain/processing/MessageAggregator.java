package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputMessage;

import java.util.List;
import java.util.Optional;

/**
 * Stateful pipeline stage. May swallow a message, pass it on, or emit a
 * different message built from its buffered state.
 *
 * <p>
 * Instances are owned by a single consumer and are not thread-safe.
 */
public interface MessageAggregator {

    /**
     * @return the message to hand to the next stage, or empty to emit nothing
     */
    Optional<OutputMessage> aggregate(OutputMessage message);

    /**
     * Drains whatever is still buffered. Called once, after the last message.
     */
    List<OutputMessage> flush();
}
