package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;

import java.util.List;
import java.util.Optional;

/**
 * Concatenates streamed deltas into one {@link OutputData.Primary}.
 *
 * <p>
 * The first non-delta message after buffered deltas is replaced by the
 * aggregated primary message, which carries turn id
 * {@value #AGGREGATED_TURN_ID}. That triggering message is not emitted.
 */
public class DeltaAggregator implements MessageAggregator {

    public static final long AGGREGATED_TURN_ID = 0L;

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public Optional<OutputMessage> aggregate(OutputMessage message) {
        if (message.data() instanceof OutputData.PrimaryDelta delta) {
            buffer.append(delta.text());
            return Optional.empty();
        }
        if (buffer.length() == 0) {
            return Optional.of(message);
        }
        return Optional.of(drain());
    }

    @Override
    public List<OutputMessage> flush() {
        if (buffer.length() == 0) {
            return List.of();
        }
        return List.of(drain());
    }

    private OutputMessage drain() {
        OutputMessage aggregated = OutputMessage.of(AGGREGATED_TURN_ID, new OutputData.Primary(buffer.toString()));
        buffer.setLength(0);
        return aggregated;
    }
}
