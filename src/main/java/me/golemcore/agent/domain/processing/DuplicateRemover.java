package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drops a primary message or delta whose text equals the last one seen.
 * Messages without text pass and do not reset the tracked text.
 */
public class DuplicateRemover implements MessageAggregator {

    private String lastText;

    @Override
    public Optional<OutputMessage> aggregate(OutputMessage message) {
        String text = textOf(message.data());
        if (text != null) {
            if (Objects.equals(lastText, text)) {
                return Optional.empty();
            }
            lastText = text;
        }
        return Optional.of(message);
    }

    @Override
    public List<OutputMessage> flush() {
        return List.of();
    }

    private static String textOf(OutputData data) {
        if (data instanceof OutputData.Primary primary) {
            return primary.text();
        }
        if (data instanceof OutputData.PrimaryDelta delta) {
            return delta.text();
        }
        return null;
    }
}
