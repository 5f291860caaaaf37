package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;

/**
 * Drops tool start and streamed tool output. Tool completion passes.
 */
public class ToolOutputFilter implements MessageFilter {

    @Override
    public boolean accept(OutputMessage message) {
        OutputData data = message.data();
        return !(data instanceof OutputData.ToolStart) && !(data instanceof OutputData.ToolOutput);
    }
}
