package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;

/**
 * Base for transformers that rewrite the text of primary messages, deltas and
 * tool output. Other variants pass through unchanged.
 */
abstract class TextRewritingTransformer implements MessageTransformer {

    protected abstract String rewrite(String text);

    @Override
    public OutputMessage transform(OutputMessage message) {
        OutputData data = message.data();
        OutputData rewritten;
        if (data instanceof OutputData.Primary primary) {
            rewritten = new OutputData.Primary(rewrite(primary.text()));
        } else if (data instanceof OutputData.PrimaryDelta delta) {
            rewritten = new OutputData.PrimaryDelta(rewrite(delta.text()));
        } else if (data instanceof OutputData.ToolOutput toolOutput) {
            rewritten = new OutputData.ToolOutput(toolOutput.toolName(), rewrite(toolOutput.output()));
        } else {
            return message;
        }
        return OutputMessage.of(message.turnId(), rewritten);
    }
}
