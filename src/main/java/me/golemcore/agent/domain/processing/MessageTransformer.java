package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputMessage;

/**
 * Pipeline stage that rewrites a message. Must not return {@code null}.
 */
@FunctionalInterface
public interface MessageTransformer {

    OutputMessage transform(OutputMessage message);
}
