package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputMessage;

/**
 * Pipeline stage that may veto a message.
 */
@FunctionalInterface
public interface MessageFilter {

    /**
     * @return {@code true} to keep the message
     */
    boolean accept(OutputMessage message);
}
