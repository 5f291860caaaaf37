package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.util.OutputMessages;

/**
 * Removes ANSI escape sequences from text-bearing messages.
 */
public class AnsiStripper extends TextRewritingTransformer {

    @Override
    protected String rewrite(String text) {
        return OutputMessages.cleanAnsi(text);
    }
}
