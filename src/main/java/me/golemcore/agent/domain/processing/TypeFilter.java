package me.golemcore.agent.domain.processing;

import me.golemcore.agent.domain.model.OutputData;
import me.golemcore.agent.domain.model.OutputMessage;

import java.util.Collection;
import java.util.Set;

/**
 * Keeps only messages whose {@link OutputData#typeName()} is in the allowed
 * set.
 */
public class TypeFilter implements MessageFilter {

    private final Set<String> allowedTypes;

    public TypeFilter(Collection<String> allowedTypes) {
        this.allowedTypes = Set.copyOf(allowedTypes);
    }

    public Set<String> getAllowedTypes() {
        return allowedTypes;
    }

    @Override
    public boolean accept(OutputMessage message) {
        return allowedTypes.contains(message.data().typeName());
    }
}
