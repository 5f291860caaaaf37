package me.golemcore.agent.domain.event;

import me.golemcore.agent.domain.model.OutputMessage;
import me.golemcore.agent.domain.model.PlanMessage;

import java.util.List;

/**
 * Result of translating one backend event: outputs in emission order plus at
 * most one plan update ({@code null} when the event carries no plan).
 */
public record Translation(List<OutputMessage> outputs, PlanMessage plan) {

    private static final Translation EMPTY = new Translation(List.of(), null);

    public Translation {
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public static Translation empty() {
        return EMPTY;
    }

    public static Translation of(OutputMessage output) {
        return new Translation(List.of(output), null);
    }

    public boolean hasPlan() {
        return plan != null;
    }

    public boolean isEmpty() {
        return outputs.isEmpty() && plan == null;
    }
}
