package com.socdash.reconciler.model;

import java.util.List;

/**
 * One step's current observed condition inside a {@link WorkflowSnapshot}.
 *
 * timestamp and duration are passed through exactly as the backend reported
 * them; nothing is computed locally.
 */
public record StepState(
        String       key,
        StepStatus   status,
        String       timestamp,   // nullable
        String       duration,    // nullable
        List<String> logs
) {
    public StepState {
        if (status == null) status = StepStatus.PENDING;
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static StepState pending(String key) {
        return new StepState(key, StepStatus.PENDING, null, null, List.of());
    }

    public StepState withStatus(StepStatus newStatus) {
        return new StepState(key, newStatus, timestamp, duration, logs);
    }
}
