package com.socdash.reconciler.parser;

import com.socdash.reconciler.model.StepStatus;

import java.util.List;

/**
 * Partial update to one step, produced by {@link StatusSnapshotParser}.
 *
 * status is always applied. timestamp, duration and logs are null when the
 * payload did not supply them, and the merger then keeps the prior value.
 */
public record StepPatch(
        String       key,
        StepStatus   status,
        String       timestamp,
        String       duration,
        List<String> logs
) {
    public StepPatch {
        if (logs != null) logs = List.copyOf(logs);
    }

    public static StepPatch of(String key, StepStatus status) {
        return new StepPatch(key, status, null, null, null);
    }

    public static StepPatch failed(String key, String message) {
        return new StepPatch(key, StepStatus.FAILED, null, null,
                message == null ? null : List.of(message));
    }
}
