package com.socdash.reconciler.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

/**
 * Observed condition of a single workflow step.
 *
 * Transitions are driven entirely by the backend; the reconciler never
 * advances a step on its own except for the SUCCESS sweep in the merger.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    private static final Set<String> COMPLETED_WORDS =
            Set.of("completed", "complete", "success", "succeeded", "done", "ok");
    private static final Set<String> RUNNING_WORDS =
            Set.of("running", "in_progress", "started", "progress", "active", "retry");
    private static final Set<String> FAILED_WORDS =
            Set.of("failed", "failure", "error", "revoked", "cancelled");

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Normalise a backend status word. Backends disagree on vocabulary
     * ("success" vs "completed", "PROGRESS" vs "running"), so anything
     * unrecognised is treated as pending.
     */
    public static StepStatus fromWire(String raw) {
        if (raw == null) return PENDING;
        String word = raw.trim().toLowerCase(Locale.ROOT);
        if (COMPLETED_WORDS.contains(word)) return COMPLETED;
        if (RUNNING_WORDS.contains(word))   return RUNNING;
        if (FAILED_WORDS.contains(word))    return FAILED;
        return PENDING;
    }
}
