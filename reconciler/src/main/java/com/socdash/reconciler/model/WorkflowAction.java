package com.socdash.reconciler.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Control commands a responder can send to a running workflow.
 * Each maps to the value the control endpoint expects in {@code action}.
 */
public enum WorkflowAction {
    ADVANCE("force_next"),
    SKIP("skip_step"),
    CANCEL("cancel");

    private final String wireValue;

    WorkflowAction(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Accepts either the enum name ("advance") or the wire value ("force_next"). */
    public static Optional<WorkflowAction> parse(String raw) {
        if (raw == null) return Optional.empty();
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(a -> a.name().toLowerCase(Locale.ROOT).equals(value)
                          || a.wireValue.equals(value))
                .findFirst();
    }
}
