package com.socdash.reconciler.service;

import com.socdash.reconciler.model.WorkflowAction;

/**
 * Result of one control command, kept on the session for display.
 *
 * UNSUPPORTED is informational: the backend has no control endpoint.
 */
public record ActionOutcome(WorkflowAction action, Kind kind, String message) {

    public enum Kind {
        SUCCESS,
        UNSUPPORTED,
        FAILED
    }

    public boolean isError() {
        return kind == Kind.FAILED;
    }
}
