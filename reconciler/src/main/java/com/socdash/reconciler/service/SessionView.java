package com.socdash.reconciler.service;

import com.socdash.reconciler.model.WorkflowSnapshot;

/**
 * Consistent read of everything a monitor view renders for one session.
 *
 * snapshot is null until the first fetch succeeds. lastError is the most
 * recent transport error, cleared by the next successful poll.
 */
public record SessionView(
        String           incidentId,
        SessionState     state,
        WorkflowSnapshot snapshot,
        String           lastError,
        ActionOutcome    lastAction
) {}
