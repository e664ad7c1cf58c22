package com.socdash.reconciler.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable reconciled view of one workflow run at one point in time.
 *
 * steps are in catalog order followed by unknown steps in first-seen order.
 * Every merge produces a new instance, so consumers can skip a re-render when
 * the reference they hold is unchanged.
 */
public record WorkflowSnapshot(List<StepState> steps, String topLevelState) {

    private static final Set<String> TERMINAL_STATES = Set.of("SUCCESS", "FAILURE", "REVOKED");

    public WorkflowSnapshot {
        steps = List.copyOf(steps);
    }

    public Optional<StepState> step(String key) {
        return steps.stream().filter(s -> s.key().equals(key)).findFirst();
    }

    /** First step currently running, if any. */
    public Optional<StepState> currentStep() {
        return steps.stream().filter(s -> s.status() == StepStatus.RUNNING).findFirst();
    }

    public int totalCount() {
        return steps.size();
    }

    public int completedCount() {
        return count(StepStatus.COMPLETED);
    }

    public int failedCount() {
        return count(StepStatus.FAILED);
    }

    /** Completed steps as a rounded percentage of all steps; 0 for an empty run. */
    public int progressPercent() {
        if (steps.isEmpty()) return 0;
        return Math.round(completedCount() * 100f / steps.size());
    }

    public boolean isTerminal() {
        return topLevelState != null && TERMINAL_STATES.contains(topLevelState.toUpperCase(Locale.ROOT));
    }

    private int count(StepStatus status) {
        return (int) steps.stream().filter(s -> s.status() == status).count();
    }
}
