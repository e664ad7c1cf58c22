package com.socdash.reconciler.service;

import com.socdash.reconciler.backend.dto.WorkflowStatusResponse;
import com.socdash.reconciler.merge.StepStateMerger;
import com.socdash.reconciler.model.WorkflowSnapshot;
import com.socdash.reconciler.parser.ParseResult;
import com.socdash.reconciler.parser.StatusSnapshotParser;
import org.springframework.stereotype.Component;

/**
 * parse → merge, for one fetched payload.
 *
 * Synchronous and side-effect free; the polling session calls it while
 * holding its own lock.
 */
@Component
public class StatusReconciler {

    private final StatusSnapshotParser parser;
    private final StepStateMerger      merger;

    public StatusReconciler(StatusSnapshotParser parser, StepStateMerger merger) {
        this.parser = parser;
        this.merger = merger;
    }

    /**
     * @param prior    snapshot currently shown for the run, or null before the first poll
     * @param response raw status payload
     * @return a new snapshot; never the same instance as prior
     */
    public WorkflowSnapshot reconcile(WorkflowSnapshot prior, WorkflowStatusResponse response) {
        ParseResult parsed = parser.parse(response.effectiveState(), response.info());
        return merger.merge(prior, parsed.patches(), parsed.topLevelState());
    }
}
