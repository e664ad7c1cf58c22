package com.socdash.reconciler.merge;

import com.socdash.reconciler.catalog.StepCatalog;
import com.socdash.reconciler.model.StepState;
import com.socdash.reconciler.model.StepStatus;
import com.socdash.reconciler.model.WorkflowSnapshot;
import com.socdash.reconciler.parser.StepPatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a patch list onto the previous snapshot of a run.
 *
 * Rules:
 *   - no prior snapshot: start from the catalog, every step pending
 *   - known key: status is overwritten; timestamp, duration and logs only
 *     when the patch carries them
 *   - unknown key: appended after everything already present, so unknown
 *     steps keep their first-seen order across polls
 *   - top-level SUCCESS: every step still pending becomes completed
 *
 * Steps are never removed. Inputs are never mutated; every call returns a
 * new snapshot.
 */
public class StepStateMerger {

    private static final String SUCCESS = "SUCCESS";

    private final LogMergeMode logMode;

    public StepStateMerger(LogMergeMode logMode) {
        this.logMode = logMode;
    }

    /** Fresh snapshot with every catalog step pending. */
    public static WorkflowSnapshot initial(String topLevelState) {
        List<StepState> steps = StepCatalog.keys().stream().map(StepState::pending).toList();
        return new WorkflowSnapshot(steps, topLevelState);
    }

    /**
     * @param prior         previous snapshot of this run, or null on the first poll
     * @param patches       patches from the parser, applied in order
     * @param topLevelState the backend's coarse state for this poll
     */
    public WorkflowSnapshot merge(WorkflowSnapshot prior, List<StepPatch> patches, String topLevelState) {
        WorkflowSnapshot base = prior != null ? prior : initial(topLevelState);

        // Insertion order of the map is the display order.
        Map<String, StepState> steps = new LinkedHashMap<>();
        for (StepState s : base.steps()) {
            steps.put(s.key(), s);
        }

        for (StepPatch patch : patches) {
            StepState existing = steps.get(patch.key());
            steps.put(patch.key(), existing == null
                    ? fromPatch(patch)
                    : apply(existing, patch));
        }

        if (SUCCESS.equalsIgnoreCase(topLevelState)) {
            steps.replaceAll((key, s) -> s.status() == StepStatus.PENDING
                    ? s.withStatus(StepStatus.COMPLETED)
                    : s);
        }

        return new WorkflowSnapshot(new ArrayList<>(steps.values()), topLevelState);
    }

    private StepState apply(StepState existing, StepPatch patch) {
        return new StepState(
                existing.key(),
                patch.status(),
                patch.timestamp() != null ? patch.timestamp() : existing.timestamp(),
                patch.duration()  != null ? patch.duration()  : existing.duration(),
                mergeLogs(existing.logs(), patch.logs()));
    }

    private List<String> mergeLogs(List<String> current, List<String> incoming) {
        if (incoming == null) return current;
        if (logMode == LogMergeMode.REPLACE) return incoming;
        List<String> combined = new ArrayList<>(current.size() + incoming.size());
        combined.addAll(current);
        combined.addAll(incoming);
        return combined;
    }

    private static StepState fromPatch(StepPatch patch) {
        return new StepState(patch.key(), patch.status(), patch.timestamp(), patch.duration(), patch.logs());
    }
}
