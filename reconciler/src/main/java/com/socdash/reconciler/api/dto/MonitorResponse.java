package com.socdash.reconciler.api.dto;

import com.socdash.reconciler.model.WorkflowSnapshot;
import com.socdash.reconciler.service.SessionView;

import java.util.List;

/**
 * Response body for the /monitors endpoints: everything one incident monitor
 * renders.
 *
 * loading is true until the first status fetch has succeeded; in that case
 * steps is empty and topLevelState is null.
 */
public record MonitorResponse(
        String             incidentId,
        String             sessionState,
        boolean            loading,
        String             topLevelState,
        boolean            terminal,
        int                completedSteps,
        int                totalSteps,
        int                progressPercent,
        String             currentStep,
        List<StepResponse> steps,
        String             error,
        ActionResponse     lastAction
) {
    public static MonitorResponse from(SessionView view) {
        WorkflowSnapshot snap = view.snapshot();
        if (snap == null) {
            return new MonitorResponse(view.incidentId(), view.state().name(), true,
                    null, false, 0, 0, 0, null, List.of(),
                    view.lastError(), ActionResponse.from(view.lastAction()));
        }
        return new MonitorResponse(
                view.incidentId(),
                view.state().name(),
                false,
                snap.topLevelState(),
                snap.isTerminal(),
                snap.completedCount(),
                snap.totalCount(),
                snap.progressPercent(),
                snap.currentStep().map(s -> s.key()).orElse(null),
                snap.steps().stream().map(StepResponse::from).toList(),
                view.lastError(),
                ActionResponse.from(view.lastAction())
        );
    }
}
