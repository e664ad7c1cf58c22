package com.socdash.reconciler.api.dto;

import com.socdash.reconciler.service.ActionOutcome;

public record ActionResponse(String action, String kind, String message) {

    public static ActionResponse from(ActionOutcome outcome) {
        if (outcome == null) return null;
        return new ActionResponse(
                outcome.action().wireValue(),
                outcome.kind().name(),
                outcome.message()
        );
    }
}
