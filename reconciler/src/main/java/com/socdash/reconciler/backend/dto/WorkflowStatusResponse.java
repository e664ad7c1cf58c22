package com.socdash.reconciler.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response from GET /response/workflows/{incidentId}/status.
 *
 * A running workflow answers {state, info}; before any task exists the
 * service answers {status: "not_started"} instead. info is left as a raw
 * tree because its shape depends on which task last wrote progress.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowStatusResponse(
        String   state,
        String   status,
        JsonNode info      // nullable, any shape
) {
    /** state if present, else the pre-start status, else null. */
    public String effectiveState() {
        if (state != null && !state.isBlank()) return state;
        return status;
    }
}
