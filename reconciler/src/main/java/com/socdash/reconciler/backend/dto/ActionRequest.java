package com.socdash.reconciler.backend.dto;

/**
 * Request body for POST /response/workflows/{incidentId}/action.
 * action is one of "force_next" | "skip_step" | "cancel".
 */
public record ActionRequest(String action) {}
