package com.socdash.reconciler.api.dto;

/**
 * Request body for POST /monitors/{incidentId}/actions.
 * action: "advance" | "skip" | "cancel" (or the wire values force_next / skip_step).
 */
public record ActionCommand(String action) {}
