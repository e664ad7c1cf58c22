package com.socdash.reconciler.service;

/**
 * Lifecycle of a {@link PollingSession}.
 *
 * Transitions:
 *   IDLE    → POLLING (start: first fetch issued immediately)
 *   POLLING → STOPPED (close; entered exactly once)
 */
public enum SessionState {
    IDLE,
    POLLING,
    STOPPED
}
