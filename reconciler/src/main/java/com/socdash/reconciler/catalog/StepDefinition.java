package com.socdash.reconciler.catalog;

/**
 * A workflow step known in advance: stable key, label for the monitor view,
 * and its position in the canonical chain.
 */
public record StepDefinition(String key, String displayName, int ordinal) {}
