package com.socdash.reconciler.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The canonical incident-response chain, in execution order.
 *
 * Mirrors the task chain the response service runs:
 *   lookup_ip → quarantine_host → block_ip → enrich_threat_intel → escalate → finalize
 *
 * Read-only and process-wide. The list is not exhaustive: backends may report
 * steps that are not in here, and the merger keeps those after the catalog
 * entries.
 */
public final class StepCatalog {

    private static final List<StepDefinition> STEPS = List.of(
            new StepDefinition("lookup_ip",           "IP Reputation Lookup",       0),
            new StepDefinition("quarantine_host",     "Quarantine Host",            1),
            new StepDefinition("block_ip",            "Block IP at Firewall",       2),
            new StepDefinition("enrich_threat_intel", "Enrich Threat Intelligence", 3),
            new StepDefinition("escalate",            "Conditional Escalation",     4),
            new StepDefinition("finalize",            "Finalize Response",          5)
    );

    private static final Map<String, StepDefinition> BY_KEY = STEPS.stream()
            .collect(Collectors.toUnmodifiableMap(StepDefinition::key, Function.identity()));

    private static final List<String> KEYS = STEPS.stream().map(StepDefinition::key).toList();

    private StepCatalog() {}

    public static List<StepDefinition> definitions() {
        return STEPS;
    }

    /** All catalog keys, in canonical order. */
    public static List<String> keys() {
        return KEYS;
    }

    public static Optional<StepDefinition> get(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }

    public static boolean contains(String key) {
        return BY_KEY.containsKey(key);
    }

    public static StepDefinition first() {
        return STEPS.get(0);
    }

    /** Display name for a step; unknown steps are shown by their raw key. */
    public static String displayName(String key) {
        StepDefinition def = BY_KEY.get(key);
        return def != null ? def.displayName() : key;
    }
}
