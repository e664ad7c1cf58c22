package com.socdash.reconciler.parser;

import java.util.List;

/**
 * Output of {@link StatusSnapshotParser#parse}.
 *
 * structured is false when no payload shape matched and the patches (if any)
 * were derived from the top-level state alone.
 */
public record ParseResult(String topLevelState, List<StepPatch> patches, boolean structured) {

    public ParseResult {
        patches = List.copyOf(patches);
    }

    static ParseResult structured(String state, List<StepPatch> patches) {
        return new ParseResult(state, patches, true);
    }

    static ParseResult unstructured(String state, List<StepPatch> patches) {
        return new ParseResult(state, patches, false);
    }
}
