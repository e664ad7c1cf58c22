package com.socdash.reconciler.api.dto;

import com.socdash.reconciler.catalog.StepCatalog;
import com.socdash.reconciler.model.StepState;
import com.socdash.reconciler.model.StepStatus;

import java.util.List;

/**
 * One row of the monitor's step timeline.
 */
public record StepResponse(
        String       key,
        String       displayName,
        boolean      known,       // false for steps not in the catalog
        StepStatus   status,
        String       timestamp,
        String       duration,
        List<String> logs
) {
    public static StepResponse from(StepState s) {
        return new StepResponse(
                s.key(),
                StepCatalog.displayName(s.key()),
                StepCatalog.contains(s.key()),
                s.status(),
                s.timestamp(),
                s.duration(),
                s.logs()
        );
    }
}
