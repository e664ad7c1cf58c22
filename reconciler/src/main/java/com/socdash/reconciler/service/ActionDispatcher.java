package com.socdash.reconciler.service;

import com.socdash.reconciler.backend.BackendException;
import com.socdash.reconciler.backend.WorkflowBackendClient;
import com.socdash.reconciler.model.WorkflowAction;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Sends best-effort control commands (advance / skip / cancel) to a running
 * workflow and records the outcome on its polling session.
 *
 * Outcomes:
 *   SUCCESS     → one immediate out-of-band poll so the effect shows up quickly
 *   UNSUPPORTED → backend answered 404: informational, never retried
 *   FAILED      → any other error: shown to the user, never retried
 *
 * Nothing here prevents two dispatches for the same session overlapping;
 * the UI disables the control while a request is outstanding.
 */
@Service
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    static final String UNSUPPORTED_MESSAGE =
            "This action is not available for this workflow backend";

    private final MonitorSessionRegistry registry;
    private final WorkflowBackendClient  client;
    private final MeterRegistry          meterRegistry;

    public ActionDispatcher(MonitorSessionRegistry registry,
                            WorkflowBackendClient client,
                            MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.client        = client;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws SessionNotFoundException if no monitor is open for the incident
     */
    public ActionOutcome dispatch(String incidentId, WorkflowAction action) {
        PollingSession session = registry.find(incidentId)
                .orElseThrow(() -> new SessionNotFoundException(incidentId));

        ActionOutcome outcome;
        try {
            client.sendAction(incidentId, action);
            outcome = new ActionOutcome(action, ActionOutcome.Kind.SUCCESS,
                    "Action '" + action.wireValue() + "' accepted");
        } catch (BackendException e) {
            if (e.isNotFound()) {
                log.info("Workflow backend does not support '{}' for incident {}",
                        action.wireValue(), incidentId);
                outcome = new ActionOutcome(action, ActionOutcome.Kind.UNSUPPORTED, UNSUPPORTED_MESSAGE);
            } else {
                log.warn("Workflow action '{}' failed for incident {}: {}",
                        action.wireValue(), incidentId, e.getMessage());
                outcome = new ActionOutcome(action, ActionOutcome.Kind.FAILED, e.getMessage());
            }
        }

        session.recordAction(outcome);
        meterRegistry.counter("socdash.action.requests",
                "action", action.wireValue(),
                "outcome", outcome.kind().name().toLowerCase(Locale.ROOT)).increment();

        if (outcome.kind() == ActionOutcome.Kind.SUCCESS) {
            session.pollNow();
        }
        return outcome;
    }
}
