package com.socdash.reconciler.api;

import com.socdash.reconciler.api.dto.ActionCommand;
import com.socdash.reconciler.api.dto.ActionResponse;
import com.socdash.reconciler.api.dto.MonitorResponse;
import com.socdash.reconciler.model.WorkflowAction;
import com.socdash.reconciler.service.ActionDispatcher;
import com.socdash.reconciler.service.MonitorSessionRegistry;
import com.socdash.reconciler.service.PollingSession;
import com.socdash.reconciler.service.SessionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API behind the incident workflow monitor.
 *
 *   GET    /monitors                         incidents with an open session
 *   POST   /monitors/{incidentId}            open (or reuse) a polling session
 *   GET    /monitors/{incidentId}            current reconciled view
 *   DELETE /monitors/{incidentId}            close the session
 *   POST   /monitors/{incidentId}/actions    advance / skip / cancel the workflow
 */
@RestController
@RequestMapping("/monitors")
public class WorkflowMonitorController {

    private final MonitorSessionRegistry registry;
    private final ActionDispatcher       dispatcher;

    public WorkflowMonitorController(MonitorSessionRegistry registry, ActionDispatcher dispatcher) {
        this.registry   = registry;
        this.dispatcher = dispatcher;
    }

    @GetMapping
    public List<String> openMonitors() {
        return registry.openIncidents();
    }

    /**
     * Open a monitor for an incident.
     * Returns 201 when a new session was started, 200 if one was already open.
     *
     * Example:
     *   curl -X POST http://localhost:8080/monitors/5f0c...
     */
    @PostMapping("/{incidentId}")
    public ResponseEntity<MonitorResponse> open(@PathVariable String incidentId) {
        boolean existed = registry.find(incidentId).isPresent();
        PollingSession session = registry.open(incidentId);
        return ResponseEntity.status(existed ? HttpStatus.OK : HttpStatus.CREATED)
                .body(MonitorResponse.from(session.view()));
    }

    @GetMapping("/{incidentId}")
    public MonitorResponse get(@PathVariable String incidentId) {
        return registry.find(incidentId)
                .map(s -> MonitorResponse.from(s.view()))
                .orElseThrow(() -> notFound(incidentId));
    }

    @DeleteMapping("/{incidentId}")
    public ResponseEntity<Void> close(@PathVariable String incidentId) {
        if (!registry.close(incidentId)) throw notFound(incidentId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Send a control command. Always 200 once dispatched; the outcome kind
     * (SUCCESS / UNSUPPORTED / FAILED) tells the UI what to show.
     *
     * Example:
     *   curl -X POST http://localhost:8080/monitors/5f0c.../actions \
     *     -H "Content-Type: application/json" -d '{"action":"advance"}'
     */
    @PostMapping("/{incidentId}/actions")
    public ActionResponse act(@PathVariable String incidentId, @RequestBody ActionCommand cmd) {
        WorkflowAction action = WorkflowAction.parse(cmd.action())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.BAD_REQUEST, "Unknown action: " + cmd.action()));
        try {
            return ActionResponse.from(dispatcher.dispatch(incidentId, action));
        } catch (SessionNotFoundException e) {
            throw notFound(incidentId);
        }
    }

    private static ResponseStatusException notFound(String incidentId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "No monitor open for incident: " + incidentId);
    }
}
