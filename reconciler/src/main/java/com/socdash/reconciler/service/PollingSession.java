package com.socdash.reconciler.service;

import com.socdash.reconciler.backend.WorkflowBackendClient;
import com.socdash.reconciler.backend.dto.WorkflowStatusResponse;
import com.socdash.reconciler.model.WorkflowSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic status poll for one workflow run (one open incident monitor).
 *
 * A fetch is issued on every tick whether or not the previous one has
 * returned. Each fetch gets a sequence number when it is initiated; a
 * completion older than the snapshot already applied is dropped, so a slow
 * early response can never overwrite newer data.
 *
 * Failed fetches keep the last good snapshot and record the error; polling
 * carries on. After {@link #close()} the timer is cancelled and any fetch
 * still in flight is ignored when it lands.
 *
 * Thread-safety: all mutable state is guarded by {@code this}. Fetch
 * completions arrive on the HTTP client's threads.
 */
public class PollingSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollingSession.class);

    private final String                   incidentId;
    private final WorkflowBackendClient    client;
    private final StatusReconciler         reconciler;
    private final Duration                 interval;
    private final ScheduledExecutorService timer;
    private final MeterRegistry            meterRegistry;

    // guarded by this
    private SessionState       state = SessionState.IDLE;
    private ScheduledFuture<?> tick;
    private long               lastIssuedSeq;
    private long               appliedSeq;
    private long               errorSeq;
    private WorkflowSnapshot   snapshot;
    private String             lastError;
    private ActionOutcome      lastAction;

    /**
     * @param timer owned by this session and shut down on close
     */
    public PollingSession(String incidentId,
                          WorkflowBackendClient client,
                          StatusReconciler reconciler,
                          Duration interval,
                          ScheduledExecutorService timer,
                          MeterRegistry meterRegistry) {
        this.incidentId    = incidentId;
        this.client        = client;
        this.reconciler    = reconciler;
        this.interval      = interval;
        this.timer         = timer;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /** Issue the first fetch now and schedule the rest. No-op unless IDLE. */
    public void start() {
        synchronized (this) {
            if (state != SessionState.IDLE) return;
            state = SessionState.POLLING;
            long periodMs = interval.toMillis();
            tick = timer.scheduleAtFixedRate(this::onTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
        log.info("Started polling workflow status for incident {} every {} ms",
                incidentId, interval.toMillis());
        pollNow();
    }

    /** Cancel the timer; in-flight fetches are discarded when they complete. */
    @Override
    public void close() {
        synchronized (this) {
            if (state == SessionState.STOPPED) return;
            state = SessionState.STOPPED;
            if (tick != null) tick.cancel(false);
        }
        timer.shutdownNow();
        log.info("Stopped polling workflow status for incident {}", incidentId);
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    /**
     * Issue one fetch outside the timer schedule. Used for the initial poll
     * and after a successful control action.
     */
    public void pollNow() {
        long seq;
        synchronized (this) {
            if (state != SessionState.POLLING) return;
            seq = ++lastIssuedSeq;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        CompletableFuture<WorkflowStatusResponse> fetch;
        try {
            fetch = client.fetchStatus(incidentId);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        fetch.whenComplete((response, error) -> {
            sample.stop(meterRegistry.timer("socdash.poll.duration"));
            MDC.put("incidentId", incidentId);
            try {
                onCompleted(seq, response, error);
            } finally {
                MDC.remove("incidentId");
            }
        });
    }

    private void onTick() {
        MDC.put("incidentId", incidentId);
        try {
            pollNow();
        } catch (RuntimeException e) {
            // An exception escaping here would silently cancel the schedule.
            log.error("Unexpected error issuing poll for incident {}: {}", incidentId, e.getMessage(), e);
        } finally {
            MDC.remove("incidentId");
        }
    }

    private synchronized void onCompleted(long seq, WorkflowStatusResponse response, Throwable error) {
        String outcome;
        if (state == SessionState.STOPPED) {
            outcome = "discarded";
        } else if (error != null) {
            if (seq < appliedSeq || seq < errorSeq) {
                outcome = "stale";
            } else {
                lastError = describe(error);
                errorSeq  = seq;
                outcome   = "error";
                log.warn("Workflow status poll #{} failed for incident {}: {}", seq, incidentId, lastError);
            }
        } else if (seq < appliedSeq) {
            outcome = "stale";
            log.debug("Dropping stale status #{} for incident {} (already applied #{})",
                    seq, incidentId, appliedSeq);
        } else {
            try {
                snapshot   = reconciler.reconcile(snapshot, response);
                appliedSeq = seq;
                if (seq > errorSeq) lastError = null;
                outcome = "applied";
                log.debug("Applied status #{} for incident {}: state={} progress={}%",
                        seq, incidentId, snapshot.topLevelState(), snapshot.progressPercent());
            } catch (RuntimeException e) {
                lastError = describe(e);
                errorSeq  = Math.max(errorSeq, seq);
                outcome   = "error";
                log.warn("Could not reconcile status #{} for incident {}: {}", seq, incidentId, lastError, e);
            }
        }
        meterRegistry.counter("socdash.poll.requests", "outcome", outcome).increment();
    }

    // ------------------------------------------------------------------
    // Action results (written by ActionDispatcher)
    // ------------------------------------------------------------------

    public synchronized void recordAction(ActionOutcome outcome) {
        this.lastAction = outcome;
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    public String getIncidentId() {
        return incidentId;
    }

    public synchronized SessionState getState() {
        return state;
    }

    /** Latest applied snapshot, or null before the first successful fetch. */
    public synchronized WorkflowSnapshot getSnapshot() {
        return snapshot;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized ActionOutcome getLastAction() {
        return lastAction;
    }

    public synchronized SessionView view() {
        return new SessionView(incidentId, state, snapshot, lastError, lastAction);
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
