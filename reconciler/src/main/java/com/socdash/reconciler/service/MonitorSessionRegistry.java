package com.socdash.reconciler.service;

import com.socdash.reconciler.backend.WorkflowBackendClient;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Open polling sessions, one per incident being monitored.
 *
 * Each session gets its own single-thread timer; sessions share nothing but
 * the read-only step catalog.
 */
@Service
public class MonitorSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(MonitorSessionRegistry.class);

    private final Map<String, PollingSession> sessions = new ConcurrentHashMap<>();

    private final WorkflowBackendClient client;
    private final StatusReconciler      reconciler;
    private final Duration              interval;
    private final MeterRegistry         meterRegistry;

    public MonitorSessionRegistry(WorkflowBackendClient client,
                                  StatusReconciler reconciler,
                                  @Value("${socdash.polling.interval-ms:3000}") long intervalMs,
                                  MeterRegistry meterRegistry) {
        this.client        = client;
        this.reconciler    = reconciler;
        this.interval      = Duration.ofMillis(intervalMs);
        this.meterRegistry = meterRegistry;
    }

    /** Return the session for an incident, creating and starting it if needed. */
    public PollingSession open(String incidentId) {
        PollingSession session = sessions.computeIfAbsent(incidentId, this::newSession);
        session.start();
        return session;
    }

    public Optional<PollingSession> find(String incidentId) {
        return Optional.ofNullable(sessions.get(incidentId));
    }

    /** @return false if no session was open */
    public boolean close(String incidentId) {
        PollingSession session = sessions.remove(incidentId);
        if (session == null) return false;
        session.close();
        return true;
    }

    public List<String> openIncidents() {
        return sessions.keySet().stream().sorted().toList();
    }

    @PreDestroy
    public void closeAll() {
        if (!sessions.isEmpty()) {
            log.info("Closing {} monitor session(s)", sessions.size());
        }
        sessions.keySet().forEach(this::close);
    }

    private PollingSession newSession(String incidentId) {
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "workflow-poll-" + incidentId);
            t.setDaemon(true);
            return t;
        });
        return new PollingSession(incidentId, client, reconciler, interval, timer, meterRegistry);
    }
}
