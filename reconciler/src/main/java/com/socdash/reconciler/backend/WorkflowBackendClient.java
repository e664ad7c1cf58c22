package com.socdash.reconciler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socdash.reconciler.backend.dto.ActionRequest;
import com.socdash.reconciler.backend.dto.WorkflowStatusResponse;
import com.socdash.reconciler.model.WorkflowAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP client for the response service's workflow endpoints.
 *
 *   GET  /response/workflows/{incidentId}/status   (polled)
 *   POST /response/workflows/{incidentId}/action   (optional control endpoint)
 *
 * Status fetches are asynchronous so that a slow backend never holds up the
 * polling timer. Control commands are blocking; they run on the request
 * thread of whoever triggered them.
 *
 * A 401 is reported like any other non-2xx status. Refreshing the bearer
 * token is the session layer's job, not this client's.
 */
@Component
public class WorkflowBackendClient {

    private static final Logger log = LoggerFactory.getLogger(WorkflowBackendClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final Duration     requestTimeout;

    public WorkflowBackendClient(
            @Value("${socdash.backend.base-url}") String baseUrl,
            @Value("${socdash.backend.token:}") String token,
            @Value("${socdash.backend.request-timeout-ms:10000}") long requestTimeoutMs,
            ObjectMapper objectMapper) {
        this.baseUrl        = stripTrailingSlash(baseUrl);
        this.token          = token;
        this.json           = objectMapper;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    /**
     * Fetch the current status of the workflow attached to an incident.
     *
     * The future completes exceptionally with a {@link BackendException}
     * (possibly wrapped in a CompletionException) on any transport failure,
     * non-2xx status, or unparseable body.
     */
    public CompletableFuture<WorkflowStatusResponse> fetchStatus(String incidentId) {
        String opName = "fetchStatus for incident " + incidentId;
        HttpRequest req = authorized(HttpRequest.newBuilder()
                .uri(workflowUri(incidentId, "status"))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET())
                .build();

        return http.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        throw new CompletionException(new BackendException(opName + " failed", unwrap(err)));
                    }
                    if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                        throw new CompletionException(new BackendException(
                                opName + " failed — HTTP " + resp.statusCode(), resp.statusCode()));
                    }
                    WorkflowStatusResponse parsed;
                    try {
                        parsed = json.readValue(resp.body(), WorkflowStatusResponse.class);
                    } catch (JsonProcessingException e) {
                        throw new CompletionException(
                                new BackendException("Failed to parse " + opName + " response", e));
                    }
                    if (parsed == null) {
                        throw new CompletionException(new BackendException(
                                opName + " returned an empty status body", resp.statusCode()));
                    }
                    return parsed;
                });
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /**
     * Send a control command to the running workflow.
     *
     * @throws BackendException on any failure; {@link BackendException#isNotFound()}
     *         means the backend does not implement the control endpoint
     */
    public void sendAction(String incidentId, WorkflowAction action) {
        String opName = "sendAction " + action.wireValue() + " for incident " + incidentId;
        log.info("Sending workflow action '{}' for incident {}", action.wireValue(), incidentId);
        try {
            HttpRequest req = authorized(HttpRequest.newBuilder()
                    .uri(workflowUri(incidentId, "action"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            json.writeValueAsString(new ActionRequest(action.wireValue())))))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new BackendException(
                        opName + " failed — HTTP " + resp.statusCode() + ": " + resp.body(),
                        resp.statusCode());
            }
        } catch (BackendException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new BackendException(opName + " failed", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private URI workflowUri(String incidentId, String leaf) {
        String id = UriUtils.encodePathSegment(incidentId, StandardCharsets.UTF_8);
        return URI.create(baseUrl + "/response/workflows/" + id + "/" + leaf);
    }

    /** Attach the bearer credential when one is configured. */
    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
