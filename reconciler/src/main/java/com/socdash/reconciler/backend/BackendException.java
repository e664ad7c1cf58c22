package com.socdash.reconciler.backend;

/**
 * Thrown when the response service returns a non-2xx status or is unreachable.
 *
 * statusCode is -1 when no HTTP response was received at all.
 */
public class BackendException extends RuntimeException {

    public static final int NO_RESPONSE = -1;

    private final int statusCode;

    public BackendException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
