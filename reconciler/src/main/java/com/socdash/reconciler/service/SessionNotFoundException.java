package com.socdash.reconciler.service;

public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String incidentId) {
        super("No monitor session open for incident: " + incidentId);
    }
}
