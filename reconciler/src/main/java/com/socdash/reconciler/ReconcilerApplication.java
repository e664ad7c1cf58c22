package com.socdash.reconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Workflow status reconciler for the SOC dashboard.
 *
 * Polls the response service for the progress of incident-response workflows
 * and serves a stable, ordered step view to the monitor screens.
 *
 * To run:
 *   SOCDASH_TOKEN=... mvn -pl reconciler spring-boot:run
 */
@SpringBootApplication
public class ReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconcilerApplication.class, args);
    }
}
