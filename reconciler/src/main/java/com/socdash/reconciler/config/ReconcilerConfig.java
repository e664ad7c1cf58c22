package com.socdash.reconciler.config;

import com.socdash.reconciler.merge.LogMergeMode;
import com.socdash.reconciler.merge.StepStateMerger;
import com.socdash.reconciler.parser.StatusSnapshotParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pure reconciliation pieces with their configured behaviour.
 *
 * The parser and merger themselves have no Spring dependencies.
 */
@Configuration
public class ReconcilerConfig {

    private static final Logger log = LoggerFactory.getLogger(ReconcilerConfig.class);

    @Bean
    StatusSnapshotParser statusSnapshotParser(
            @Value("${socdash.reconciler.first-step-fallback:true}") boolean firstStepFallback) {
        log.info("Status parser: first-step fallback {}", firstStepFallback ? "enabled" : "disabled");
        return new StatusSnapshotParser(firstStepFallback);
    }

    @Bean
    StepStateMerger stepStateMerger(
            @Value("${socdash.reconciler.log-mode:replace}") String logMode) {
        LogMergeMode mode = LogMergeMode.fromConfig(logMode);
        log.info("Step merger: log mode {}", mode);
        return new StepStateMerger(mode);
    }
}
