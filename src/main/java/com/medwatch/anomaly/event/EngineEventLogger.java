package com.medwatch.anomaly.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of engine notifications. Other listeners (dashboards, sockets) subscribe to the same events.
 */
@Component
public class EngineEventLogger {

    private static final Logger log = LoggerFactory.getLogger(EngineEventLogger.class);

    @EventListener
    public void onInitialized(EngineInitializedEvent event) {
        log.info("[engine] initialized at {}: {} rules, model loaded={}",
                event.at(), event.ruleCount(), event.modelsLoaded());
    }

    @EventListener
    public void onError(EngineErrorEvent event) {
        log.error("[engine] error at {}: {}", event.at(), event.cause().getMessage());
    }

    @EventListener
    public void onStarted(EngineStartedEvent event) {
        log.info("[engine] started at {}, interval {}", event.at(), event.processingInterval());
    }

    @EventListener
    public void onStopped(EngineStoppedEvent event) {
        log.info("[engine] stopped at {}", event.at());
    }

    @EventListener
    public void onBatchProcessed(BatchProcessedEvent event) {
        log.info("[engine] batch {} processed: {} data points, outcome {}",
                event.batchRun().getBatchId(), event.batchSize(), event.batchRun().getOutcome());
    }

    @EventListener
    public void onPersistFailed(AnomalyPersistFailedEvent event) {
        log.warn("[engine] anomaly {} was not persisted: {}",
                event.anomaly().getAnomalyId(), event.cause().getMessage());
    }
}
