package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.engine.spi.AlertDispatcher;
import com.medwatch.anomaly.event.AnomalyDetectedEvent;
import com.medwatch.anomaly.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Persistence and alert gate for a normalized anomaly.
 *
 * Flow:
 * 1. Hand the anomaly to the persistence service (asynchronous, never awaited).
 *    A rejected hand-off is reported as a persist failure and the flow continues.
 * 2. Publish {@link AnomalyDetectedEvent}
 * 3. Alert exactly once when confidence >= alertThreshold
 */
@Service
public class AnomalyDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDispatchService.class);

    private final AnomalyPersistenceService persistenceService;
    private final AlertDispatcher alertDispatcher;
    private final ApplicationEventPublisher eventPublisher;
    private final AnomalyEngineConfig engineConfig;
    private final MetricsConfig metricsConfig;

    public AnomalyDispatchService(AnomalyPersistenceService persistenceService,
                                  AlertDispatcher alertDispatcher,
                                  ApplicationEventPublisher eventPublisher,
                                  AnomalyEngineConfig engineConfig,
                                  MetricsConfig metricsConfig) {
        this.persistenceService = persistenceService;
        this.alertDispatcher = alertDispatcher;
        this.eventPublisher = eventPublisher;
        this.engineConfig = engineConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @return true if an alert was handed to the dispatcher
     */
    public boolean dispatch(Anomaly anomaly) {
        try {
            persistenceService.persist(anomaly);
        } catch (RuntimeException e) {
            persistenceService.reportFailure(anomaly, e);
        }

        metricsConfig.recordAnomaly(anomaly.getDetectionType(), anomaly.getSeverity());
        eventPublisher.publishEvent(new AnomalyDetectedEvent(anomaly));
        log.info("Anomaly {} [{}] {} for medicine {}: {} (confidence={})",
                anomaly.getAnomalyId(), anomaly.getDetectionType(), anomaly.getSeverity(),
                anomaly.getMedicineDataId(), anomaly.getMessage(), anomaly.getConfidence());

        if (anomaly.getConfidence() < engineConfig.getAlertThreshold()) {
            return false;
        }

        try {
            alertDispatcher.sendAlert(anomaly);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to dispatch alert for anomaly {}", anomaly.getAnomalyId(), e);
            metricsConfig.recordAlert(alertDispatcher.getChannel(), "error");
            return false;
        }
    }
}
