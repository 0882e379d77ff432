package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.engine.spi.AnomalySink;
import com.medwatch.anomaly.event.AnomalyPersistFailedEvent;
import com.medwatch.anomaly.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Writes anomalies off the batch thread. The batch never waits for, or hears about, a failed write;
 * failures are logged, counted and published as {@link AnomalyPersistFailedEvent}.
 */
@Service
public class AnomalyPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPersistenceService.class);

    private final AnomalySink anomalySink;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsConfig metricsConfig;

    public AnomalyPersistenceService(AnomalySink anomalySink,
                                     ApplicationEventPublisher eventPublisher,
                                     MetricsConfig metricsConfig) {
        this.anomalySink = anomalySink;
        this.eventPublisher = eventPublisher;
        this.metricsConfig = metricsConfig;
    }

    @Async
    public void persist(Anomaly anomaly) {
        try {
            anomalySink.saveAnomaly(anomaly);
            log.debug("Persisted anomaly {} for medicine {}", anomaly.getAnomalyId(), anomaly.getMedicineDataId());
        } catch (RuntimeException e) {
            reportFailure(anomaly, e);
        }
    }

    /**
     * Also called by the dispatcher when the executor rejects the hand-off itself.
     */
    public void reportFailure(Anomaly anomaly, Throwable cause) {
        log.error("Failed to persist anomaly {} for medicine {}",
                anomaly.getAnomalyId(), anomaly.getMedicineDataId(), cause);
        metricsConfig.recordPersistFailure();
        eventPublisher.publishEvent(new AnomalyPersistFailedEvent(anomaly, cause));
    }
}
