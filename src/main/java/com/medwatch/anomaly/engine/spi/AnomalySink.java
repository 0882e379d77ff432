package com.medwatch.anomaly.engine.spi;

import com.medwatch.anomaly.exception.AnomalyPersistenceException;
import com.medwatch.anomaly.model.Anomaly;

public interface AnomalySink {

    /**
     * Durably store a normalized anomaly.
     *
     * @throws AnomalyPersistenceException on write failure
     */
    void saveAnomaly(Anomaly anomaly);
}
