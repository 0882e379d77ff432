package com.medwatch.anomaly.event;

import com.medwatch.anomaly.model.Anomaly;

public record AnomalyPersistFailedEvent(Anomaly anomaly, Throwable cause) {}
