package com.medwatch.anomaly.event;

import com.medwatch.anomaly.model.Anomaly;

public record AnomalyDetectedEvent(Anomaly anomaly) {}
