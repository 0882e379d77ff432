package com.medwatch.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger engineRunning;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.engineRunning = registry.gauge("engine.running", new AtomicInteger(0));
    }

    public void recordBatch(String outcome, int dataPointCount, int anomalyCount) {
        Counter.builder("batch.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("batch.size")
                .tag("outcome", outcome)
                .register(registry)
                .record(dataPointCount);

        DistributionSummary.builder("batch.anomalies")
                .register(registry)
                .record(anomalyCount);
    }

    public void recordSkippedTick() {
        Counter.builder("batch.skipped.count")
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String detectionType, String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("detection_type", detectionType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordRuleTriggered(String ruleType) {
        Counter.builder("rule.triggered.count")
                .tag("rule_type", ruleType)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String detector) {
        Counter.builder("detector.failure.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordPersistFailure() {
        Counter.builder("anomaly.persist.failure.count")
                .register(registry)
                .increment();
    }

    public void recordAlert(String channel, String status) {
        Counter.builder("alert.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateEngineRunning(boolean running) {
        engineRunning.set(running ? 1 : 0);
    }
}
