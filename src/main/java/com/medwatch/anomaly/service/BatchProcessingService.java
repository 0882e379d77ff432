package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.engine.AnomalyNormalizer;
import com.medwatch.anomaly.engine.spi.DataPreprocessor;
import com.medwatch.anomaly.engine.spi.MedicineDataSource;
import com.medwatch.anomaly.engine.spi.ModelDetector;
import com.medwatch.anomaly.engine.spi.RuleDetector;
import com.medwatch.anomaly.event.BatchProcessedEvent;
import com.medwatch.anomaly.exception.ModelPredictionException;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.BatchOutcome;
import com.medwatch.anomaly.model.BatchRun;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.DetectionType;
import com.medwatch.anomaly.model.ModelPrediction;
import com.medwatch.anomaly.model.RawFinding;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Runs one detection batch end to end.
 *
 * Flow:
 * 1. Fetch pending data points (nothing pending ends the batch as EMPTY)
 * 2. Preprocess them (failure ends the batch as FAILED, points stay pending)
 * 3. Rule stage: evaluate every point, confidence 1.0 for critical findings, 0.8 otherwise
 * 4. Model stage: score the whole batch once, one finding per anomalous prediction
 * 5. Normalize and dispatch each finding
 * 6. Acknowledge the fetched points and publish {@link BatchProcessedEvent}
 *
 * A failing data point, model stage or finding is logged and skipped; the batch ends PARTIAL.
 */
@Service
public class BatchProcessingService {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessingService.class);

    static final double CRITICAL_RULE_CONFIDENCE = 1.0;
    static final double RULE_CONFIDENCE = 0.8;

    private final MedicineDataSource dataSource;
    private final DataPreprocessor preprocessor;
    private final RuleDetector ruleDetector;
    private final ModelDetector modelDetector;
    private final AnomalyNormalizer normalizer;
    private final AnomalyDispatchService dispatchService;
    private final ApplicationEventPublisher eventPublisher;
    private final AnomalyEngineConfig engineConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public BatchProcessingService(MedicineDataSource dataSource,
                                  DataPreprocessor preprocessor,
                                  RuleDetector ruleDetector,
                                  ModelDetector modelDetector,
                                  AnomalyNormalizer normalizer,
                                  AnomalyDispatchService dispatchService,
                                  ApplicationEventPublisher eventPublisher,
                                  AnomalyEngineConfig engineConfig,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.dataSource = dataSource;
        this.preprocessor = preprocessor;
        this.ruleDetector = ruleDetector;
        this.modelDetector = modelDetector;
        this.normalizer = normalizer;
        this.dispatchService = dispatchService;
        this.eventPublisher = eventPublisher;
        this.engineConfig = engineConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "anomaly.batch", contextualName = "process-batch")
    public BatchRun processBatch() {
        BatchRun run = BatchRun.builder()
                .batchId(UUID.randomUUID().toString())
                .startedAt(clock.instant())
                .build();

        List<DataPoint> fetched;
        try {
            fetched = dataSource.fetchPendingDataPoints();
        } catch (RuntimeException e) {
            log.error("Batch {} aborted: failed to fetch pending data points", run.getBatchId(), e);
            return complete(run, BatchOutcome.FAILED);
        }

        if (fetched == null || fetched.isEmpty()) {
            log.info("No data points to process");
            return complete(run, BatchOutcome.EMPTY);
        }
        run.setDataPointCount(fetched.size());

        List<DataPoint> prepared;
        try {
            prepared = preprocessor.preprocess(fetched);
        } catch (RuntimeException e) {
            log.error("Batch {} aborted: preprocessing failed for {} data points",
                    run.getBatchId(), fetched.size(), e);
            return complete(run, BatchOutcome.FAILED);
        }

        if (engineConfig.isEnableRuleEngine()) {
            runRuleStage(run, prepared);
        }
        if (engineConfig.isEnableMlModels()) {
            runModelStage(run, prepared);
        }

        try {
            dataSource.acknowledge(fetched);
        } catch (RuntimeException e) {
            log.error("Batch {}: failed to acknowledge {} data points, they will be processed again",
                    run.getBatchId(), fetched.size(), e);
            run.setFailureCount(run.getFailureCount() + 1);
        }

        complete(run, run.getFailureCount() > 0 ? BatchOutcome.PARTIAL : BatchOutcome.SUCCESS);
        eventPublisher.publishEvent(new BatchProcessedEvent(prepared.size(), run));
        log.info("Batch {} processed {} data points: {} anomalies, {} isolated failures",
                run.getBatchId(), prepared.size(), run.getAnomalyCount(), run.getFailureCount());
        return run;
    }

    private void runRuleStage(BatchRun run, List<DataPoint> dataPoints) {
        for (DataPoint dataPoint : dataPoints) {
            List<RawFinding> findings;
            try {
                findings = ruleDetector.evaluate(dataPoint);
            } catch (RuntimeException e) {
                log.error("Rule evaluation failed for medicine {}", dataPoint.getMedicineId(), e);
                metricsConfig.recordDetectorFailure("rule");
                run.setFailureCount(run.getFailureCount() + 1);
                continue;
            }

            for (RawFinding finding : findings) {
                finding.setConfidence("critical".equals(finding.getSeverity())
                        ? CRITICAL_RULE_CONFIDENCE
                        : RULE_CONFIDENCE);
                if (finding.getDataPoint() == null) {
                    finding.setDataPoint(dataPoint);
                }
                handleFinding(run, DetectionType.RULE_BASED, finding);
            }
        }
    }

    private void runModelStage(BatchRun run, List<DataPoint> dataPoints) {
        List<ModelPrediction> predictions;
        try {
            predictions = modelDetector.predict(dataPoints);
            if (predictions == null || predictions.size() != dataPoints.size()) {
                throw new ModelPredictionException(String.format(
                        "Model returned %s predictions for %d data points",
                        predictions == null ? "no" : String.valueOf(predictions.size()), dataPoints.size()));
            }
        } catch (RuntimeException e) {
            log.error("Model detection failed for batch {}", run.getBatchId(), e);
            metricsConfig.recordDetectorFailure("model");
            run.setFailureCount(run.getFailureCount() + 1);
            return;
        }

        for (int i = 0; i < predictions.size(); i++) {
            ModelPrediction prediction = predictions.get(i);
            if (prediction == null || !prediction.isAnomaly()) {
                continue;
            }
            DataPoint dataPoint = dataPoints.get(i);
            RawFinding finding = RawFinding.builder()
                    .severity(prediction.severity())
                    .message(prediction.message())
                    .type(prediction.type())
                    .details(prediction.details())
                    .confidence(prediction.confidence())
                    .causesOfShortages(dataPoint.getCausesOfShortage())
                    .dataPoint(dataPoint)
                    .build();
            handleFinding(run, DetectionType.MODEL_BASED, finding);
        }
    }

    private void handleFinding(BatchRun run, DetectionType detectionType, RawFinding finding) {
        try {
            Anomaly anomaly = normalizer.normalize(detectionType, finding);
            dispatchService.dispatch(anomaly);
            run.setAnomalyCount(run.getAnomalyCount() + 1);
        } catch (RuntimeException e) {
            String medicineId = finding.getDataPoint() != null ? finding.getDataPoint().getMedicineId() : null;
            log.error("Failed to handle {} finding for medicine {}", detectionType.getLabel(), medicineId, e);
            run.setFailureCount(run.getFailureCount() + 1);
        }
    }

    private BatchRun complete(BatchRun run, BatchOutcome outcome) {
        run.setOutcome(outcome);
        run.setCompletedAt(clock.instant());
        metricsConfig.recordBatch(outcome.name(), run.getDataPointCount(), run.getAnomalyCount());
        return run;
    }
}
