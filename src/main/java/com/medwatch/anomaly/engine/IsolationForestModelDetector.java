package com.medwatch.anomaly.engine;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.engine.isolationforest.IsolationForest;
import com.medwatch.anomaly.engine.isolationforest.MedicineFeatureExtractor;
import com.medwatch.anomaly.engine.spi.ModelDetector;
import com.medwatch.anomaly.exception.DetectorLoadException;
import com.medwatch.anomaly.exception.ModelPredictionException;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.ModelPrediction;
import com.medwatch.anomaly.repository.IsolationForestModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

/**
 * Scores data points with a single global Isolation Forest.
 *
 * The forest catches combinations that no single rule flags: a medicine whose stock, price and
 * supplier delay are each borderline but jointly rare across the catalogue.
 *
 * Scoring:
 *   The IF score (0.0 normal to 1.0 anomalous) is used directly as the confidence.
 *   A point is anomalous when its score is strictly above anomaly-engine.model.score-threshold.
 *   Severity is "critical" from 0.85, "high" from 0.7, "medium" below that.
 */
@Component
public class IsolationForestModelDetector implements ModelDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestModelDetector.class);

    private static final int TOP_FEATURES = 3;

    private final IsolationForestModelRepository modelRepository;
    private final AnomalyEngineConfig engineConfig;

    private final AtomicReference<IsolationForest> activeModel = new AtomicReference<>();

    public IsolationForestModelDetector(IsolationForestModelRepository modelRepository,
                                        AnomalyEngineConfig engineConfig) {
        this.modelRepository = modelRepository;
        this.engineConfig = engineConfig;
    }

    @Override
    public boolean loadModels() {
        String modelId = engineConfig.getModel().getModelId();
        IsolationForest forest;
        try {
            forest = modelRepository.load(modelId);
        } catch (DetectorLoadException e) {
            throw e;
        } catch (Exception e) {
            throw new DetectorLoadException("Failed to load IF model " + modelId, e);
        }

        activeModel.set(forest);
        if (forest == null) {
            log.warn("No IF model '{}' trained yet. Model detection will report every point as normal " +
                    "until POST /api/v1/models/train is called.", modelId);
            return false;
        }
        log.info("Loaded IF model '{}' with {} trees", modelId, forest.getTrees().size());
        return true;
    }

    public boolean isModelLoaded() {
        return activeModel.get() != null;
    }

    @Override
    public List<ModelPrediction> predict(List<DataPoint> dataPoints) {
        IsolationForest forest = activeModel.get();
        List<ModelPrediction> predictions = new ArrayList<>(dataPoints.size());
        if (forest == null) {
            for (int i = 0; i < dataPoints.size(); i++) {
                predictions.add(ModelPrediction.normal(0.0));
            }
            return predictions;
        }

        double threshold = engineConfig.getModel().getScoreThreshold();
        try {
            for (DataPoint dataPoint : dataPoints) {
                double[] features = MedicineFeatureExtractor.extract(dataPoint);
                double score = forest.score(features);
                if (score <= threshold) {
                    predictions.add(ModelPrediction.normal(score));
                } else {
                    predictions.add(anomalous(dataPoint, features, score, threshold, forest));
                }
            }
        } catch (RuntimeException e) {
            throw new ModelPredictionException("IF scoring failed", e);
        }
        return predictions;
    }

    private ModelPrediction anomalous(DataPoint dataPoint, double[] features, double score,
                                      double threshold, IsolationForest forest) {
        double[] contributions = forest.featureContributions(features);

        Map<String, Object> featureValues = new LinkedHashMap<>();
        for (int i = 0; i < features.length; i++) {
            featureValues.put(MedicineFeatureExtractor.FEATURE_NAMES[i], round(features[i]));
        }

        List<Map<String, Object>> topFactors = new ArrayList<>();
        for (int idx : topIndices(contributions, TOP_FEATURES)) {
            if (contributions[idx] <= 0) break;
            Map<String, Object> factor = new LinkedHashMap<>();
            factor.put("feature", MedicineFeatureExtractor.FEATURE_NAMES[idx]);
            factor.put("value", round(features[idx]));
            factor.put("contribution", round(contributions[idx]));
            topFactors.add(factor);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("model", "isolation-forest");
        details.put("modelId", engineConfig.getModel().getModelId());
        details.put("score", round(score));
        details.put("threshold", threshold);
        details.put("features", featureValues);
        details.put("topFactors", topFactors);

        String name = dataPoint.getMedicineName() != null ? dataPoint.getMedicineName() : dataPoint.getMedicineId();
        String message = topFactors.isEmpty()
                ? String.format("Unusual supply pattern for %s (score=%.3f)", name, score)
                : String.format("Unusual supply pattern for %s (score=%.3f), driven by %s",
                        name, score, topFactors.get(0).get("feature"));

        return new ModelPrediction(true, score, severityFor(score), message, "supply-pattern", details);
    }

    static String severityFor(double score) {
        if (score >= 0.85) return "critical";
        if (score >= 0.7) return "high";
        return "medium";
    }

    private static int[] topIndices(double[] values, int n) {
        return IntStream.range(0, values.length)
                .boxed()
                .sorted((a, b) -> Double.compare(values[b], values[a]))
                .limit(n)
                .mapToInt(Integer::intValue)
                .toArray();
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
