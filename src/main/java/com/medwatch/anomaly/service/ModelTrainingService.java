package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.engine.isolationforest.IsolationForest;
import com.medwatch.anomaly.engine.isolationforest.MedicineFeatureExtractor;
import com.medwatch.anomaly.engine.spi.DataPreprocessor;
import com.medwatch.anomaly.engine.spi.ModelDetector;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.repository.IsolationForestModelRepository;
import com.medwatch.anomaly.repository.MedicineDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final MedicineDataRepository medicineDataRepository;
    private final DataPreprocessor preprocessor;
    private final IsolationForestModelRepository modelRepository;
    private final ModelDetector modelDetector;
    private final AnomalyEngineConfig engineConfig;

    public ModelTrainingService(MedicineDataRepository medicineDataRepository,
                                DataPreprocessor preprocessor,
                                IsolationForestModelRepository modelRepository,
                                ModelDetector modelDetector,
                                AnomalyEngineConfig engineConfig) {
        this.medicineDataRepository = medicineDataRepository;
        this.preprocessor = preprocessor;
        this.modelRepository = modelRepository;
        this.modelDetector = modelDetector;
        this.engineConfig = engineConfig;
    }

    /**
     * Train the global model on every stored medicine, persist it and swap it into the detector.
     *
     * @return metadata of the trained model
     * @throws IllegalStateException if there are fewer stored medicines than the configured minimum
     */
    public Map<String, Object> train(int numTrees, int sampleSize) {
        String modelId = engineConfig.getModel().getModelId();
        List<DataPoint> medicines = preprocessor.preprocess(medicineDataRepository.findAll());

        int minSamples = engineConfig.getModel().getMinTrainingSamples();
        if (medicines.size() < minSamples) {
            throw new IllegalStateException(String.format(
                    "Insufficient data to train model %s: %d medicines, at least %d required",
                    modelId, medicines.size(), minSamples));
        }

        log.info("Training IF model {} on {} medicines...", modelId, medicines.size());
        double[][] data = medicines.stream()
                .map(MedicineFeatureExtractor::extract)
                .toArray(double[][]::new);

        IsolationForest forest = IsolationForest.train(data, numTrees, sampleSize, modelId.hashCode());
        modelRepository.save(modelId, forest, data.length);
        modelDetector.loadModels();

        log.info("Trained IF model {}: {} trees, {} samples, {} features",
                modelId, numTrees, data.length, MedicineFeatureExtractor.FEATURE_COUNT);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("modelId", modelId);
        result.put("treeCount", numTrees);
        result.put("sampleSize", forest.getSampleSize());
        result.put("trainingSamples", data.length);
        result.put("featureCount", MedicineFeatureExtractor.FEATURE_COUNT);
        return result;
    }

    public List<Map<String, Object>> listModels() {
        return modelRepository.findAllMetadata();
    }
}
