package com.medwatch.anomaly.engine.spi;

import com.medwatch.anomaly.exception.DetectorLoadException;
import com.medwatch.anomaly.exception.ModelPredictionException;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.ModelPrediction;

import java.util.List;

/**
 * Statistical / learned detection, scored over a whole batch at once.
 */
public interface ModelDetector {

    /**
     * Load (or reload) model artifacts.
     *
     * @return true if a usable model is loaded
     * @throws DetectorLoadException if the artifacts exist but cannot be read
     */
    boolean loadModels();

    /**
     * Score a batch.
     *
     * @return one prediction per input data point, in input order
     * @throws ModelPredictionException if scoring fails
     */
    List<ModelPrediction> predict(List<DataPoint> dataPoints);
}
