package com.medwatch.anomaly.engine.spi;

import com.medwatch.anomaly.exception.PreprocessException;
import com.medwatch.anomaly.model.DataPoint;

import java.util.List;

public interface DataPreprocessor {

    /**
     * Clean and enrich a fetched batch before detection.
     *
     * @throws PreprocessException if the batch cannot be prepared; aborts the batch
     */
    List<DataPoint> preprocess(List<DataPoint> dataPoints);
}
